package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Display metadata of a profile document found on disk.
 *
 * @param path        absolute path of the document
 * @param name        profile name, or the file name when none could be read
 * @param description profile description, possibly empty
 * @param language    language tag, possibly empty
 * @param ruleCount   number of checks, or -1 when the document could not be parsed
 */
public record ProfileInfo(
        @JsonProperty("path") String path,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("language") String language,
        @JsonProperty("rule_count") int ruleCount) {

    public boolean parsed() {
        return ruleCount >= 0;
    }
}
