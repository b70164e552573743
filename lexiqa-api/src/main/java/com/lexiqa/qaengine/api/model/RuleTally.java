package com.lexiqa.qaengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Replacement counts contributed by a single rule during a replace run.
 *
 * @param ruleName       rule name
 * @param ruleOrder      rule order
 * @param replacements   spans replaced by this rule across all records
 * @param recordsTouched records in which this rule replaced at least one span
 */
public record RuleTally(
        @JsonProperty("rule_name") String ruleName,
        @JsonProperty("rule_order") int ruleOrder,
        @JsonProperty("replacements") int replacements,
        @JsonProperty("records_touched") int recordsTouched) {
}
