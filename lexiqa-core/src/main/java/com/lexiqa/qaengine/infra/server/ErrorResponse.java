package com.lexiqa.qaengine.infra.server;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(@JsonProperty("error") String error, @JsonProperty("kind") String kind) {
}
