package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MessageType {
    @JsonProperty("announce") ANNOUNCE,
    @JsonProperty("query")    QUERY,
    @JsonProperty("response") RESPONSE,
    @JsonProperty("ping")     PING,
    @JsonProperty("pong")     PONG
}
