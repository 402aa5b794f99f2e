package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RegistrationResult(
    @JsonProperty("success")  boolean success,
    @JsonProperty("serverId") String serverId
) {
    public static RegistrationResult registered(String serverId) {
        return new RegistrationResult(true, serverId);
    }
}
