package com.toolfederation.federation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String serverId) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
