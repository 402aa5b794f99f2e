package com.toolfederation.federation.dto;

/** Body of {@code POST /federation/report}. {@code reporter} is optional. */
public record ServerReportRequest(String serverId, String reason, String reporter) {}
