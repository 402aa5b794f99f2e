package com.toolfederation.federation.dto;

/** Body of {@code POST /federation/verify}. The signature is recorded as present or absent only. */
public record OwnerVerificationRequest(String serverId, String signature) {}
