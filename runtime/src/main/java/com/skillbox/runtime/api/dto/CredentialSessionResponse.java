package com.skillbox.runtime.api.dto;

/** The opaque session id to hand to the consuming skill. */
public record CredentialSessionResponse(String sessionId, String skillId) {}
