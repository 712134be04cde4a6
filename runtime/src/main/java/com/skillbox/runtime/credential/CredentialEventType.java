package com.skillbox.runtime.credential;

import com.fasterxml.jackson.annotation.JsonValue;

/** {@code event_type} values of {@code user.credential_event}. */
public enum CredentialEventType {
    ACCESS("access"),
    FAILED("failed"),
    BLOCKED("blocked"),
    EXPIRED("expired"),
    LIMIT_REACHED("limit_reached");

    private final String wireName;

    CredentialEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
