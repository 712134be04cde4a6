package com.skillbox.runtime.credential;

/** Why the vault refused a redemption. */
public enum DenialReason {
    BLOCKED(CredentialEventType.BLOCKED),
    NOT_FOUND(CredentialEventType.FAILED),
    SKILL_MISMATCH(CredentialEventType.FAILED),
    EXPIRED(CredentialEventType.EXPIRED),
    LIMIT_REACHED(CredentialEventType.LIMIT_REACHED);

    private final CredentialEventType eventType;

    DenialReason(CredentialEventType eventType) {
        this.eventType = eventType;
    }

    public CredentialEventType eventType() {
        return eventType;
    }
}
