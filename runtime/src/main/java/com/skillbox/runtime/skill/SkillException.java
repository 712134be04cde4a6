package com.skillbox.runtime.skill;

/**
 * Thrown when a skill operation fails in a way the caller is expected to
 * handle. {@link com.skillbox.runtime.lifecycle.SkillLifecycleManager#useAndKill}
 * converts it into a structured failure, so channels never see it directly.
 *
 * NOT_FOUND, TIMEOUT and EXECUTION_FAILURE are retryable; the others are not.
 */
public class SkillException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,
        TIMEOUT,
        EXECUTION_FAILURE,
        TERMINATION_FAILURE,
        VALIDATION_FAILURE,
        CREDENTIAL_DENIED;

        public boolean retryable() {
            return this == NOT_FOUND || this == TIMEOUT || this == EXECUTION_FAILURE;
        }
    }

    private final Kind   kind;
    private final String detail;

    public SkillException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind   = kind;
        this.detail = message;
    }

    public SkillException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind   = kind;
        this.detail = message;
    }

    public Kind getKind() { return kind; }

    /** The message without the kind prefix. */
    public String getDetail() { return detail; }
}
