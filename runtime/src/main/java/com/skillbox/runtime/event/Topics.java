package com.skillbox.runtime.event;

/**
 * Topic names published on the {@link EventBus}.
 *
 * Payload fields are snake_case so that external channels can consume them
 * without a mapping layer.
 */
public final class Topics {

    /** Catch-all subscription: handlers receive every event. */
    public static final String WILDCARD = "*";

    /** {handle, skill_id, session_id, mode} */
    public static final String AGENT_SPAWNED = "agent.spawned";

    /** {session_id, skill_id, success, result | error, timestamp} */
    public static final String AGENT_RESULT = "agent.result";

    /** {handle, session_id, skill_id} */
    public static final String AGENT_KILLED = "agent.killed";

    /** {session_id, skill_id, original_error, timestamp} */
    public static final String SKILL_RETRY_AVAILABLE = "skill.retry_available";

    /** {session_id}; consumed by the lifecycle manager. */
    public static final String SKILL_RETRY_REQUEST = "skill.retry_request";

    /** {skill_id, location} */
    public static final String SKILL_INSTALLED = "skill.installed";

    /** {skill_id, quarantine_dir, reasons} */
    public static final String SKILL_QUARANTINED = "skill.quarantined";

    /** {user_id, skill_id, event_type, message, timestamp} */
    public static final String CREDENTIAL_EVENT = "user.credential_event";

    private Topics() {}
}
