package com.skillbox.runtime.lifecycle;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single outcome reported by an execution.
 *
 * @param result success payload; null on failure
 * @param error  failure message; null on success
 */
public record TerminalResult(
        String  sessionId,
        String  skillId,
        boolean success,
        Object  result,
        String  error,
        Instant timestamp) {

    public static TerminalResult success(String sessionId, String skillId, Object result, Instant at) {
        return new TerminalResult(sessionId, skillId, true, result, null, at);
    }

    public static TerminalResult failure(String sessionId, String skillId, String error, Instant at) {
        return new TerminalResult(sessionId, skillId, false, null,
                error == null || error.isBlank() ? "skill reported failure" : error, at);
    }

    /**
     * Interpret a skill's result map: {@code success} must be {@code true} for
     * a success; otherwise {@code error} (or a generic message) is reported.
     */
    public static TerminalResult fromSkillResult(String sessionId, String skillId,
                                                 Map<String, Object> skillResult, Instant at) {
        if (skillResult == null) {
            return failure(sessionId, skillId, "skill returned no result", at);
        }
        if (Boolean.TRUE.equals(skillResult.get("success"))) {
            return success(sessionId, skillId, skillResult.get("result"), at);
        }
        Object error = skillResult.get("error");
        return failure(sessionId, skillId, error == null ? null : String.valueOf(error), at);
    }

    /** Event payload for {@code agent.result}. */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_id", sessionId);
        payload.put("skill_id", skillId);
        payload.put("success", success);
        if (success) {
            payload.put("result", result);
        } else {
            payload.put("error", error);
        }
        payload.put("timestamp", timestamp.toString());
        return payload;
    }
}
