package com.skillbox.runtime.lifecycle;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.skillbox.runtime.skill.SkillException;

/**
 * Caller-facing outcome of {@link SkillLifecycleManager#useAndKill}.
 * Channels render it directly; it is never replaced by an exception.
 *
 * @param errorKind      null on success
 * @param retryAvailable true when {@link SkillLifecycleManager#retry} accepts {@code sessionId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SkillRunResult(
        boolean            success,
        Object             result,
        String             error,
        SkillException.Kind errorKind,
        String             skill,
        String             sessionId,
        Long               handle,
        double             durationSeconds,
        boolean            retryAvailable) {

    public static SkillRunResult success(String skill, String sessionId, long handle,
                                         Object result, double durationSeconds) {
        return new SkillRunResult(true, result, null, null, skill, sessionId, handle, durationSeconds, false);
    }

    public static SkillRunResult failure(String skill, String sessionId, Long handle, SkillException.Kind kind,
                                         String error, double durationSeconds, boolean retryAvailable) {
        return new SkillRunResult(false, null, error, kind, skill, sessionId, handle, durationSeconds, retryAvailable);
    }

    public static SkillRunResult noRetryAvailable(String sessionId) {
        return new SkillRunResult(false, null, "No retry available for session " + sessionId,
                null, null, sessionId, null, 0.0, false);
    }
}
