package com.skillbox.runtime.lifecycle;

import java.time.Duration;

/** What {@link SkillLifecycleManager#spawn} hands back to the caller. */
public record SpawnedExecution(
        long          handle,
        String        sessionId,
        String        skillId,
        ExecutionMode mode,
        Duration      maxLifetime) {}
