package com.skillbox.runtime.lifecycle;

import java.time.Instant;

/** Read-only view of a tracked execution. */
public record ExecutionSnapshot(
        long          handle,
        String        skillId,
        String        sessionId,
        ExecutionMode mode,
        Instant       spawnedAt,
        long          maxLifetimeSec,
        boolean       alive) {}
