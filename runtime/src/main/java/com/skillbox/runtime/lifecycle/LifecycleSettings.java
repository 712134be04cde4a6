package com.skillbox.runtime.lifecycle;

import java.time.Duration;

/**
 * @param pollInterval  how long a single blocking receive waits before the
 *                      liveness check runs again
 * @param resultCeiling hard bound on any wait, whatever the caller asked for
 * @param killGrace     time a process gets to exit after a polite terminate
 */
public record LifecycleSettings(
        Duration pollInterval,
        Duration resultCeiling,
        Duration killGrace) {

    public static LifecycleSettings defaults() {
        return new LifecycleSettings(Duration.ofMillis(50), Duration.ofSeconds(60), Duration.ofSeconds(5));
    }
}
