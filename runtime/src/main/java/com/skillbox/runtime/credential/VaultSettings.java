package com.skillbox.runtime.credential;

import java.time.Duration;

/**
 * Limits enforced by the {@link CredentialVault}.
 *
 * @param maxTtl             hard upper bound on any session's lifetime
 * @param defaultTtl         TTL used when the caller does not request one
 * @param maxAccesses        successful redemptions allowed per session
 * @param maxFailedAttempts  failures after which a session id is blocked
 * @param tombstoneRetention how long an erased session id keeps its denial reason, and an idle failure counter is kept
 */
public record VaultSettings(
        Duration maxTtl,
        Duration defaultTtl,
        int      maxAccesses,
        int      maxFailedAttempts,
        Duration tombstoneRetention) {

    public VaultSettings {
        if (maxTtl.isNegative() || maxTtl.isZero()) {
            throw new IllegalArgumentException("maxTtl must be positive");
        }
        if (maxAccesses < 1 || maxFailedAttempts < 1) {
            throw new IllegalArgumentException("access and failure limits must be positive");
        }
    }

    public static VaultSettings defaults() {
        return new VaultSettings(Duration.ofMinutes(10), Duration.ofMinutes(5), 10, 3, Duration.ofHours(1));
    }
}
