package com.skillbox.runtime.credential;

/** Point-in-time counters for the credential vault. */
public record VaultStats(
        int  activeSessions,
        int  expiredPendingSweep,
        int  blockedSessions,
        long totalStored,
        long totalGranted,
        long totalDenied,
        long totalErased) {}
