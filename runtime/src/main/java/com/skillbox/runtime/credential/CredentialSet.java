package com.skillbox.runtime.credential;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Secrets issued to one skill under one session id.
 *
 * Values are held as {@code char[]} so they can be overwritten in place;
 * {@link #erase} leaves nothing recoverable in this object. Not thread-safe:
 * the vault serialises all access.
 */
final class CredentialSet {

    private final String  skillId;
    private final String  sessionId;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final Map<String, char[]> secrets = new LinkedHashMap<>();

    private boolean used;
    private int     accessCount;

    CredentialSet(String skillId, String sessionId, Map<String, String> credentials,
                  Instant createdAt, Instant expiresAt) {
        this.skillId   = skillId;
        this.sessionId = sessionId;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        credentials.forEach((k, v) -> secrets.put(k, v == null ? new char[0] : v.toCharArray()));
    }

    String skillId()     { return skillId; }
    String sessionId()   { return sessionId; }
    Instant createdAt()  { return createdAt; }
    Instant expiresAt()  { return expiresAt; }
    boolean used()       { return used; }
    int accessCount()    { return accessCount; }

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /** Record a successful redemption and return a detached copy of the secrets. */
    Map<String, String> redeem() {
        accessCount++;
        used = true;
        Map<String, String> copy = new HashMap<>();
        secrets.forEach((k, v) -> copy.put(k, new String(v)));
        return copy;
    }

    /** Overwrite every value with random characters, then zeros, then drop them. */
    void erase(SecureRandom random) {
        for (char[] value : secrets.values()) {
            for (int i = 0; i < value.length; i++) {
                value[i] = (char) (' ' + random.nextInt(95));
            }
            Arrays.fill(value, '\0');
        }
        secrets.clear();
    }

    boolean isErased() {
        return secrets.isEmpty();
    }
}
