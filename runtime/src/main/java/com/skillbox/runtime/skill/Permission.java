package com.skillbox.runtime.skill;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Controlled permission vocabulary a manifest may declare.
 *
 * NETWORK        - sandbox network is reported as allowed; without it (or
 *                  CREDENTIALS) the sandbox runs with network blocked.
 * CREDENTIALS    - the skill may redeem a credential session.
 * DIRECT_ACCESS  - lower-trust mode: a JVM entry runs inside the host
 *                  process with no isolation (device/UI automation).
 */
public enum Permission {
    FS_READ("fs_read"),
    FS_WRITE("fs_write"),
    NETWORK("network"),
    CREDENTIALS("credentials"),
    DIRECT_ACCESS("direct_access");

    private final String wireName;

    Permission(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<Permission> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(p -> p.wireName.equals(normalized))
                .findFirst();
    }
}
