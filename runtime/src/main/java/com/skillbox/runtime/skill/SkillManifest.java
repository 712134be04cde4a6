package com.skillbox.runtime.skill;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The {@code manifest.json} shipped with every submitted skill.
 *
 * @param id             unique skill identifier; also the live directory name
 * @param name           display name
 * @param version        free-form version string
 * @param permissions    wire names from {@link Permission}; unknown names are
 *                       kept here and rejected by validation
 * @param entry          relative path of the entry script, or
 *                       {@code java:<fully.qualified.Class>} for a JVM entry
 * @param maxLifetimeSec upper bound for a single execution; null means the default
 * @param description    optional one-line description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SkillManifest(
        String       id,
        String       name,
        String       version,
        List<String> permissions,
        String       entry,
        @JsonProperty("max_lifetime_sec") Integer maxLifetimeSec,
        String       description) {

    public static final String FILE_NAME = "manifest.json";
    public static final String JVM_ENTRY_PREFIX = "java:";
    public static final int DEFAULT_MAX_LIFETIME_SEC = 300;

    public SkillManifest {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public boolean isJvmEntry() {
        return entry != null && entry.startsWith(JVM_ENTRY_PREFIX);
    }

    public int maxLifetimeSecOrDefault() {
        return maxLifetimeSec == null || maxLifetimeSec <= 0 ? DEFAULT_MAX_LIFETIME_SEC : maxLifetimeSec;
    }
}
