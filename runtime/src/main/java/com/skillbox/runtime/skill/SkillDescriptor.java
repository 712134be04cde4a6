package com.skillbox.runtime.skill;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Resolved, runnable view of an installed skill.
 *
 * @param location skill directory, or the single entry file for flat
 *                 user/built-in skills
 * @param entry    entry as declared in the manifest (relative path or
 *                 {@code java:<class>})
 */
public record SkillDescriptor(
        String          id,
        String          name,
        String          version,
        Set<Permission> permissions,
        Path            location,
        String          entry,
        Duration        maxLifetime,
        SkillOrigin     origin) {

    public SkillDescriptor {
        permissions = permissions.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(permissions));
    }

    public static SkillDescriptor fromManifest(SkillManifest manifest, Path directory, SkillOrigin origin) {
        Set<Permission> permissions = EnumSet.noneOf(Permission.class);
        manifest.permissions().forEach(p -> Permission.fromWire(p).ifPresent(permissions::add));
        return new SkillDescriptor(
                manifest.id(),
                manifest.name() != null ? manifest.name() : manifest.id(),
                manifest.version() != null ? manifest.version() : "0",
                permissions,
                directory,
                manifest.entry(),
                Duration.ofSeconds(manifest.maxLifetimeSecOrDefault()),
                origin);
    }

    public boolean has(Permission permission) {
        return permissions.contains(permission);
    }

    public boolean isJvmEntry() {
        return entry != null && entry.startsWith(SkillManifest.JVM_ENTRY_PREFIX);
    }

    public String jvmClassName() {
        if (!isJvmEntry()) {
            throw new IllegalStateException("Skill '" + id + "' has no JVM entry");
        }
        return entry.substring(SkillManifest.JVM_ENTRY_PREFIX.length()).trim();
    }

    public boolean isPackaged() {
        return Files.isDirectory(location);
    }

    /** Path of the entry script inside {@link #location}. Not defined for JVM entries. */
    public Path entryPath() {
        if (isJvmEntry()) {
            throw new IllegalStateException("Skill '" + id + "' has a JVM entry");
        }
        return isPackaged() ? location.resolve(entry).normalize() : location;
    }
}
