package com.skillbox.runtime.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * On-disk layout under a single data directory.
 *
 * <pre>
 *   staging/      uploaded archives awaiting validation
 *   live/         promoted skills, one directory per skill id
 *   skills_user/  flat module references to promoted skills
 *   builtin/      skills shipped with the host
 *   quarantine/   rejected submissions, never overwritten
 *   sandbox/      per-execution working directories
 *   output/       files collected from finished executions
 *   work/         scratch space for archive extraction
 * </pre>
 */
public record SkillboxPaths(Path dataDir) {

    public SkillboxPaths {
        dataDir = dataDir.toAbsolutePath().normalize();
    }

    public Path staging()    { return dataDir.resolve("staging"); }
    public Path live()       { return dataDir.resolve("live"); }
    public Path userSkills() { return dataDir.resolve("skills_user"); }
    public Path builtin()    { return dataDir.resolve("builtin"); }
    public Path quarantine() { return dataDir.resolve("quarantine"); }
    public Path sandbox()    { return dataDir.resolve("sandbox"); }
    public Path output()     { return dataDir.resolve("output"); }
    public Path work()       { return dataDir.resolve("work"); }

    public SkillboxPaths ensureDirectories() {
        for (Path dir : List.of(staging(), live(), userSkills(), builtin(), quarantine(), sandbox(), output(), work())) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create " + dir, e);
            }
        }
        return this;
    }
}
