package com.skillbox.runtime.gate;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Result of validating an archive.
 *
 * @param extracted  the skill root inside the extracted tree, if extraction got that far
 * @param scratchDir directory the validator extracted into; the caller owns it afterwards
 */
public record ValidationOutcome(SafetyReport report, Path extracted, Path scratchDir) {

    public static ValidationOutcome rejected(SafetyReport report) {
        return new ValidationOutcome(report, null, null);
    }

    public Optional<Path> extractedDir() {
        return Optional.ofNullable(extracted);
    }

    public Optional<Path> scratch() {
        return Optional.ofNullable(scratchDir);
    }
}
