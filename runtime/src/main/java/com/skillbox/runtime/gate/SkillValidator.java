package com.skillbox.runtime.gate;

import java.nio.file.Path;

/**
 * Decides whether a submission may go live. The vault acts on the verdict
 * only; how a validator reaches it is its own business.
 */
public interface SkillValidator {

    /** Validate a submitted archive, extracting it when it is structurally sound. */
    ValidationOutcome validateArchive(Path archive);

    /** Validate an already-unpacked skill directory. */
    SafetyReport validateDirectory(Path directory);
}
