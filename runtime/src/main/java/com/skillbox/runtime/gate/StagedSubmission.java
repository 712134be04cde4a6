package com.skillbox.runtime.gate;

import java.nio.file.Path;
import java.time.Instant;

/** An uploaded archive copied into the staging area. */
public record StagedSubmission(
        Path    archive,
        String  submitterId,
        String  originalName,
        Instant stagedAt) {}
