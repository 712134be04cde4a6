package com.skillbox.runtime.gate;

import java.nio.file.Path;
import java.util.List;

/**
 * A rejected submission kept for inspection under
 * {@code quarantine/<skill id>/<timestamp>/}.
 */
public record QuarantineRecord(
        String       skillId,
        String       timestamp,
        Path         directory,
        List<String> reasons) {

    public static final String ORIGINAL_ARCHIVE = "original.zip";
    public static final String EXTRACTED_DIR    = "extracted";
    public static final String REPORT_FILE      = "safety_report.json";
    public static final String REASONS_FILE     = "reasons.txt";

    public QuarantineRecord {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
