package com.skillbox.runtime.gate;

import java.nio.file.Path;

/**
 * Outcome of an install attempt.
 *
 * @param location the live directory on success, the quarantine directory
 *                 when quarantined, null when rejected
 */
public record InstallResult(SubmissionState state, SafetyReport report, Path location) {

    public static InstallResult live(SafetyReport report, Path liveDir) {
        return new InstallResult(SubmissionState.LIVE, report, liveDir);
    }

    public static InstallResult quarantined(SafetyReport report, Path quarantineDir) {
        return new InstallResult(SubmissionState.QUARANTINED, report, quarantineDir);
    }

    public static InstallResult rejected(SafetyReport report) {
        return new InstallResult(SubmissionState.REJECTED, report, null);
    }

    public boolean ok() {
        return state == SubmissionState.LIVE;
    }
}
