package com.skillbox.runtime.gate;

/**
 * Archive submissions move STAGED → VALIDATING → LIVE | QUARANTINED.
 * Prepared directories skip staging and end LIVE or REJECTED (no quarantine).
 */
public enum SubmissionState {
    STAGED,
    VALIDATING,
    LIVE,
    QUARANTINED,
    REJECTED
}
