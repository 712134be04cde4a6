package com.skillbox.runtime.lifecycle;

/**
 * How a skill execution is hosted.
 *
 * ISOLATED_PROCESS - a child OS process in a private sandbox directory with a
 *                    filtered environment. The default for every skill.
 *
 * IN_PROCESS       - a background task inside the host JVM with a synthetic
 *                    handle. No isolation at all; only granted to JVM entries
 *                    whose manifest declares {@code direct_access}.
 */
public enum ExecutionMode {
    ISOLATED_PROCESS,
    IN_PROCESS
}
