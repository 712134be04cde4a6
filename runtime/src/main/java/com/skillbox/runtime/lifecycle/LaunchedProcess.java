package com.skillbox.runtime.lifecycle;

import com.skillbox.runtime.sandbox.SandboxWorkspace;

import java.util.concurrent.CompletableFuture;

/**
 * A started skill process.
 *
 * @param outputDrained completes once stdout reached EOF, i.e. after any
 *                      terminal message has been handed to the channel
 */
record LaunchedProcess(Process process, SandboxWorkspace workspace, CompletableFuture<Void> outputDrained) {

    boolean isAlive() {
        return process.isAlive() || !outputDrained.isDone();
    }
}
