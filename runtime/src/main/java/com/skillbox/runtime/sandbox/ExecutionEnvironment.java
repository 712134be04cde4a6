package com.skillbox.runtime.sandbox;

import com.skillbox.runtime.skill.Permission;

import java.nio.file.Path;
import java.util.Set;

/** Per-execution facts exported to a spawned skill through {@code SKILLBOX_*} variables. */
public record ExecutionEnvironment(
        String          skillId,
        String          sessionId,
        String          task,
        String          userId,
        Path            sandboxDir,
        Set<Permission> permissions) {}
