package com.skillbox.runtime.skill;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** Interpreters used to run script entries in a child process, keyed by file extension. */
public enum ScriptRuntime {
    SHELL("sh", "/bin/sh"),
    PYTHON("py", "python3", "-I"),
    NODE("js", "node");

    private final String       extension;
    private final List<String> launcher;

    ScriptRuntime(String extension, String... launcher) {
        this.extension = extension;
        this.launcher  = List.of(launcher);
    }

    public String extension() {
        return extension;
    }

    public List<String> command(Path script) {
        List<String> command = new ArrayList<>(launcher);
        command.add(script.toString());
        return command;
    }

    public static Optional<ScriptRuntime> forFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String ext = name.substring(dot + 1).toLowerCase();
        return Arrays.stream(values()).filter(r -> r.extension.equals(ext)).findFirst();
    }
}
