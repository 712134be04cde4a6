package com.skillbox.runtime.lifecycle;

import com.skillbox.runtime.skill.SkillDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Spots source markers of device or desktop automation.
 *
 * Advisory only: a substring scan is trivially evaded, so it never grants
 * in-process execution. The manager uses it to warn when a skill looks like
 * it needs {@code direct_access} but has not declared it.
 */
@Component
public class DirectAccessDetector {

    private static final Logger log = LoggerFactory.getLogger(DirectAccessDetector.class);

    static final List<String> MARKERS = List.of(
            "pyautogui", "pywinauto", "win32api", "win32gui", "win32con", "ctypes.wintypes",
            "java.awt.Robot", "javax.swing", "xdotool");

    private static final long MAX_SCANNED_BYTES = 1024 * 1024;
    private static final Set<String> SOURCE_SUFFIXES = Set.of(".py", ".sh", ".js", ".java");

    public Set<String> scan(SkillDescriptor skill) {
        Set<String> found = new TreeSet<>();
        if (!skill.isPackaged()) {
            scanFile(skill.location(), found);
            return found;
        }
        try (Stream<Path> files = Files.walk(skill.location(), 4)) {
            files.filter(Files::isRegularFile)
                    .filter(DirectAccessDetector::isSource)
                    .forEach(f -> scanFile(f, found));
        } catch (IOException e) {
            log.warn("Could not scan {} for direct-access markers: {}", skill.location(), e.getMessage());
        }
        return found;
    }

    private static boolean isSource(Path file) {
        String name = file.getFileName().toString();
        return SOURCE_SUFFIXES.stream().anyMatch(name::endsWith);
    }

    private static void scanFile(Path file, Set<String> found) {
        try {
            if (Files.size(file) > MAX_SCANNED_BYTES) {
                return;
            }
            String source = Files.readString(file, StandardCharsets.UTF_8);
            MARKERS.stream().filter(source::contains).forEach(found::add);
        } catch (IOException e) {
            log.debug("Skipping {}: {}", file, e.getMessage());
        }
    }
}
