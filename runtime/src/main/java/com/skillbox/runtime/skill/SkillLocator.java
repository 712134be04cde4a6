package com.skillbox.runtime.skill;

import com.skillbox.runtime.config.SkillboxPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Resolves a skill name to a runnable {@link SkillDescriptor}.
 *
 * Lookup order: {@code live/<name>/manifest.json}, then the flat module
 * reference {@code skills_user/<name>.<ext>}, then {@code builtin/}.
 * The first hit wins. Names that are not plain identifiers never resolve.
 */
@Component
public class SkillLocator {

    private static final Logger log = LoggerFactory.getLogger(SkillLocator.class);

    /** Extension of a flat reference whose content is a JVM entry class name. */
    public static final String JVM_REFERENCE_EXTENSION = "jvm";

    private final SkillboxPaths  paths;
    private final ManifestReader manifestReader;

    public SkillLocator(SkillboxPaths paths, ManifestReader manifestReader) {
        this.paths          = paths;
        this.manifestReader = manifestReader;
    }

    public Optional<SkillDescriptor> resolve(String name) {
        if (!ManifestReader.isValidSkillName(name)) {
            log.debug("Rejecting malformed skill name '{}'", name);
            return Optional.empty();
        }
        return fromPackage(paths.live().resolve(name), SkillOrigin.LIVE)
                .or(() -> fromFlatReference(paths.userSkills(), name, SkillOrigin.USER))
                .or(() -> fromPackage(paths.builtin().resolve(name), SkillOrigin.BUILTIN))
                .or(() -> fromFlatReference(paths.builtin(), name, SkillOrigin.BUILTIN));
    }

    /** Names resolvable by {@link #resolve}, sorted. */
    public SortedSet<String> listAvailable() {
        SortedSet<String> names = new TreeSet<>();
        for (Path root : List.of(paths.live(), paths.userSkills(), paths.builtin())) {
            for (Path child : children(root)) {
                String fileName = child.getFileName().toString();
                if (Files.isRegularFile(child.resolve(SkillManifest.FILE_NAME))) {
                    names.add(fileName);
                } else if (Files.isRegularFile(child) && isFlatReference(child)) {
                    names.add(fileName.substring(0, fileName.lastIndexOf('.')));
                }
            }
        }
        names.removeIf(n -> !ManifestReader.isValidSkillName(n));
        return names;
    }

    private Optional<SkillDescriptor> fromPackage(Path dir, SkillOrigin origin) {
        Path manifestFile = dir.resolve(SkillManifest.FILE_NAME);
        if (!Files.isRegularFile(manifestFile)) {
            return Optional.empty();
        }
        try {
            SkillManifest manifest = manifestReader.read(manifestFile);
            return Optional.of(SkillDescriptor.fromManifest(manifest, dir, origin));
        } catch (SkillException e) {
            log.warn("Ignoring {} skill at {}: {}", origin, dir, e.getDetail());
            return Optional.empty();
        }
    }

    private Optional<SkillDescriptor> fromFlatReference(Path root, String name, SkillOrigin origin) {
        Path jvmRef = root.resolve(name + "." + JVM_REFERENCE_EXTENSION);
        if (Files.isRegularFile(jvmRef)) {
            try {
                String className = Files.readString(jvmRef, StandardCharsets.UTF_8).trim();
                return Optional.of(flat(name, jvmRef, SkillManifest.JVM_ENTRY_PREFIX + className, origin));
            } catch (IOException e) {
                log.warn("Cannot read JVM reference {}: {}", jvmRef, e.getMessage());
                return Optional.empty();
            }
        }
        for (ScriptRuntime runtime : ScriptRuntime.values()) {
            Path script = root.resolve(name + "." + runtime.extension());
            if (Files.isRegularFile(script)) {
                return Optional.of(flat(name, script, script.getFileName().toString(), origin));
            }
        }
        return Optional.empty();
    }

    private static SkillDescriptor flat(String name, Path file, String entry, SkillOrigin origin) {
        return new SkillDescriptor(name, name, "0", Set.of(), file, entry,
                Duration.ofSeconds(SkillManifest.DEFAULT_MAX_LIFETIME_SEC), origin);
    }

    private static boolean isFlatReference(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.endsWith("." + JVM_REFERENCE_EXTENSION) || ScriptRuntime.forFile(file).isPresent();
    }

    private static List<Path> children(Path root) {
        List<Path> result = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return result;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root)) {
            stream.forEach(result::add);
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", root, e.getMessage());
        }
        return result;
    }
}
