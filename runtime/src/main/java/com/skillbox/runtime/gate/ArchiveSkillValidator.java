package com.skillbox.runtime.gate;

import com.skillbox.runtime.config.SkillboxPaths;
import com.skillbox.runtime.sandbox.Capability;
import com.skillbox.runtime.skill.ManifestReader;
import com.skillbox.runtime.skill.Permission;
import com.skillbox.runtime.skill.ScriptRuntime;
import com.skillbox.runtime.skill.SkillException;
import com.skillbox.runtime.skill.SkillManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Default structural validator.
 *
 * <ol>
 *   <li>Archive limits: size, entry count, uncompressed size, and no absolute
 *       or {@code ..} entry names. Nothing is extracted if these fail.</li>
 *   <li>Extraction into a scratch directory, enforcing the uncompressed limit
 *       on the bytes actually written.</li>
 *   <li>Manifest: present, parseable, required fields, known permissions.</li>
 *   <li>Entry point present and runnable.</li>
 *   <li>Source scan: forbidden capabilities are always rejected; network use
 *       needs the {@code network} permission.</li>
 * </ol>
 * Each problem becomes one reason; a report fails if it has any.
 */
@Component
public class ArchiveSkillValidator implements SkillValidator {

    private static final Logger log = LoggerFactory.getLogger(ArchiveSkillValidator.class);

    private static final Set<String> SCANNED_SUFFIXES = Set.of(".py", ".sh", ".js", ".java");
    private static final int MAX_SCAN_DEPTH = 8;

    private final GateSettings   settings;
    private final ManifestReader manifestReader;
    private final SkillboxPaths  paths;

    public ArchiveSkillValidator(GateSettings settings, ManifestReader manifestReader, SkillboxPaths paths) {
        this.settings       = settings;
        this.manifestReader = manifestReader;
        this.paths          = paths;
    }

    // ------------------------------------------------------------------
    // Archives
    // ------------------------------------------------------------------

    @Override
    public ValidationOutcome validateArchive(Path archive) {
        if (archive == null || !Files.isRegularFile(archive)) {
            return ValidationOutcome.rejected(SafetyReport.failed("archive not found: " + archive));
        }
        if (!archive.getFileName().toString().toLowerCase().endsWith(".zip")) {
            return ValidationOutcome.rejected(SafetyReport.failed("archive must be a .zip file"));
        }

        List<String> reasons = new ArrayList<>();
        try {
            if (Files.size(archive) > settings.maxArchiveBytes()) {
                reasons.add("archive exceeds " + settings.maxArchiveBytes() + " bytes");
            }
            try (ZipFile zip = new ZipFile(archive.toFile())) {
                inspectEntries(zip, reasons);
                if (!reasons.isEmpty()) {
                    return ValidationOutcome.rejected(SafetyReport.failed(null, null, null, List.of(), reasons));
                }
                Path scratch = Files.createDirectories(paths.work().resolve(UUID.randomUUID().toString()));
                try {
                    extract(zip, scratch);
                } catch (IOException e) {
                    return new ValidationOutcome(
                            SafetyReport.failed("extraction failed: " + e.getMessage()), null, scratch);
                }
                Path skillRoot = locateSkillRoot(scratch);
                SafetyReport report = validateDirectory(skillRoot);
                return new ValidationOutcome(report, skillRoot, scratch);
            }
        } catch (ZipException e) {
            return ValidationOutcome.rejected(SafetyReport.failed("archive is not a readable zip: " + e.getMessage()));
        } catch (IOException e) {
            log.warn("Could not read archive {}: {}", archive, e.getMessage());
            return ValidationOutcome.rejected(SafetyReport.failed("archive unreadable: " + e.getMessage()));
        }
    }

    private void inspectEntries(ZipFile zip, List<String> reasons) {
        if (zip.size() > settings.maxEntries()) {
            reasons.add("archive has " + zip.size() + " entries (max " + settings.maxEntries() + ")");
        }
        long declared = 0;
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            String name = entry.getName().replace('\\', '/');
            if (name.startsWith("/") || name.matches("^[A-Za-z]:.*")) {
                reasons.add("absolute path in archive: " + entry.getName());
            }
            for (String segment : name.split("/")) {
                if (segment.equals("..")) {
                    reasons.add("path traversal in archive: " + entry.getName());
                    break;
                }
            }
            if (entry.getSize() > 0) {
                declared += entry.getSize();
            }
        }
        if (declared > settings.maxUncompressedBytes()) {
            reasons.add("archive expands to " + declared + " bytes (max " + settings.maxUncompressedBytes() + ")");
        }
    }

    private void extract(ZipFile zip, Path target) throws IOException {
        long written = 0;
        byte[] buffer = new byte[8192];
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            Path destination = target.resolve(entry.getName().replace('\\', '/')).normalize();
            if (!destination.startsWith(target)) {
                throw new IOException("entry escapes extraction directory: " + entry.getName());
            }
            if (entry.isDirectory()) {
                Files.createDirectories(destination);
                continue;
            }
            Files.createDirectories(destination.getParent());
            try (InputStream in = zip.getInputStream(entry);
                 OutputStream out = Files.newOutputStream(destination)) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    written += read;
                    if (written > settings.maxUncompressedBytes()) {
                        throw new IOException("archive expands beyond " + settings.maxUncompressedBytes() + " bytes");
                    }
                    out.write(buffer, 0, read);
                }
            }
        }
    }

    /** Archives may wrap the skill in a single top-level directory. */
    private static Path locateSkillRoot(Path scratch) throws IOException {
        if (Files.isRegularFile(scratch.resolve(SkillManifest.FILE_NAME))) {
            return scratch;
        }
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(scratch)) {
            stream.forEach(children::add);
        }
        if (children.size() == 1 && Files.isDirectory(children.get(0))
                && Files.isRegularFile(children.get(0).resolve(SkillManifest.FILE_NAME))) {
            return children.get(0);
        }
        return scratch;
    }

    // ------------------------------------------------------------------
    // Directories
    // ------------------------------------------------------------------

    @Override
    public SafetyReport validateDirectory(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return SafetyReport.failed("skill directory not found: " + directory);
        }
        Path manifestFile = directory.resolve(SkillManifest.FILE_NAME);
        if (!Files.isRegularFile(manifestFile)) {
            return SafetyReport.failed("manifest.json missing");
        }

        SkillManifest manifest;
        try {
            manifest = manifestReader.read(manifestFile);
        } catch (SkillException e) {
            return SafetyReport.failed(e.getDetail());
        }

        List<String> reasons = new ArrayList<>(manifestReader.problems(manifest));
        if (!manifest.isJvmEntry() && manifest.entry() != null && !manifest.entry().isBlank()) {
            Path entry = directory.resolve(manifest.entry()).normalize();
            if (!entry.startsWith(directory) || !Files.isRegularFile(entry)) {
                reasons.add("missing entry point");
            } else if (ScriptRuntime.forFile(entry).isEmpty()) {
                reasons.add("unsupported entry type: " + entry.getFileName());
            }
        }
        reasons.addAll(scanSources(directory, manifest));

        if (reasons.isEmpty()) {
            log.info("Skill {} v{} passed validation", manifest.id(), manifest.version());
            return SafetyReport.passed(manifest.id(), manifest.name(), manifest.version(), manifest.permissions());
        }
        log.warn("Skill {} failed validation: {}", manifest.id(), reasons);
        return SafetyReport.failed(manifest.id(), manifest.name(), manifest.version(), manifest.permissions(), reasons);
    }

    private List<String> scanSources(Path directory, SkillManifest manifest) {
        boolean networkDeclared = manifest.permissions().stream()
                .anyMatch(p -> Permission.fromWire(p).orElse(null) == Permission.NETWORK);
        List<String> reasons = new ArrayList<>();
        List<Path> sources;
        try (Stream<Path> files = Files.walk(directory, MAX_SCAN_DEPTH)) {
            sources = files.filter(Files::isRegularFile).filter(ArchiveSkillValidator::isScanned).sorted().toList();
        } catch (IOException e) {
            reasons.add("could not scan sources: " + e.getMessage());
            return reasons;
        }

        for (Path source : sources) {
            String text;
            try {
                text = Files.readString(source, StandardCharsets.UTF_8);
            } catch (IOException e) {
                reasons.add("unreadable source " + directory.relativize(source) + ": " + e.getMessage());
                continue;
            }
            String relative = directory.relativize(source).toString();
            for (Capability capability : Capability.values()) {
                if (capability == Capability.RAW_SOCKET && networkDeclared) {
                    continue;
                }
                for (String marker : capability.markers()) {
                    if (text.contains(marker)) {
                        reasons.add(capability == Capability.RAW_SOCKET
                                ? "network access without 'network' permission in " + relative + " ('" + marker.trim() + "')"
                                : "forbidden construct '" + marker.trim() + "' (" + capability.wireName() + ") in " + relative);
                        break;
                    }
                }
            }
        }
        return reasons;
    }

    private static boolean isScanned(Path file) {
        String name = file.getFileName().toString();
        return SCANNED_SUFFIXES.stream().anyMatch(name::endsWith);
    }
}
