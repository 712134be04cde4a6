package com.skillbox.runtime.gate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbox.runtime.config.SkillboxPaths;
import com.skillbox.runtime.event.EventBus;
import com.skillbox.runtime.event.Topics;
import com.skillbox.runtime.skill.ManifestReader;
import com.skillbox.runtime.skill.ScriptRuntime;
import com.skillbox.runtime.skill.SkillDescriptor;
import com.skillbox.runtime.skill.SkillException;
import com.skillbox.runtime.skill.SkillLocator;
import com.skillbox.runtime.skill.SkillManifest;
import com.skillbox.runtime.skill.SkillOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns untrusted submissions into live skills.
 *
 * <pre>
 *   stage()  →  validateAndInstall()  →  live/&lt;id&gt;/ + skills_user/&lt;id&gt;.&lt;ext&gt;
 *                                   ↘  quarantine/&lt;id&gt;/&lt;timestamp&gt;/
 * </pre>
 *
 * Rejections are never retried. Quarantine records are never overwritten:
 * each rejection gets its own directory even within the same millisecond.
 */
@Service
public class SkillVault {

    private static final Logger log = LoggerFactory.getLogger(SkillVault.class);

    private static final String SENDER = "skill-vault";
    private static final String UNKNOWN_SKILL = "unknown";
    private static final DateTimeFormatter QUARANTINE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private static final AtomicLong STAGING_SEQUENCE = new AtomicLong();

    private final SkillboxPaths  paths;
    private final SkillValidator validator;
    private final ManifestReader manifestReader;
    private final EventBus       eventBus;
    private final ObjectMapper   objectMapper;
    private final Clock          clock;

    public SkillVault(SkillboxPaths paths, SkillValidator validator, ManifestReader manifestReader,
                      EventBus eventBus, ObjectMapper objectMapper, Clock clock) {
        this.paths          = paths;
        this.validator      = validator;
        this.manifestReader = manifestReader;
        this.eventBus       = eventBus;
        this.objectMapper   = objectMapper;
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // Staging
    // ------------------------------------------------------------------

    /** Copy an archive into {@code staging/submitter_<id>/} under a unique name. */
    public StagedSubmission stage(Path archive, String submitterId) {
        try (InputStream in = Files.newInputStream(archive)) {
            return stage(in, archive.getFileName().toString(), submitterId);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot stage " + archive, e);
        }
    }

    public StagedSubmission stage(InputStream archive, String fileName, String submitterId) {
        Instant now = clock.instant();
        String safeName = sanitize(fileName == null ? "skill.zip" : Path.of(fileName).getFileName().toString());
        Path dir = paths.staging().resolve("submitter_" + sanitize(submitterId));
        Path target = dir.resolve(now.toEpochMilli() + "-" + STAGING_SEQUENCE.incrementAndGet() + "-" + safeName);
        try {
            Files.createDirectories(dir);
            Files.copy(archive, target);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot stage " + fileName, e);
        }
        log.info("Staged {} from submitter {} as {}", fileName, submitterId, target.getFileName());
        return new StagedSubmission(target, submitterId, fileName, now);
    }

    // ------------------------------------------------------------------
    // Validate and promote
    // ------------------------------------------------------------------

    /**
     * Validate a staged archive and either promote it to live or quarantine it.
     * Never throws; the verdict is in the result. A failure after promotion
     * restores the previous live version.
     */
    public InstallResult validateAndInstall(StagedSubmission staged) {
        log.info("Validating {} ({})", staged.originalName(), SubmissionState.VALIDATING);
        ValidationOutcome outcome;
        try {
            outcome = validator.validateArchive(staged.archive());
        } catch (RuntimeException e) {
            log.error("Validator failed on {}: {}", staged.archive(), e.getMessage(), e);
            outcome = ValidationOutcome.rejected(SafetyReport.failed("validator error: " + describe(e)));
        }

        try {
            return install(staged, outcome);
        } catch (IOException | RuntimeException e) {
            log.error("Install of {} failed: {}", staged.archive(), e.getMessage(), e);
            SafetyReport failed = outcome.report().failedWith("install failed: " + describe(e));
            try {
                return quarantine(staged, outcome.extractedDir().orElse(null), failed);
            } catch (IOException | RuntimeException q) {
                log.error("Could not quarantine {}: {}", staged.archive(), q.getMessage(), q);
                return InstallResult.rejected(failed.withReason("quarantine failed: " + describe(q)));
            }
        } finally {
            outcome.scratch().ifPresent(SkillVault::deleteQuietly);
        }
    }

    private InstallResult install(StagedSubmission staged, ValidationOutcome outcome) throws IOException {
        SafetyReport report = outcome.report();
        Path extracted = outcome.extractedDir().orElse(null);
        if (!report.ok()) {
            return quarantine(staged, extracted, report);
        }
        if (extracted == null || !Files.isDirectory(extracted)) {
            return quarantine(staged, null, report.failedWith("extracted directory missing"));
        }

        Promotion promotion;
        try {
            promotion = promote(extracted, report.skillId());
        } catch (IOException e) {
            log.error("Promotion of {} failed: {}", report.skillId(), e.getMessage(), e);
            return quarantine(staged, extracted, report.failedWith("promotion failed: " + describe(e)));
        }

        SkillManifest manifest;
        try {
            manifest = manifestReader.read(promotion.target().resolve(SkillManifest.FILE_NAME));
            if (!manifest.isJvmEntry() && !Files.isRegularFile(promotion.target().resolve(manifest.entry()))) {
                throw new SkillException(SkillException.Kind.VALIDATION_FAILURE, "entry point missing after promotion");
            }
            installModuleReference(promotion.target(), manifest);
        } catch (SkillException e) {
            try {
                return quarantine(staged, promotion.target(), report.failedWith(e.getDetail()));
            } finally {
                rollback(promotion);
            }
        } catch (IOException | RuntimeException e) {
            rollback(promotion);
            throw e;
        }

        commit(promotion);
        try {
            Files.deleteIfExists(staged.archive());
        } catch (IOException e) {
            log.warn("Could not remove staged archive {}: {}", staged.archive(), e.getMessage());
        }
        publishInstalled(manifest.id(), promotion.target());
        return InstallResult.live(report, promotion.target());
    }

    /**
     * Install an unpacked skill directory. A rejection is reported without
     * any quarantine side effect. Never throws.
     */
    public InstallResult installFromPreparedDir(Path directory) {
        SafetyReport report;
        try {
            report = validator.validateDirectory(directory);
        } catch (RuntimeException e) {
            log.error("Validator failed on {}: {}", directory, e.getMessage(), e);
            return InstallResult.rejected(SafetyReport.failed("validator error: " + describe(e)));
        }
        if (!report.ok()) {
            log.warn("Prepared skill at {} rejected: {}", directory, report.reasons());
            return InstallResult.rejected(report);
        }

        String id = report.skillId();
        Path copy = paths.live().resolve("." + id + "-" + UUID.randomUUID());
        Promotion promotion = null;
        try {
            Files.createDirectories(paths.live());
            FileSystemUtils.copyRecursively(directory, copy);
            promotion = promote(copy, id);
            SkillManifest manifest = manifestReader.read(promotion.target().resolve(SkillManifest.FILE_NAME));
            installModuleReference(promotion.target(), manifest);
        } catch (IOException | RuntimeException e) {
            log.error("Install of prepared skill {} failed: {}", id, e.getMessage(), e);
            if (promotion != null) {
                rollback(promotion);
            }
            deleteQuietly(copy);
            return InstallResult.rejected(report.failedWith("install failed: " + describe(e)));
        }

        commit(promotion);
        publishInstalled(id, promotion.target());
        return InstallResult.live(report, promotion.target());
    }

    /**
     * Swap {@code source} in as {@code live/<id>}. The new tree is first moved
     * (or copied, when it cannot be moved) to a hidden sibling, then the
     * current version is renamed aside and the new one renamed into place.
     * The previous version survives until {@link #commit}.
     */
    private Promotion promote(Path source, String id) throws IOException {
        Path target = paths.live().resolve(id);
        Files.createDirectories(paths.live());

        Path incoming = paths.live().resolve("." + id + "-new-" + UUID.randomUUID());
        try {
            Files.move(source, incoming, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.debug("Move of {} into live failed ({}); copying", id, e.toString());
            try {
                FileSystemUtils.copyRecursively(source, incoming);
            } catch (IOException copyFailure) {
                deleteQuietly(incoming);
                throw copyFailure;
            }
            deleteQuietly(source);
        }

        Path previous = null;
        try {
            if (Files.exists(target)) {
                previous = paths.live().resolve("." + id + "-old-" + UUID.randomUUID());
                Files.move(target, previous);
            }
            Files.move(incoming, target);
        } catch (IOException e) {
            if (previous != null && !Files.exists(target)) {
                restore(previous, target);
            }
            deleteQuietly(incoming);
            throw e;
        }
        if (!Files.isDirectory(target)) {
            Promotion failed = new Promotion(id, target, previous);
            rollback(failed);
            throw new IOException("live directory missing after promotion: " + target);
        }
        log.info("Promoted skill {} to {}", id, target);
        return new Promotion(id, target, previous);
    }

    private void commit(Promotion promotion) {
        if (promotion.previous() != null) {
            deleteQuietly(promotion.previous());
        }
    }

    /** Remove the promoted tree and put the previous version, with its module reference, back. */
    private void rollback(Promotion promotion) {
        deleteQuietly(promotion.target());
        if (promotion.previous() == null) {
            log.warn("Rolled back promotion of {}", promotion.id());
            return;
        }
        if (!restore(promotion.previous(), promotion.target())) {
            return;
        }
        try {
            installModuleReference(promotion.target(),
                    manifestReader.read(promotion.target().resolve(SkillManifest.FILE_NAME)));
        } catch (IOException | RuntimeException e) {
            log.warn("Could not restore module reference of {}: {}", promotion.id(), e.getMessage());
        }
        log.warn("Rolled back promotion of {}; previous version restored", promotion.id());
    }

    private static boolean restore(Path previous, Path target) {
        try {
            Files.move(previous, target);
            return true;
        } catch (IOException e) {
            log.error("Could not restore {} from {}: {}", target, previous, e.getMessage(), e);
            return false;
        }
    }

    /** A promoted live directory and the version it replaced, if any. */
    private record Promotion(String id, Path target, Path previous) {}

    /** Flat reference used for fast lookup: a copy of the entry script, or the JVM class name. */
    private void installModuleReference(Path live, SkillManifest manifest) throws IOException {
        Files.createDirectories(paths.userSkills());
        removeModuleReferences(manifest.id());
        if (manifest.isJvmEntry()) {
            String className = manifest.entry().substring(SkillManifest.JVM_ENTRY_PREFIX.length()).trim();
            Files.writeString(paths.userSkills().resolve(manifest.id() + "." + SkillLocator.JVM_REFERENCE_EXTENSION),
                    className + "\n", StandardCharsets.UTF_8);
            return;
        }
        Path entry = live.resolve(manifest.entry());
        String extension = ScriptRuntime.forFile(entry).map(ScriptRuntime::extension).orElse("txt");
        Files.copy(entry, paths.userSkills().resolve(manifest.id() + "." + extension),
                StandardCopyOption.REPLACE_EXISTING);
    }

    private boolean removeModuleReferences(String id) throws IOException {
        boolean removed = Files.deleteIfExists(
                paths.userSkills().resolve(id + "." + SkillLocator.JVM_REFERENCE_EXTENSION));
        for (ScriptRuntime runtime : ScriptRuntime.values()) {
            removed |= Files.deleteIfExists(paths.userSkills().resolve(id + "." + runtime.extension()));
        }
        return removed;
    }

    // ------------------------------------------------------------------
    // Quarantine
    // ------------------------------------------------------------------

    /** Quarantine a staged submission by hand, e.g. after an external review. */
    public QuarantineRecord quarantine(StagedSubmission staged, String reason) {
        SafetyReport report = SafetyReport.failed("manual quarantine: " + reason);
        try {
            QuarantineRecord record = writeQuarantine(staged.archive(), null, report);
            Files.deleteIfExists(staged.archive());
            return record;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot quarantine " + staged.archive(), e);
        }
    }

    private InstallResult quarantine(StagedSubmission staged, Path extracted, SafetyReport report) throws IOException {
        QuarantineRecord record = writeQuarantine(staged.archive(), extracted, report);
        Files.deleteIfExists(staged.archive());
        SafetyReport annotated = report.withReason("Quarantined at: " + record.directory());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("skill_id", record.skillId());
        payload.put("quarantine_dir", record.directory().toString());
        payload.put("reasons", annotated.reasons());
        eventBus.publish(Topics.SKILL_QUARANTINED, payload, SENDER);
        return InstallResult.quarantined(annotated, record.directory());
    }

    private QuarantineRecord writeQuarantine(Path archive, Path extracted, SafetyReport report) throws IOException {
        String skillId = report.skillId() != null && ManifestReader.isValidSkillName(report.skillId())
                ? report.skillId()
                : UNKNOWN_SKILL;
        Instant now = clock.instant();
        String stamp = QUARANTINE_STAMP.format(now);
        Path base = paths.quarantine().resolve(skillId);
        Files.createDirectories(base);

        Path dir = base.resolve(stamp);
        for (int attempt = 1; ; attempt++) {
            try {
                Files.createDirectory(dir);
                break;
            } catch (FileAlreadyExistsException e) {
                dir = base.resolve(stamp + "_" + attempt);
            }
        }

        if (archive != null && Files.isRegularFile(archive)) {
            Files.copy(archive, dir.resolve(QuarantineRecord.ORIGINAL_ARCHIVE));
        }
        if (extracted != null && Files.isDirectory(extracted)) {
            FileSystemUtils.copyRecursively(extracted, dir.resolve(QuarantineRecord.EXTRACTED_DIR));
        }

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("skill_id", report.skillId());
        json.put("name", report.name());
        json.put("version", report.version());
        json.put("permissions", report.permissions());
        json.put("ok", report.ok());
        json.put("reasons", report.reasons());
        json.put("timestamp", now.toString());
        objectMapper.writerWithDefaultPrettyPrinter()
                .writeValue(dir.resolve(QuarantineRecord.REPORT_FILE).toFile(), json);
        Files.write(dir.resolve(QuarantineRecord.REASONS_FILE), report.reasons(), StandardCharsets.UTF_8);

        log.warn("Quarantined submission for skill {} at {}: {}", skillId, dir, report.reasons());
        return new QuarantineRecord(skillId, dir.getFileName().toString(), dir, report.reasons());
    }

    // ------------------------------------------------------------------
    // Listing and removal
    // ------------------------------------------------------------------

    public List<SkillDescriptor> listInstalled() {
        List<SkillDescriptor> installed = new ArrayList<>();
        for (Path dir : children(paths.live())) {
            Path manifestFile = dir.resolve(SkillManifest.FILE_NAME);
            if (dir.getFileName().toString().startsWith(".") || !Files.isRegularFile(manifestFile)) {
                continue;
            }
            try {
                installed.add(SkillDescriptor.fromManifest(manifestReader.read(manifestFile), dir, SkillOrigin.LIVE));
            } catch (SkillException e) {
                log.warn("Skipping unreadable live skill {}: {}", dir.getFileName(), e.getDetail());
            }
        }
        installed.sort(Comparator.comparing(SkillDescriptor::id));
        return installed;
    }

    public List<QuarantineRecord> listQuarantine() {
        List<QuarantineRecord> records = new ArrayList<>();
        for (Path skillDir : children(paths.quarantine())) {
            for (Path dir : children(skillDir)) {
                Path reasonsFile = dir.resolve(QuarantineRecord.REASONS_FILE);
                List<String> reasons = List.of();
                try {
                    if (Files.isRegularFile(reasonsFile)) {
                        reasons = Files.readAllLines(reasonsFile, StandardCharsets.UTF_8);
                    }
                } catch (IOException e) {
                    log.warn("Cannot read {}: {}", reasonsFile, e.getMessage());
                }
                records.add(new QuarantineRecord(skillDir.getFileName().toString(),
                        dir.getFileName().toString(), dir, reasons));
            }
        }
        records.sort(Comparator.comparing(QuarantineRecord::skillId).thenComparing(QuarantineRecord::timestamp));
        return records;
    }

    public List<Path> listStaged() {
        List<Path> staged = new ArrayList<>();
        for (Path submitter : children(paths.staging())) {
            staged.addAll(children(submitter));
        }
        staged.sort(Comparator.naturalOrder());
        return staged;
    }

    /** Remove a live skill and its module reference. */
    public boolean deleteSkill(String id) {
        if (!ManifestReader.isValidSkillName(id)) {
            return false;
        }
        try {
            boolean removed = FileSystemUtils.deleteRecursively(paths.live().resolve(id));
            removed |= removeModuleReferences(id);
            if (removed) {
                log.info("Deleted skill {}", id);
            }
            return removed;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete skill " + id, e);
        }
    }

    public boolean deleteStaged(StagedSubmission staged) {
        try {
            return Files.deleteIfExists(staged.archive());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete " + staged.archive(), e);
        }
    }

    // ------------------------------------------------------------------

    private void publishInstalled(String id, Path live) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("skill_id", id);
        payload.put("location", live.toString());
        eventBus.publish(Topics.SKILL_INSTALLED, payload, SENDER);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String sanitize(String value) {
        String cleaned = value == null ? "" : value.replaceAll("[^A-Za-z0-9_.-]", "_");
        return cleaned.isEmpty() || cleaned.startsWith(".") ? "_" + cleaned : cleaned;
    }

    private static List<Path> children(Path dir) {
        List<Path> result = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return result;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            stream.forEach(result::add);
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", dir, e.getMessage());
        }
        return result;
    }

    private static void deleteQuietly(Path path) {
        try {
            FileSystemUtils.deleteRecursively(path);
        } catch (IOException e) {
            log.warn("Could not remove {}: {}", path, e.getMessage());
        }
    }
}
