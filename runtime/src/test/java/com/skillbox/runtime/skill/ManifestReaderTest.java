package com.skillbox.runtime.skill;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestReaderTest {

    @TempDir
    Path dir;

    final ManifestReader reader = new ManifestReader(new ObjectMapper());

    @Test
    void read_ignoresUnknownFieldsAndParsesLifetime() throws Exception {
        Path file = Files.writeString(dir.resolve("manifest.json"), """
                {"id": "s1", "name": "S1", "version": "2", "entry": "run.py",
                 "permissions": ["network"], "max_lifetime_sec": 30, "author": "someone"}
                """);

        SkillManifest manifest = reader.read(file);

        assertThat(manifest.id()).isEqualTo("s1");
        assertThat(manifest.maxLifetimeSecOrDefault()).isEqualTo(30);
        assertThat(reader.problems(manifest)).isEmpty();
    }

    @Test
    void read_invalidJson_throwsValidationFailure() throws Exception {
        Path file = Files.writeString(dir.resolve("manifest.json"), "[1, 2");

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(SkillException.class)
                .extracting(e -> ((SkillException) e).getKind())
                .isEqualTo(SkillException.Kind.VALIDATION_FAILURE);
    }

    @Test
    void problems_reportsEachMissingFieldAndUnknownPermission() {
        SkillManifest manifest = new SkillManifest("s1", null, null, List.of("network", "root"), "run.sh", null, null);

        assertThat(reader.problems(manifest)).containsExactly(
                "manifest missing field: name",
                "manifest missing field: version",
                "unknown permission: 'root'");
    }

    @Test
    void read_missingFile_throwsValidationFailureWithIoMessage() {
        Path file = dir.resolve("absent.json");

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(SkillException.class)
                .hasMessageContaining("manifest.json unreadable")
                .extracting(e -> ((SkillException) e).getKind())
                .isEqualTo(SkillException.Kind.VALIDATION_FAILURE);
    }

    @Test
    void problems_idWithDoubleDot_isInvalidSkillId() {
        SkillManifest manifest = new SkillManifest("a..b", "A", "1", List.of(), "run.sh", null, null);

        assertThat(reader.problems(manifest)).containsExactly("invalid skill id: 'a..b'");
    }

    @Test
    void problems_badJvmClassName_isMissingEntryPoint() {
        SkillManifest manifest = new SkillManifest("s1", "S1", "1", List.of(), "java:not a class", null, null);

        assertThat(reader.problems(manifest)).containsExactly("missing entry point");
    }

    @Test
    void isValidSkillName_rejectsTraversalAndSeparators() {
        assertThat(ManifestReader.isValidSkillName("web-search_2.1")).isTrue();
        assertThat(ManifestReader.isValidSkillName("a..b")).isFalse();
        assertThat(ManifestReader.isValidSkillName("-lead")).isFalse();
        assertThat(ManifestReader.isValidSkillName("a b")).isFalse();
    }
}
