package com.skillbox.runtime.skill;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Parses and sanity-checks {@code manifest.json} files. */
@Component
public class ManifestReader {

    public static final Pattern SKILL_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,63}");

    private static final Pattern JVM_CLASS_NAME =
            Pattern.compile("[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*");

    private final ObjectMapper objectMapper;

    public ManifestReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws SkillException VALIDATION_FAILURE if the file is missing or not a manifest
     */
    public SkillManifest read(Path manifestFile) {
        try {
            SkillManifest manifest = objectMapper.readValue(manifestFile.toFile(), SkillManifest.class);
            if (manifest == null) {
                throw new SkillException(SkillException.Kind.VALIDATION_FAILURE,
                        "manifest.json is empty: " + manifestFile);
            }
            return manifest;
        } catch (JsonProcessingException e) {
            throw new SkillException(SkillException.Kind.VALIDATION_FAILURE,
                    "manifest.json unreadable: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SkillException(SkillException.Kind.VALIDATION_FAILURE,
                    "manifest.json unreadable: " + e.getMessage(), e);
        }
    }

    /** Structural problems with the manifest fields; empty when the manifest is usable. */
    public List<String> problems(SkillManifest manifest) {
        List<String> problems = new ArrayList<>();
        requireField(problems, "id", manifest.id());
        requireField(problems, "name", manifest.name());
        requireField(problems, "version", manifest.version());
        requireField(problems, "entry", manifest.entry());

        if (!isBlank(manifest.id()) && !isValidSkillName(manifest.id())) {
            problems.add("invalid skill id: '" + manifest.id() + "'");
        }
        for (String permission : manifest.permissions()) {
            if (Permission.fromWire(permission).isEmpty()) {
                problems.add("unknown permission: '" + permission + "'");
            }
        }
        if (manifest.isJvmEntry()) {
            String className = manifest.entry().substring(SkillManifest.JVM_ENTRY_PREFIX.length()).trim();
            if (!JVM_CLASS_NAME.matcher(className).matches()) {
                problems.add("missing entry point");
            }
        }
        return problems;
    }

    public static boolean isValidSkillName(String name) {
        return name != null && SKILL_ID.matcher(name).matches() && !name.contains("..");
    }

    private static void requireField(List<String> problems, String field, String value) {
        if (isBlank(value)) {
            problems.add("manifest missing field: " + field);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
