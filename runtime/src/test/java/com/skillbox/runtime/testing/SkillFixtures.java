package com.skillbox.runtime.testing;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** Helpers that lay out skill packages and archives on disk. */
public final class SkillFixtures {

    private SkillFixtures() {}

    public static String manifest(String id, String entry, String... permissions) {
        String perms = Arrays.stream(permissions)
                .map(p -> "\"" + p + "\"")
                .collect(Collectors.joining(", "));
        return """
                {
                  "id": "%s",
                  "name": "%s skill",
                  "version": "1.0.0",
                  "permissions": [%s],
                  "entry": "%s"
                }
                """.formatted(id, id, perms, entry);
    }

    /** Write a skill package ({@code manifest.json} plus the given files) into {@code dir}. */
    public static Path writePackage(Path dir, String manifestJson, Map<String, String> files) {
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve("manifest.json"), manifestJson, StandardCharsets.UTF_8);
            for (Map.Entry<String, String> file : files.entrySet()) {
                Path target = dir.resolve(file.getKey());
                Files.createDirectories(target.getParent());
                Files.writeString(target, file.getValue(), StandardCharsets.UTF_8);
            }
            return dir;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Zip the given entries, in order, into {@code archive}. */
    public static Path writeZip(Path archive, Map<String, String> entries) {
        try (OutputStream out = Files.newOutputStream(archive);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
            return archive;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Map<String, String> entries(String... nameThenContent) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < nameThenContent.length; i += 2) {
            map.put(nameThenContent[i], nameThenContent[i + 1]);
        }
        return map;
    }
}
