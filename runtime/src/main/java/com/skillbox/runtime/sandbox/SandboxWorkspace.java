package com.skillbox.runtime.sandbox;

import com.skillbox.runtime.skill.SkillDescriptor;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Private working directory of one skill execution.
 *
 * <pre>
 *   sandbox/&lt;skill&gt;_&lt;session8&gt;/
 *     output/       files the skill produces; collected on cleanup
 *     stderr.log    the process' standard error
 *     ...           copy of the skill tree
 * </pre>
 */
public final class SandboxWorkspace {

    public static final String OUTPUT_DIR = "output";
    public static final String STDERR_LOG = "stderr.log";

    // 'output/  "output/  'output\  "output\
    private static final Pattern RELATIVE_OUTPUT = Pattern.compile("(['\"])output[/\\\\]");

    private final Path root;

    private SandboxWorkspace(Path root) {
        this.root = root;
    }

    public static SandboxWorkspace create(Path sandboxRoot, String skillId, String sessionId) throws IOException {
        String suffix = sessionId.replace("-", "");
        suffix = suffix.substring(0, Math.min(8, suffix.length()));
        Path root = sandboxRoot.resolve(skillId + "_" + suffix);
        Files.createDirectories(root.resolve(OUTPUT_DIR));
        return new SandboxWorkspace(root);
    }

    public Path root()      { return root; }
    public Path outputDir() { return root.resolve(OUTPUT_DIR); }
    public Path stderrLog() { return root.resolve(STDERR_LOG); }

    /**
     * Copy the skill into the sandbox and rewrite relative output paths in
     * its entry script.
     *
     * @return the entry script inside the sandbox, or the sandbox root for JVM entries
     */
    public Path install(SkillDescriptor skill) throws IOException {
        if (skill.isPackaged()) {
            FileSystemUtils.copyRecursively(skill.location(), root);
        } else {
            Files.copy(skill.location(), root.resolve(skill.location().getFileName()),
                    StandardCopyOption.REPLACE_EXISTING);
        }
        if (skill.isJvmEntry()) {
            return root;
        }

        Path entry = skill.isPackaged()
                ? root.resolve(skill.entry()).normalize()
                : root.resolve(skill.location().getFileName());
        if (!entry.startsWith(root) || !Files.isRegularFile(entry)) {
            throw new IOException("Entry script missing in sandbox: " + skill.entry());
        }
        String source = Files.readString(entry, StandardCharsets.UTF_8);
        String rewritten = rewriteOutputPaths(source);
        if (!rewritten.equals(source)) {
            Files.writeString(entry, rewritten, StandardCharsets.UTF_8);
        }
        return entry;
    }

    /** Point quoted {@code output/} references at this sandbox's output directory. */
    public String rewriteOutputPaths(String source) {
        String absolute = outputDir().toAbsolutePath().toString().replace('\\', '/') + "/";
        Matcher m = RELATIVE_OUTPUT.matcher(source);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(m.group(1) + absolute));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Copy everything under {@code output/} into {@code target}.
     *
     * @return number of files copied
     */
    public int collectOutput(Path target) throws IOException {
        Path source = outputDir();
        if (!Files.isDirectory(source)) {
            return 0;
        }
        int[] copied = {0};
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file).toString()),
                        StandardCopyOption.REPLACE_EXISTING);
                copied[0]++;
                return FileVisitResult.CONTINUE;
            }
        });
        return copied[0];
    }

    /** Last {@code maxChars} characters of the process' stderr, or "" if none. */
    public String stderrTail(int maxChars) {
        try {
            if (!Files.isRegularFile(stderrLog())) {
                return "";
            }
            String text = Files.readString(stderrLog(), StandardCharsets.UTF_8).strip();
            return text.length() <= maxChars ? text : text.substring(text.length() - maxChars);
        } catch (IOException e) {
            return "";
        }
    }

    public boolean delete() throws IOException {
        return FileSystemUtils.deleteRecursively(root);
    }
}
