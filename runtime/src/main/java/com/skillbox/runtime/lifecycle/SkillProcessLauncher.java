package com.skillbox.runtime.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbox.runtime.config.SkillboxPaths;
import com.skillbox.runtime.sandbox.ExecutionEnvironment;
import com.skillbox.runtime.sandbox.SandboxPolicy;
import com.skillbox.runtime.sandbox.SandboxWorkspace;
import com.skillbox.runtime.skill.ScriptRuntime;
import com.skillbox.runtime.skill.SkillDescriptor;
import com.skillbox.runtime.skill.SkillException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

/**
 * Starts isolated skill processes.
 *
 * <p>Protocol with the child:
 * <ul>
 *   <li>stdin - the execution context as one JSON document, then EOF.
 *       Credentials, when granted, travel only here.</li>
 *   <li>stdout - free-form output; the first JSON object line with a
 *       {@code success} field is the terminal result.</li>
 *   <li>stderr - appended to {@code stderr.log} in the sandbox.</li>
 * </ul>
 * Script entries run under their {@link ScriptRuntime}; JVM entries run in a
 * child JVM through {@link SkillProcessMain}.
 */
@Component
public class SkillProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(SkillProcessLauncher.class);

    private final SandboxPolicy         policy;
    private final SkillboxPaths         paths;
    private final ObjectMapper          objectMapper;
    private final TerminalMessageParser parser;
    private final Clock                 clock;
    private final ExecutorService       io;

    public SkillProcessLauncher(SandboxPolicy policy, SkillboxPaths paths, ObjectMapper objectMapper, Clock clock) {
        this.policy       = policy;
        this.paths        = paths;
        this.objectMapper = objectMapper;
        this.parser       = new TerminalMessageParser(objectMapper);
        this.clock        = clock;
        CustomizableThreadFactory threads = new CustomizableThreadFactory("skill-io-");
        threads.setDaemon(true);
        this.io = Executors.newCachedThreadPool(threads);
    }

    /**
     * Prepare a sandbox for {@code skill} and start it.
     *
     * @param context context written to the child's stdin; gains {@code sandbox_dir}
     * @throws IOException if the sandbox cannot be prepared or the process cannot start;
     *                     the sandbox is removed in that case
     */
    LaunchedProcess launch(SkillDescriptor skill, String sessionId, Map<String, Object> context,
                           ResultChannel channel) throws IOException {
        SandboxWorkspace workspace = SandboxWorkspace.create(paths.sandbox(), skill.id(), sessionId);
        try {
            Path entry = workspace.install(skill);
            List<String> command = commandFor(skill, entry, workspace);

            context.put("sandbox_dir", workspace.root().toString());
            ExecutionEnvironment run = new ExecutionEnvironment(skill.id(), sessionId,
                    stringOrNull(context.get("task")), stringOrNull(context.get("user_id")),
                    workspace.root(), skill.permissions());

            ProcessBuilder builder = new ProcessBuilder(command)
                    .directory(workspace.root().toFile())
                    .redirectError(ProcessBuilder.Redirect.appendTo(workspace.stderrLog().toFile()));
            builder.environment().clear();
            builder.environment().putAll(policy.environmentFor(run));

            Process process = builder.start();
            log.info("Started {} for skill {} (pid {}, session {})", command.get(0), skill.id(), process.pid(), sessionId);

            byte[] payload = objectMapper.writeValueAsBytes(context);
            CompletableFuture.runAsync(() -> writeContext(process, payload, skill.id()), io);
            CompletableFuture<Void> drained =
                    CompletableFuture.runAsync(() -> pump(process, skill.id(), sessionId, channel), io);
            return new LaunchedProcess(process, workspace, drained);
        } catch (IOException | RuntimeException e) {
            try {
                workspace.delete();
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    List<String> commandFor(SkillDescriptor skill, Path entry, SandboxWorkspace workspace) throws IOException {
        if (skill.isJvmEntry()) {
            String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
            return List.of(java, "-cp", classpathFor(workspace.root()),
                    SkillProcessMain.class.getName(), skill.jvmClassName());
        }
        Optional<ScriptRuntime> runtime = ScriptRuntime.forFile(entry);
        if (runtime.isEmpty()) {
            throw new SkillException(SkillException.Kind.EXECUTION_FAILURE,
                    "No runtime for entry " + entry.getFileName());
        }
        return runtime.get().command(entry);
    }

    private static String classpathFor(Path sandbox) throws IOException {
        List<String> entries = new ArrayList<>();
        entries.add(System.getProperty("java.class.path"));
        Path lib = sandbox.resolve("lib");
        if (Files.isDirectory(lib)) {
            try (Stream<Path> jars = Files.list(lib)) {
                jars.filter(p -> p.toString().endsWith(".jar")).sorted()
                        .forEach(p -> entries.add(p.toAbsolutePath().toString()));
            }
        }
        return String.join(File.pathSeparator, entries);
    }

    private void writeContext(Process process, byte[] payload, String skillId) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(payload);
            stdin.write('\n');
        } catch (IOException e) {
            // The child may exit without reading its input.
            log.debug("Could not write context to skill {}: {}", skillId, e.getMessage());
        }
    }

    private void pump(Process process, String skillId, String sessionId, ResultChannel channel) {
        try (BufferedReader stdout = process.inputReader(StandardCharsets.UTF_8)) {
            String line;
            while ((line = stdout.readLine()) != null) {
                var terminal = parser.parse(line, sessionId, skillId, clock.instant());
                if (terminal.isPresent()) {
                    if (!channel.offer(terminal.get())) {
                        log.warn("Ignoring extra terminal message from skill {} (session {})", skillId, sessionId);
                    }
                } else {
                    log.debug("[{}] {}", skillId, line);
                }
            }
        } catch (IOException e) {
            log.debug("Output of skill {} closed: {}", skillId, e.getMessage());
        }
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    @PreDestroy
    public void shutdown() {
        io.shutdownNow();
    }
}
