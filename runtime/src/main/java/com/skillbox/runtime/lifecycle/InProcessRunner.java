package com.skillbox.runtime.lifecycle;

import com.skillbox.runtime.skill.SkillDescriptor;
import com.skillbox.runtime.skill.SkillEntryInvoker;
import com.skillbox.runtime.skill.SkillException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

/**
 * Runs {@code direct_access} JVM skills as background tasks in the host JVM.
 *
 * The skill class is loaded from the host classpath plus any jars in the
 * skill's {@code lib/} directory. Cancelling the returned future interrupts
 * the task; a skill that ignores interrupts keeps its thread until it returns.
 */
@Component
public class InProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(InProcessRunner.class);

    private final ExecutorService workers;
    private final Clock clock;

    public InProcessRunner(Clock clock) {
        CustomizableThreadFactory threads = new CustomizableThreadFactory("skill-inproc-");
        threads.setDaemon(true);
        this.workers = Executors.newCachedThreadPool(threads);
        this.clock   = clock;
    }

    Future<?> start(SkillDescriptor skill, String sessionId, Map<String, Object> context, ResultChannel channel) {
        String className = skill.jvmClassName();
        ClassLoader loader = classLoaderFor(skill);
        return workers.submit(() -> {
            MDC.put("skillId", skill.id());
            MDC.put("sessionId", sessionId);
            TerminalResult outcome;
            try {
                Object entry = SkillEntryInvoker.instantiate(className, loader);
                Map<String, Object> result = SkillEntryInvoker.invoke(entry, context);
                outcome = TerminalResult.fromSkillResult(sessionId, skill.id(), result, clock.instant());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = TerminalResult.failure(sessionId, skill.id(), "interrupted", clock.instant());
            } catch (SkillException e) {
                outcome = TerminalResult.failure(sessionId, skill.id(), e.getDetail(), clock.instant());
            } catch (Exception | LinkageError e) {
                log.debug("In-process skill {} threw", skill.id(), e);
                outcome = TerminalResult.failure(sessionId, skill.id(), describe(e), clock.instant());
            } finally {
                closeLoader(loader);
                MDC.clear();
            }
            if (!channel.offer(outcome)) {
                log.debug("Result of {} arrived after the channel closed", sessionId);
            }
        });
    }

    static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private ClassLoader classLoaderFor(SkillDescriptor skill) {
        ClassLoader parent = getClass().getClassLoader();
        if (!skill.isPackaged()) {
            return parent;
        }
        List<URL> jars = new ArrayList<>();
        Path lib = skill.location().resolve("lib");
        if (Files.isDirectory(lib)) {
            try (Stream<Path> files = Files.list(lib)) {
                for (Path jar : files.filter(p -> p.toString().endsWith(".jar")).sorted().toList()) {
                    jars.add(jar.toUri().toURL());
                }
            } catch (IOException e) {
                log.warn("Could not read libraries of skill {}: {}", skill.id(), e.getMessage());
            }
        }
        return jars.isEmpty() ? parent : new URLClassLoader(jars.toArray(URL[]::new), parent);
    }

    private static void closeLoader(ClassLoader loader) {
        if (loader instanceof URLClassLoader closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                log.warn("Could not close skill class loader: {}", e.getMessage());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }
}
