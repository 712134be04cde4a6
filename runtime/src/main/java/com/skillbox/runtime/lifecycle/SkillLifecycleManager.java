package com.skillbox.runtime.lifecycle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbox.runtime.config.SkillboxPaths;
import com.skillbox.runtime.credential.CredentialAccess;
import com.skillbox.runtime.credential.CredentialVault;
import com.skillbox.runtime.event.Event;
import com.skillbox.runtime.event.EventBus;
import com.skillbox.runtime.event.EventHandler;
import com.skillbox.runtime.event.Topics;
import com.skillbox.runtime.skill.Permission;
import com.skillbox.runtime.skill.SkillDescriptor;
import com.skillbox.runtime.skill.SkillException;
import com.skillbox.runtime.skill.SkillLocator;
import com.skillbox.runtime.skill.SkillNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Spawns, tracks and terminates skill executions.
 *
 * <p>Every execution is isolated in a child process unless the skill is a JVM
 * entry that declares {@code direct_access}, in which case it runs as a
 * background task in this JVM. Either way it reports exactly one
 * {@link TerminalResult} through a one-shot {@link ResultChannel}.
 *
 * <p>{@link #useAndKill} is the entry point for channels: it never throws,
 * always terminates what it spawned, and registers a retry for retryable
 * failures. Every run is timed and counted:
 * <pre>
 *   skillbox.skill.runs{skill, status="success|not_found|timeout|execution_failure|credential_denied"}
 *   skillbox.skill.duration{skill, mode="isolated_process|in_process|none"}
 * </pre>
 */
@Service
public class SkillLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(SkillLifecycleManager.class);

    private static final String SENDER = "lifecycle-manager";
    private static final int SYNTHETIC_HANDLE_RANGE = 100_000;
    private static final int STDERR_TAIL_CHARS = 500;

    private final Object lock = new Object();
    private final Map<Long, ExecutionRecord> active = new HashMap<>();
    private final Map<String, TerminalResult> buffered = new ConcurrentHashMap<>();

    private final SkillLocator         locator;
    private final SkillProcessLauncher launcher;
    private final InProcessRunner      inProcessRunner;
    private final DirectAccessDetector directAccessDetector;
    private final CredentialVault      credentialVault;
    private final EventBus             eventBus;
    private final RetryRegistry        retries;
    private final MeterRegistry        meterRegistry;
    private final ObjectMapper         objectMapper;
    private final Clock                clock;
    private final LifecycleSettings    settings;
    private final SkillboxPaths        paths;

    public SkillLifecycleManager(SkillLocator locator,
                                 SkillProcessLauncher launcher,
                                 InProcessRunner inProcessRunner,
                                 DirectAccessDetector directAccessDetector,
                                 CredentialVault credentialVault,
                                 EventBus eventBus,
                                 RetryRegistry retries,
                                 MeterRegistry meterRegistry,
                                 ObjectMapper objectMapper,
                                 Clock clock,
                                 LifecycleSettings settings,
                                 SkillboxPaths paths) {
        this.locator              = locator;
        this.launcher             = launcher;
        this.inProcessRunner      = inProcessRunner;
        this.directAccessDetector = directAccessDetector;
        this.credentialVault      = credentialVault;
        this.eventBus             = eventBus;
        this.retries              = retries;
        this.meterRegistry        = meterRegistry;
        this.objectMapper         = objectMapper;
        this.clock                = clock;
        this.settings             = settings;
        this.paths                = paths;
    }

    /** Lets channels request a retry by publishing {@code skill.retry_request}. */
    @PostConstruct
    public void subscribeToRetryRequests() {
        eventBus.subscribe(Topics.SKILL_RETRY_REQUEST,
                EventHandler.bound(this, "onRetryRequest", this::onRetryRequest));
    }

    // ------------------------------------------------------------------
    // Spawn
    // ------------------------------------------------------------------

    /**
     * Resolve and start a skill.
     *
     * @param context caller context; {@code credential_session} is redeemed for
     *                skills declaring {@code credentials} and dropped otherwise
     * @throws SkillNotFoundException if no skill with that name is installed
     * @throws SkillException         CREDENTIAL_DENIED or EXECUTION_FAILURE if it cannot start
     */
    public SpawnedExecution spawn(String skillName, Map<String, Object> context) {
        SkillDescriptor skill = locator.resolve(skillName)
                .orElseThrow(() -> new SkillNotFoundException(skillName));
        String sessionId = UUID.randomUUID().toString();
        ExecutionMode mode = modeFor(skill);

        Map<String, Object> childContext = new LinkedHashMap<>(context);
        childContext.put("session_id", sessionId);
        childContext.put("skill_name", skill.name());
        childContext.put("skill_id", skill.id());
        childContext.put("permissions", skill.permissions().stream().map(Permission::wireName).sorted().toList());

        String credentialSession = redeemCredentials(skill, childContext);
        ResultChannel channel = new ResultChannel();
        ExecutionRecord record;
        try {
            if (mode == ExecutionMode.IN_PROCESS) {
                synchronized (lock) {
                    long handle = nextSyntheticHandle();
                    Future<?> task = inProcessRunner.start(skill, sessionId, childContext, channel);
                    record = ExecutionRecord.forTask(handle, task, skill, sessionId,
                            withoutSecrets(childContext), clock.instant(), channel, credentialSession);
                    active.put(handle, record);
                }
            } else {
                LaunchedProcess launched = launcher.launch(skill, sessionId, childContext, channel);
                record = ExecutionRecord.forProcess(launched, skill, sessionId,
                        withoutSecrets(childContext), clock.instant(), channel, credentialSession);
                register(record);
            }
        } catch (IOException e) {
            releaseCredentials(credentialSession);
            throw new SkillException(SkillException.Kind.EXECUTION_FAILURE,
                    "Could not start skill '" + skill.id() + "': " + e.getMessage(), e);
        } catch (RuntimeException e) {
            releaseCredentials(credentialSession);
            throw e;
        }

        log.info("Spawned skill {} as {} (handle {}, session {})", skill.id(), mode, record.handle(), sessionId);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("handle", record.handle());
        payload.put("skill_id", skill.id());
        payload.put("session_id", sessionId);
        payload.put("mode", mode.name().toLowerCase());
        eventBus.publish(Topics.AGENT_SPAWNED, payload, SENDER);
        return new SpawnedExecution(record.handle(), sessionId, skill.id(), mode, skill.maxLifetime());
    }

    private ExecutionMode modeFor(SkillDescriptor skill) {
        if (skill.has(Permission.DIRECT_ACCESS)) {
            if (skill.isJvmEntry()) {
                return ExecutionMode.IN_PROCESS;
            }
            log.warn("Skill {} declares direct_access but has a script entry; running it isolated", skill.id());
            return ExecutionMode.ISOLATED_PROCESS;
        }
        Set<String> markers = directAccessDetector.scan(skill);
        if (!markers.isEmpty()) {
            log.warn("Skill {} uses {} without declaring direct_access; running it isolated", skill.id(), markers);
        }
        return ExecutionMode.ISOLATED_PROCESS;
    }

    private String redeemCredentials(SkillDescriptor skill, Map<String, Object> childContext) {
        Object token = childContext.get("credential_session");
        if (token == null) {
            return null;
        }
        if (!skill.has(Permission.CREDENTIALS)) {
            log.warn("Dropping credential session for skill {}: credentials permission not declared", skill.id());
            childContext.remove("credential_session");
            return null;
        }
        Object userId = childContext.get("user_id");
        CredentialAccess access = credentialVault.get(token.toString(), skill.id(),
                userId == null ? SENDER : userId.toString());
        if (!access.granted()) {
            throw new SkillException(SkillException.Kind.CREDENTIAL_DENIED, access.message());
        }
        childContext.put("credentials", access.credentials());
        return token.toString();
    }

    private static Map<String, Object> withoutSecrets(Map<String, Object> context) {
        Map<String, Object> copy = new LinkedHashMap<>(context);
        copy.remove("credentials");
        return copy;
    }

    private void register(ExecutionRecord record) {
        synchronized (lock) {
            if (active.putIfAbsent(record.handle(), record) == null) {
                return;
            }
        }
        // A live OS pid collided with a synthetic handle.
        record.process().process().destroyForcibly();
        throw new SkillException(SkillException.Kind.EXECUTION_FAILURE,
                "Handle " + record.handle() + " is already tracked");
    }

    /** Time-derived handle in [0, 100000) not used by any tracked execution. Caller holds the lock. */
    private long nextSyntheticHandle() {
        long candidate = System.currentTimeMillis() % SYNTHETIC_HANDLE_RANGE;
        for (int i = 0; i < SYNTHETIC_HANDLE_RANGE; i++) {
            if (!active.containsKey(candidate)) {
                return candidate;
            }
            candidate = (candidate + 1) % SYNTHETIC_HANDLE_RANGE;
        }
        throw new SkillException(SkillException.Kind.EXECUTION_FAILURE, "No free in-process handle");
    }

    // ------------------------------------------------------------------
    // Wait
    // ------------------------------------------------------------------

    /**
     * Block until the execution reports its terminal result.
     *
     * The wait is bounded by {@code timeout} and never exceeds the configured
     * result ceiling. A result is returned at most once.
     *
     * @throws SkillException TIMEOUT when no result arrived in time;
     *                        EXECUTION_FAILURE when the execution ended without one
     */
    public TerminalResult waitForResult(long handle, String sessionId, Duration timeout) {
        Duration bound = timeout == null || timeout.compareTo(settings.resultCeiling()) > 0
                ? settings.resultCeiling()
                : timeout;
        long deadline = System.nanoTime() + bound.toNanos();

        while (true) {
            TerminalResult ready = buffered.remove(sessionId);
            if (ready != null) {
                return ready;
            }
            ExecutionRecord record = lookup(handle).orElseThrow(() -> new SkillException(
                    SkillException.Kind.EXECUTION_FAILURE, "Execution " + handle + " is not tracked"));

            long remaining = deadline - System.nanoTime();
            Duration slice = Duration.ofNanos(Math.max(0, Math.min(remaining, settings.pollInterval().toNanos())));
            TerminalResult received;
            try {
                received = record.channel().poll(slice);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SkillException(SkillException.Kind.TIMEOUT,
                        "Interrupted while waiting for skill '" + record.skillId() + "'", e);
            }
            if (received != null) {
                if (received.sessionId().equals(sessionId)) {
                    return received;
                }
                buffered.put(received.sessionId(), received);
                continue;
            }

            if (!record.isAlive()) {
                TerminalResult late = record.channel().pollNow();
                if (late != null && late.sessionId().equals(sessionId)) {
                    return late;
                }
                throw new SkillException(SkillException.Kind.EXECUTION_FAILURE,
                        "Skill '" + record.skillId() + "' ended without result" + stderrSuffix(record));
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new SkillException(SkillException.Kind.TIMEOUT,
                        "No result from skill '" + record.skillId() + "' within " + bound.toSeconds() + "s");
            }
        }
    }

    private static String stderrSuffix(ExecutionRecord record) {
        if (record.process() == null) {
            return "";
        }
        String tail = record.process().workspace().stderrTail(STDERR_TAIL_CHARS);
        return tail.isEmpty() ? "" : ": " + tail;
    }

    // ------------------------------------------------------------------
    // Execute and wait
    // ------------------------------------------------------------------

    /**
     * Run a skill to completion and always terminate it afterwards.
     *
     * @param task    plain task text, or a JSON object whose keys are merged into the context
     * @param timeout wait bound; null means the skill's declared max lifetime
     * @return a structured result; failures that can be retried carry a session id
     *         accepted by {@link #retry}
     */
    public SkillRunResult useAndKill(String skillName, String task, Duration timeout, String userId) {
        long started = System.nanoTime();
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        String modeTag = "none";
        SpawnedExecution spawned = null;

        MDC.put("skillId", skillName);
        try {
            spawned = spawn(skillName, buildContext(skillName, task, userId));
            modeTag = spawned.mode().name().toLowerCase();
            MDC.put("sessionId", spawned.sessionId());

            Duration bound = timeout != null ? timeout : spawned.maxLifetime();
            TerminalResult result = waitForResult(spawned.handle(), spawned.sessionId(), bound);
            eventBus.publish(Topics.AGENT_RESULT, result.toPayload(), SENDER);

            if (result.success()) {
                double seconds = secondsSince(started);
                log.info("Skill {} succeeded in {}s", skillName, String.format("%.3f", seconds));
                return SkillRunResult.success(skillName, spawned.sessionId(), spawned.handle(), result.result(), seconds);
            }
            status = "execution_failure";
            return failed(skillName, task, timeout, userId, spawned,
                    SkillException.Kind.EXECUTION_FAILURE, result.error(), started, false);

        } catch (SkillException e) {
            status = e.getKind().name().toLowerCase();
            if (e.getKind() == SkillException.Kind.TIMEOUT && spawned != null) {
                forceKill(spawned.handle());
            }
            return failed(skillName, task, timeout, userId, spawned, e.getKind(), e.getDetail(), started, true);
        } catch (RuntimeException e) {
            status = "execution_failure";
            log.error("Unexpected error running skill {}: {}", skillName, e.getMessage(), e);
            return failed(skillName, task, timeout, userId, spawned,
                    SkillException.Kind.EXECUTION_FAILURE, InProcessRunner.describe(e), started, true);
        } finally {
            if (spawned != null) {
                kill(spawned.handle());
            }
            sample.stop(meterRegistry.timer("skillbox.skill.duration", "skill", skillName, "mode", modeTag));
            meterRegistry.counter("skillbox.skill.runs", "skill", skillName, "status", status).increment();
            MDC.remove("sessionId");
            MDC.remove("skillId");
        }
    }

    private SkillRunResult failed(String skillName, String task, Duration timeout, String userId,
                                  SpawnedExecution spawned, SkillException.Kind kind, String error,
                                  long started, boolean publishResult) {
        String sessionId = spawned != null ? spawned.sessionId() : UUID.randomUUID().toString();
        Long handle = spawned != null ? spawned.handle() : null;
        String now = clock.instant().toString();
        log.warn("Skill {} failed [{}]: {}", skillName, kind, error);

        if (publishResult) {
            eventBus.publish(Topics.AGENT_RESULT,
                    TerminalResult.failure(sessionId, skillName, error, clock.instant()).toPayload(), SENDER);
        }
        boolean retryable = kind.retryable();
        if (retryable) {
            retries.register(sessionId, () -> useAndKill(skillName, task, timeout, userId));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("session_id", sessionId);
            payload.put("skill_id", skillName);
            payload.put("original_error", error);
            payload.put("timestamp", now);
            eventBus.publish(Topics.SKILL_RETRY_AVAILABLE, payload, SENDER);
        }
        return SkillRunResult.failure(skillName, sessionId, handle, kind, error, secondsSince(started), retryable);
    }

    private Map<String, Object> buildContext(String skillName, String task, String userId) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("task", task);
        context.put("user_id", userId);
        context.put("timestamp", clock.instant().toString());
        context.put("output_dir", paths.output().resolve(skillName).toString());
        if (task != null && task.trim().startsWith("{")) {
            try {
                Map<String, Object> extra = objectMapper.readValue(task, new TypeReference<>() {});
                context.putAll(extra);
            } catch (JsonProcessingException e) {
                log.debug("Task for {} looks like JSON but is not an object; passing it as text", skillName);
            }
        }
        return context;
    }

    private static double secondsSince(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }

    // ------------------------------------------------------------------
    // Retry
    // ------------------------------------------------------------------

    public SkillRunResult retry(String sessionId) {
        return retries.retry(sessionId);
    }

    private void onRetryRequest(Event event) {
        Object sessionId = event.payload().get("session_id");
        if (sessionId == null) {
            log.warn("Ignoring retry request without session_id from {}", event.sender());
            return;
        }
        SkillRunResult result = retry(sessionId.toString());
        log.info("Retry of session {} finished: success={}", sessionId, result.success());
    }

    // ------------------------------------------------------------------
    // Terminate
    // ------------------------------------------------------------------

    /**
     * Terminate politely, escalate after the grace period, then clean up.
     *
     * @return true if this call performed the cleanup
     */
    public boolean kill(long handle) {
        return terminate(handle, true);
    }

    /** Like {@link #kill} without the grace period; used after a timeout. */
    public boolean forceKill(long handle) {
        return terminate(handle, false);
    }

    private boolean terminate(long handle, boolean graceful) {
        Optional<ExecutionRecord> record = lookup(handle);
        if (record.isEmpty()) {
            return false;
        }
        stop(record.get(), graceful);
        return cleanup(handle);
    }

    private void stop(ExecutionRecord record, boolean graceful) {
        if (record.mode() == ExecutionMode.IN_PROCESS) {
            record.task().cancel(true);
            return;
        }
        Process process = record.process().process();
        List<ProcessHandle> descendants = process.descendants().toList();
        if (process.isAlive() && graceful) {
            process.destroy();
            try {
                if (process.waitFor(settings.killGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                    descendants.forEach(ProcessHandle::destroyForcibly);
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.warn("Skill {} (pid {}) ignored terminate; forcing", record.skillId(), record.handle());
        }
        descendants.forEach(ProcessHandle::destroyForcibly);
        if (process.isAlive()) {
            process.destroyForcibly();
        }
        try {
            if (!process.waitFor(settings.killGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("Skill {} (pid {}) survived a forced kill; cleaning up anyway",
                        record.skillId(), record.handle());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Forget an execution and release everything it held. Idempotent: only
     * the first call for a handle does any work.
     *
     * @return true if this call removed the execution
     */
    public boolean cleanup(long handle) {
        ExecutionRecord record;
        synchronized (lock) {
            record = active.remove(handle);
        }
        if (record == null) {
            return false;
        }

        record.channel().close();
        buffered.remove(record.sessionId());
        releaseCredentials(record.credentialSession());

        LaunchedProcess process = record.process();
        if (process != null) {
            try {
                int files = process.workspace().collectOutput(paths.output().resolve(record.skillId()));
                if (files > 0) {
                    log.info("Collected {} output file(s) from skill {}", files, record.skillId());
                }
            } catch (IOException e) {
                log.warn("Could not collect output of skill {}: {}", record.skillId(), e.getMessage());
            }
            try {
                process.workspace().delete();
            } catch (IOException e) {
                log.warn("Could not delete sandbox {}: {}", process.workspace().root(), e.getMessage());
            }
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("handle", handle);
        payload.put("session_id", record.sessionId());
        payload.put("skill_id", record.skillId());
        eventBus.publish(Topics.AGENT_KILLED, payload, SENDER);
        log.debug("Cleaned up execution {} of skill {}", handle, record.skillId());
        return true;
    }

    private void releaseCredentials(String credentialSession) {
        if (credentialSession != null) {
            credentialVault.release(credentialSession);
        }
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    public List<ExecutionSnapshot> activeExecutions() {
        List<ExecutionRecord> records;
        synchronized (lock) {
            records = new ArrayList<>(active.values());
        }
        return records.stream()
                .map(ExecutionRecord::snapshot)
                .sorted(Comparator.comparing(ExecutionSnapshot::spawnedAt))
                .toList();
    }

    public SortedSet<String> listAvailableSkills() {
        return locator.listAvailable();
    }

    private Optional<ExecutionRecord> lookup(long handle) {
        synchronized (lock) {
            return Optional.ofNullable(active.get(handle));
        }
    }

    @PreDestroy
    public void shutdown() {
        List<Long> handles;
        synchronized (lock) {
            handles = new ArrayList<>(active.keySet());
        }
        if (!handles.isEmpty()) {
            log.info("Terminating {} running skill execution(s)", handles.size());
        }
        handles.forEach(this::forceKill);
    }
}
