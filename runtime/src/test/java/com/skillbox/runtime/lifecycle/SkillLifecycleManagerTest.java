package com.skillbox.runtime.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbox.runtime.config.SkillboxPaths;
import com.skillbox.runtime.credential.CredentialVault;
import com.skillbox.runtime.credential.VaultSettings;
import com.skillbox.runtime.event.Event;
import com.skillbox.runtime.event.EventBus;
import com.skillbox.runtime.event.Topics;
import com.skillbox.runtime.lifecycle.fixtures.AsyncUpperSkill;
import com.skillbox.runtime.lifecycle.fixtures.CredentialEchoSkill;
import com.skillbox.runtime.lifecycle.fixtures.EchoSkill;
import com.skillbox.runtime.lifecycle.fixtures.RaisingSkill;
import com.skillbox.runtime.lifecycle.fixtures.SlowSkill;
import com.skillbox.runtime.sandbox.SandboxPolicy;
import com.skillbox.runtime.skill.ManifestReader;
import com.skillbox.runtime.skill.SkillException;
import com.skillbox.runtime.skill.SkillLocator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.assertj.core.api.MapAssert;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static com.skillbox.runtime.testing.SkillFixtures.entries;
import static com.skillbox.runtime.testing.SkillFixtures.manifest;
import static com.skillbox.runtime.testing.SkillFixtures.writePackage;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SkillLifecycleManager} against real skills on disk.
 *
 * JVM entries declaring {@code direct_access} run in-process from the test
 * classpath; shell skills run as real child processes.
 * No Spring context: all wiring is done manually.
 */
class SkillLifecycleManagerTest {

    @TempDir
    Path dataDir;

    SkillboxPaths         paths;
    EventBus              bus;
    CredentialVault       vault;
    RetryRegistry         retries;
    SimpleMeterRegistry   meterRegistry;
    InProcessRunner       inProcessRunner;
    SkillProcessLauncher  launcher;
    SkillLifecycleManager manager;
    List<Event>           events;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        ObjectMapper objectMapper = new ObjectMapper();
        paths           = new SkillboxPaths(dataDir).ensureDirectories();
        bus             = new EventBus(500, clock);
        vault           = new CredentialVault(bus, clock, VaultSettings.defaults());
        retries         = new RetryRegistry();
        meterRegistry   = new SimpleMeterRegistry();
        inProcessRunner = new InProcessRunner(clock);
        launcher        = new SkillProcessLauncher(new SandboxPolicy(List.of(), System.getenv()), paths, objectMapper, clock);
        manager         = new SkillLifecycleManager(
                new SkillLocator(paths, new ManifestReader(objectMapper)),
                launcher, inProcessRunner, new DirectAccessDetector(), vault, bus, retries, meterRegistry,
                objectMapper, clock,
                new LifecycleSettings(Duration.ofMillis(20), Duration.ofSeconds(60), Duration.ofSeconds(2)),
                paths);
        manager.subscribeToRetryRequests();

        events = new CopyOnWriteArrayList<>();
        bus.subscribe(Topics.WILDCARD, events::add);
        RaisingSkill.CALLS.set(0);
        RaisingSkill.lastTask = null;
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        inProcessRunner.shutdown();
        launcher.shutdown();
        bus.shutdown();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void installJvm(String id, Class<?> entry, String... permissions) {
        writePackage(paths.live().resolve(id), manifest(id, "java:" + entry.getName(), permissions), entries());
    }

    private void installScript(String id, String script, String... permissions) {
        writePackage(paths.live().resolve(id), manifest(id, "run.sh", permissions), entries("run.sh", script));
    }

    private List<Event> eventsOn(String topic) {
        return events.stream().filter(e -> e.topic().equals(topic)).toList();
    }

    private static MapAssert<String, Object> assertResultMap(SkillRunResult result) {
        return assertThat(result.result()).asInstanceOf(InstanceOfAssertFactories.map(String.class, Object.class));
    }

    // ------------------------------------------------------------------
    // In-process execution
    // ------------------------------------------------------------------

    @Test
    void useAndKill_directAccessJvmSkill_runsInProcessAndSucceeds() {
        installJvm("echo", EchoSkill.class, "direct_access");

        SkillRunResult result = manager.useAndKill("echo", "summarise inbox", Duration.ofSeconds(5), "alice");

        assertThat(result.success()).isTrue();
        assertThat(result.errorKind()).isNull();
        assertResultMap(result)
                .containsEntry("task", "summarise inbox")
                .containsEntry("user_id", "alice")
                .containsEntry("session_id", result.sessionId());
        assertThat(eventsOn(Topics.AGENT_SPAWNED)).singleElement()
                .satisfies(e -> assertThat(e.payload()).containsEntry("mode", "in_process"));
        assertThat(eventsOn(Topics.AGENT_RESULT)).hasSize(1);
        assertThat(eventsOn(Topics.AGENT_KILLED)).hasSize(1);
        assertThat(manager.activeExecutions()).isEmpty();
        assertThat(meterRegistry.counter("skillbox.skill.runs", "skill", "echo", "status", "success").count())
                .isEqualTo(1.0);
    }

    @Test
    void useAndKill_jsonObjectTask_mergesKeysIntoContext() {
        installJvm("echo", EchoSkill.class, "direct_access");

        SkillRunResult result = manager.useAndKill("echo", "{\"task\": \"inner\", \"extra\": 7}", null, "alice");

        assertResultMap(result).containsEntry("task", "inner").containsEntry("extra", 7);
    }

    @Test
    void useAndKill_asyncEntry_isAwaited() {
        installJvm("upper", AsyncUpperSkill.class, "direct_access");

        SkillRunResult result = manager.useAndKill("upper", "shout", Duration.ofSeconds(5), "alice");

        assertThat(result.success()).isTrue();
        assertThat(result.result()).isEqualTo("SHOUT");
    }

    @Test
    void useAndKill_raisingSkill_returnsFailureAndOffersRetry() {
        installJvm("flaky", RaisingSkill.class, "direct_access");

        SkillRunResult result = manager.useAndKill("flaky", "t1", Duration.ofSeconds(5), "alice");

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("boom");
        assertThat(result.errorKind()).isEqualTo(SkillException.Kind.EXECUTION_FAILURE);
        assertThat(result.retryAvailable()).isTrue();
        assertThat(retries.contains(result.sessionId())).isTrue();
        assertThat(eventsOn(Topics.SKILL_RETRY_AVAILABLE)).singleElement()
                .satisfies(e -> assertThat(e.payload())
                        .containsEntry("session_id", result.sessionId())
                        .containsEntry("skill_id", "flaky")
                        .containsEntry("original_error", "boom")
                        .containsKey("timestamp"));
        assertThat(manager.activeExecutions()).isEmpty();
    }

    @Test
    void retry_reExecutesWithOriginalArgumentsOnce() {
        installJvm("flaky", RaisingSkill.class, "direct_access");
        SkillRunResult first = manager.useAndKill("flaky", "t1", Duration.ofSeconds(5), "alice");

        SkillRunResult second = manager.retry(first.sessionId());

        assertThat(RaisingSkill.CALLS).hasValue(2);
        assertThat(RaisingSkill.lastTask).isEqualTo("t1");
        assertThat(second.error()).isEqualTo("boom");
        assertThat(second.sessionId()).isNotEqualTo(first.sessionId());

        SkillRunResult third = manager.retry(first.sessionId());
        assertThat(third.success()).isFalse();
        assertThat(third.error()).isEqualTo("No retry available for session " + first.sessionId());
        assertThat(RaisingSkill.CALLS).hasValue(2);
    }

    @Test
    void retryRequestEvent_triggersRetry() {
        installJvm("flaky", RaisingSkill.class, "direct_access");
        SkillRunResult first = manager.useAndKill("flaky", "t1", Duration.ofSeconds(5), "alice");

        bus.publish(Topics.SKILL_RETRY_REQUEST, Map.of("session_id", first.sessionId()), "chat");

        assertThat(RaisingSkill.CALLS).hasValue(2);
    }

    @Test
    void useAndKill_unknownSkill_isNotFoundButRetryable() {
        SkillRunResult result = manager.useAndKill("ghost", "t", null, "alice");

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(SkillException.Kind.NOT_FOUND);
        assertThat(result.error()).contains("ghost");
        assertThat(result.handle()).isNull();
        assertThat(result.retryAvailable()).isTrue();
        assertThat(result.sessionId()).isNotBlank();
        assertThat(eventsOn(Topics.AGENT_SPAWNED)).isEmpty();
        assertThat(eventsOn(Topics.SKILL_RETRY_AVAILABLE)).hasSize(1);
    }

    @Test
    void useAndKill_slowSkill_timesOutAndIsTerminated() {
        installJvm("slow", SlowSkill.class, "direct_access");

        SkillRunResult result = manager.useAndKill("slow", "t", Duration.ofMillis(200), "alice");

        assertThat(result.errorKind()).isEqualTo(SkillException.Kind.TIMEOUT);
        assertThat(result.retryAvailable()).isTrue();
        assertThat(result.durationSeconds()).isLessThan(10.0);
        assertThat(manager.activeExecutions()).isEmpty();
        assertThat(eventsOn(Topics.AGENT_KILLED)).hasSize(1);
    }

    // ------------------------------------------------------------------
    // Credentials
    // ------------------------------------------------------------------

    @Test
    void useAndKill_credentialSession_isRedeemedAndReleasedAfterRun() {
        installJvm("mailer", CredentialEchoSkill.class, "direct_access", "credentials");
        String session = vault.store("mailer", Map.of("api_key", "k-123"));

        SkillRunResult result = manager.useAndKill("mailer",
                "{\"task\": \"send\", \"credential_session\": \"" + session + "\"}", Duration.ofSeconds(5), "alice");

        assertThat(result.success()).isTrue();
        assertThat(result.result()).isEqualTo("k-123");
        assertThat(vault.release(session)).isFalse();
    }

    @Test
    void useAndKill_credentialSessionWithoutPermission_isDropped() {
        installJvm("echo", EchoSkill.class, "direct_access");
        String session = vault.store("echo", Map.of("api_key", "k-123"));

        SkillRunResult result = manager.useAndKill("echo",
                "{\"credential_session\": \"" + session + "\"}", Duration.ofSeconds(5), "alice");

        assertResultMap(result)
                .containsEntry("has_credentials", false)
                .containsEntry("has_credential_session", false);
        assertThat(vault.release(session)).isTrue();
    }

    @Test
    void useAndKill_deniedCredentials_failWithoutSpawning() {
        installJvm("mailer", CredentialEchoSkill.class, "direct_access", "credentials");
        String session = vault.store("someone-else", Map.of("api_key", "k-123"));

        SkillRunResult result = manager.useAndKill("mailer",
                "{\"credential_session\": \"" + session + "\"}", Duration.ofSeconds(5), "alice");

        assertThat(result.errorKind()).isEqualTo(SkillException.Kind.CREDENTIAL_DENIED);
        assertThat(result.retryAvailable()).isFalse();
        assertThat(eventsOn(Topics.AGENT_SPAWNED)).isEmpty();
        assertThat(eventsOn(Topics.CREDENTIAL_EVENT)).singleElement()
                .satisfies(e -> assertThat(e.payload()).containsEntry("event_type", "failed"));
    }

    // ------------------------------------------------------------------
    // Spawn, wait, kill
    // ------------------------------------------------------------------

    @Test
    void waitForResult_deliversTerminalResultOnlyOnce() {
        installJvm("echo", EchoSkill.class, "direct_access");
        SpawnedExecution spawned = manager.spawn("echo", Map.of("task", "once"));

        TerminalResult first = manager.waitForResult(spawned.handle(), spawned.sessionId(), Duration.ofSeconds(5));

        assertThat(first.success()).isTrue();
        assertThatThrownBy(() -> manager.waitForResult(spawned.handle(), spawned.sessionId(), Duration.ofSeconds(1)))
                .isInstanceOf(SkillException.class)
                .hasMessageContaining("ended without result");
        assertThat(manager.kill(spawned.handle())).isTrue();
    }

    @Test
    void waitForResult_untrackedHandle_fails() {
        assertThatThrownBy(() -> manager.waitForResult(42L, "nope", Duration.ofMillis(100)))
                .isInstanceOf(SkillException.class)
                .hasMessageContaining("not tracked");
    }

    @Test
    void spawn_unknownSkill_throwsNotFound() {
        assertThatThrownBy(() -> manager.spawn("ghost", Map.of()))
                .isInstanceOf(SkillException.class)
                .extracting(e -> ((SkillException) e).getKind())
                .isEqualTo(SkillException.Kind.NOT_FOUND);
    }

    @Test
    void kill_concurrentCallers_cleanUpExactlyOnce() throws Exception {
        installJvm("slow", SlowSkill.class, "direct_access");
        SpawnedExecution spawned = manager.spawn("slow", Map.of("task", "t"));
        assertThat(manager.activeExecutions()).extracting(ExecutionSnapshot::handle).containsExactly(spawned.handle());

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            outcomes.add(pool.submit(() -> {
                go.await();
                return manager.kill(spawned.handle());
            }));
        }
        go.countDown();
        int cleaned = 0;
        for (Future<Boolean> outcome : outcomes) {
            if (outcome.get()) {
                cleaned++;
            }
        }
        pool.shutdown();

        assertThat(cleaned).isEqualTo(1);
        assertThat(eventsOn(Topics.AGENT_KILLED)).hasSize(1);
        assertThat(manager.activeExecutions()).isEmpty();
        assertThat(manager.cleanup(spawned.handle())).isFalse();
    }

    // ------------------------------------------------------------------
    // Isolated processes
    // ------------------------------------------------------------------

    @Test
    void useAndKill_jvmEntryWithoutDirectAccess_runsInChildJvm() {
        installJvm("echo", EchoSkill.class);

        SkillRunResult result = manager.useAndKill("echo", "isolated", Duration.ofSeconds(60), "bob");

        assertThat(result.success()).as(String.valueOf(result.error())).isTrue();
        assertResultMap(result).containsEntry("task", "isolated").containsEntry("user_id", "bob");
        assertThat(eventsOn(Topics.AGENT_SPAWNED)).singleElement()
                .satisfies(e -> assertThat(e.payload()).containsEntry("mode", "isolated_process"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void useAndKill_shellSkill_readsTaskFromEnvironment() {
        installScript("greet", """
                cat > /dev/null
                printf '{"success": true, "result": "%s", "session_id": "%s"}\\n' "$SKILLBOX_TASK" "$SKILLBOX_SESSION_ID"
                """);

        SkillRunResult result = manager.useAndKill("greet", "hello there", Duration.ofSeconds(10), "alice");

        assertThat(result.success()).as(String.valueOf(result.error())).isTrue();
        assertThat(result.result()).isEqualTo("hello there");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void useAndKill_shellSkill_receivesContextOnStdin() {
        installScript("ctx", """
                input=$(cat)
                case "$input" in
                  *'"user_id":"u-7"'*) seen=yes ;;
                  *) seen=no ;;
                esac
                printf '{"success": true, "result": "%s"}\\n' "$seen"
                """);

        SkillRunResult result = manager.useAndKill("ctx", "t", Duration.ofSeconds(10), "u-7");

        assertThat(result.result()).isEqualTo("yes");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void useAndKill_shellSkill_seesFilteredEnvironment() {
        installScript("env", """
                cat > /dev/null
                printf '{"success": true, "result": "%s|%s"}\\n' "$SKILLBOX_NETWORK" "$SKILLBOX_PERMISSIONS"
                """, "fs_read");

        SkillRunResult result = manager.useAndKill("env", "t", Duration.ofSeconds(10), "alice");

        assertThat(result.result()).isEqualTo("blocked|fs_read");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void useAndKill_shellSkillExitingWithoutResult_reportsStderr() {
        installScript("dies", """
                cat > /dev/null
                echo "oops: missing input" 1>&2
                exit 3
                """);

        SkillRunResult result = manager.useAndKill("dies", "t", Duration.ofSeconds(10), "alice");

        assertThat(result.errorKind()).isEqualTo(SkillException.Kind.EXECUTION_FAILURE);
        assertThat(result.error()).contains("ended without result").contains("oops: missing input");
        assertThat(result.retryAvailable()).isTrue();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void useAndKill_shellSkill_onlyFirstTerminalMessageCounts() {
        installScript("chatty", """
                cat > /dev/null
                echo "progress 50%"
                printf '{"success": true, "result": "first"}\\n'
                printf '{"success": false, "error": "second"}\\n'
                """);

        SkillRunResult result = manager.useAndKill("chatty", "t", Duration.ofSeconds(10), "alice");

        assertThat(result.success()).isTrue();
        assertThat(result.result()).isEqualTo("first");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void useAndKill_shellSkill_outputIsCollectedAndSandboxRemoved() throws Exception {
        installScript("report", """
                cat > /dev/null
                printf 'quarterly numbers' > 'output/report.txt'
                printf '{"success": true, "result": "written"}\\n'
                """, "fs_write");

        SkillRunResult result = manager.useAndKill("report", "t", Duration.ofSeconds(10), "alice");

        assertThat(result.success()).as(String.valueOf(result.error())).isTrue();
        assertThat(paths.output().resolve("report").resolve("report.txt")).hasContent("quarterly numbers");
        try (Stream<Path> leftovers = Files.list(paths.sandbox())) {
            assertThat(leftovers).isEmpty();
        }
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void useAndKill_hangingShellSkill_isKilledOnTimeout() throws Exception {
        installScript("hang", """
                cat > /dev/null
                sleep 30
                """);

        SkillRunResult result = manager.useAndKill("hang", "t", Duration.ofMillis(300), "alice");

        assertThat(result.errorKind()).isEqualTo(SkillException.Kind.TIMEOUT);
        assertThat(ProcessHandle.of(result.handle()).map(ProcessHandle::isAlive).orElse(false)).isFalse();
        assertThat(manager.activeExecutions()).isEmpty();
        try (Stream<Path> leftovers = Files.list(paths.sandbox())) {
            assertThat(leftovers).isEmpty();
        }
    }
}
