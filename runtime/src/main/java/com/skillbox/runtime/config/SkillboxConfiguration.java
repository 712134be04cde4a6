package com.skillbox.runtime.config;

import com.skillbox.runtime.credential.VaultSettings;
import com.skillbox.runtime.gate.GateSettings;
import com.skillbox.runtime.lifecycle.LifecycleSettings;
import com.skillbox.runtime.sandbox.SandboxPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Composition root for the runtime's settings.
 *
 * The vault, bus, gate and lifecycle manager are singletons created by Spring
 * and handed to each other through their constructors; nothing in the
 * runtime reaches them through static state.
 */
@Configuration
public class SkillboxConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SkillboxConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SkillboxPaths skillboxPaths(@Value("${skillbox.data-dir}") String dataDir) {
        SkillboxPaths paths = new SkillboxPaths(Path.of(dataDir)).ensureDirectories();
        log.info("Skillbox data directory: {}", paths.dataDir());
        return paths;
    }

    @Bean
    public VaultSettings vaultSettings(
            @Value("${skillbox.vault.max-ttl-sec:600}")       long maxTtlSec,
            @Value("${skillbox.vault.default-ttl-sec:300}")   long defaultTtlSec,
            @Value("${skillbox.vault.max-accesses:10}")       int maxAccesses,
            @Value("${skillbox.vault.max-failed-attempts:3}") int maxFailedAttempts,
            @Value("${skillbox.vault.tombstone-retention-sec:3600}") long tombstoneRetentionSec) {
        return new VaultSettings(Duration.ofSeconds(maxTtlSec), Duration.ofSeconds(defaultTtlSec),
                maxAccesses, maxFailedAttempts, Duration.ofSeconds(tombstoneRetentionSec));
    }

    @Bean
    public LifecycleSettings lifecycleSettings(
            @Value("${skillbox.lifecycle.poll-interval-ms:50}")    long pollIntervalMs,
            @Value("${skillbox.lifecycle.result-ceiling-sec:60}")  long resultCeilingSec,
            @Value("${skillbox.lifecycle.kill-grace-sec:5}")       long killGraceSec) {
        return new LifecycleSettings(Duration.ofMillis(pollIntervalMs),
                Duration.ofSeconds(resultCeilingSec), Duration.ofSeconds(killGraceSec));
    }

    @Bean
    public GateSettings gateSettings(
            @Value("${skillbox.gate.max-archive-bytes:15728640}")      long maxArchiveBytes,
            @Value("${skillbox.gate.max-entries:60}")                  int maxEntries,
            @Value("${skillbox.gate.max-uncompressed-bytes:41943040}") long maxUncompressedBytes) {
        return new GateSettings(maxArchiveBytes, maxEntries, maxUncompressedBytes);
    }

    @Bean
    public SandboxPolicy sandboxPolicy(@Value("${skillbox.sandbox.extra-env:}") String extraEnv) {
        List<String> extras = Arrays.stream(extraEnv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return new SandboxPolicy(extras, System.getenv());
    }
}
