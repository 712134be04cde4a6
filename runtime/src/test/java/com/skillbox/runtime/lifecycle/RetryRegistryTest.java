package com.skillbox.runtime.lifecycle;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RetryRegistryTest {

    final RetryRegistry registry = new RetryRegistry();

    @Test
    void retry_runsRegisteredActionOnce() {
        AtomicInteger runs = new AtomicInteger();
        registry.register("sess-1", () -> {
            runs.incrementAndGet();
            return SkillRunResult.success("s1", "sess-2", 12L, "ok", 0.1);
        });

        SkillRunResult first = registry.retry("sess-1");
        SkillRunResult second = registry.retry("sess-1");

        assertThat(first.success()).isTrue();
        assertThat(second.success()).isFalse();
        assertThat(second.error()).isEqualTo("No retry available for session sess-1");
        assertThat(runs).hasValue(1);
    }

    @Test
    void register_sameSession_replacesEarlierAction() {
        registry.register("sess-1", () -> SkillRunResult.noRetryAvailable("old"));
        registry.register("sess-1", () -> SkillRunResult.success("s1", "new", 1L, "latest", 0.0));

        assertThat(registry.pendingSessions()).containsExactly("sess-1");
        assertThat(registry.retry("sess-1").result()).isEqualTo("latest");
        assertThat(registry.contains("sess-1")).isFalse();
    }

    @Test
    void pop_unknownSession_isEmpty() {
        assertThat(registry.pop("missing")).isEmpty();
    }
}
