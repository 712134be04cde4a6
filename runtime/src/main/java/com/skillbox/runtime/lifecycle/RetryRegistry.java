package com.skillbox.runtime.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Session id → one-shot retry action.
 *
 * Registering under an existing id replaces the earlier action. A retry is
 * consumed when popped, so each failure can be retried once.
 */
@Component
public class RetryRegistry {

    private static final Logger log = LoggerFactory.getLogger(RetryRegistry.class);

    private final ConcurrentHashMap<String, Supplier<SkillRunResult>> retries = new ConcurrentHashMap<>();

    public void register(String sessionId, Supplier<SkillRunResult> action) {
        if (retries.put(sessionId, action) != null) {
            log.debug("Replaced retry registered under {}", sessionId);
        }
    }

    public Optional<Supplier<SkillRunResult>> pop(String sessionId) {
        return Optional.ofNullable(retries.remove(sessionId));
    }

    /** Pop and run the retry; a structured failure when none is registered. */
    public SkillRunResult retry(String sessionId) {
        return pop(sessionId)
                .map(action -> {
                    log.info("Retrying session {}", sessionId);
                    return action.get();
                })
                .orElseGet(() -> {
                    log.info("No retry available for session {}", sessionId);
                    return SkillRunResult.noRetryAvailable(sessionId);
                });
    }

    public boolean contains(String sessionId) {
        return retries.containsKey(sessionId);
    }

    public Set<String> pendingSessions() {
        return Set.copyOf(retries.keySet());
    }
}
