package com.skillbox.runtime.credential;

import com.skillbox.runtime.event.EventBus;
import com.skillbox.runtime.event.Topics;
import com.skillbox.runtime.skill.Permission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ephemeral secret store for skills.
 *
 * A caller {@link #store}s credentials for a skill and receives an opaque
 * session id, which it hands to the consumer out of band. The consumer
 * redeems it with {@link #get}, presenting the matching skill id. Every
 * refusal fails closed and is announced on {@link Topics#CREDENTIAL_EVENT}.
 *
 * <p>Secrets never outlive their TTL: expired sessions are erased on the next
 * {@code get} or by {@link #sweepExpired()}, which {@link CredentialSweeper}
 * runs on a fixed interval.
 *
 * <p>All state is guarded by one monitor. Events are published after it is
 * released, so a handler may call back into the vault.
 */
@Component
public class CredentialVault {

    private static final Logger log = LoggerFactory.getLogger(CredentialVault.class);

    private static final String SENDER = "credential-vault";
    private static final Set<Permission> CREDENTIAL_GATE =
            Set.of(Permission.NETWORK, Permission.CREDENTIALS);

    private final Object lock = new Object();
    private final Map<String, CredentialSet> sessions = new HashMap<>();
    private final Map<String, FailureCount> failedAttempts = new HashMap<>();
    private final Map<String, Tombstone> tombstones = new HashMap<>();

    private final EventBus      eventBus;
    private final Clock         clock;
    private final VaultSettings settings;
    private final SecureRandom  random = new SecureRandom();

    private long totalStored;
    private long totalGranted;
    private long totalDenied;
    private long totalErased;

    public CredentialVault(EventBus eventBus, Clock clock, VaultSettings settings) {
        this.eventBus = eventBus;
        this.clock    = clock;
        this.settings = settings;
        log.info("Credential vault ready (max ttl {}s, {} accesses, block after {} failures)",
                settings.maxTtl().toSeconds(), settings.maxAccesses(), settings.maxFailedAttempts());
    }

    // ------------------------------------------------------------------
    // Issue
    // ------------------------------------------------------------------

    public String store(String skillId, Map<String, String> credentials) {
        return store(skillId, credentials, settings.defaultTtl());
    }

    /**
     * Store credentials for {@code skillId}.
     *
     * @param ttl requested lifetime; clamped to the configured maximum
     * @return the session id the consumer must present to {@link #get}
     */
    public String store(String skillId, Map<String, String> credentials, Duration ttl) {
        Objects.requireNonNull(skillId, "skillId");
        Objects.requireNonNull(credentials, "credentials");
        Duration effective = ttl == null || ttl.isNegative() || ttl.isZero() ? settings.defaultTtl() : ttl;
        if (effective.compareTo(settings.maxTtl()) > 0) {
            log.debug("Clamping ttl {}s to {}s for skill {}", effective.toSeconds(), settings.maxTtl().toSeconds(), skillId);
            effective = settings.maxTtl();
        }

        Instant now = clock.instant();
        String sessionId = newSessionId(skillId, now);
        synchronized (lock) {
            sessions.put(sessionId, new CredentialSet(skillId, sessionId, credentials, now, now.plus(effective)));
            totalStored++;
        }
        log.info("Stored {} credential(s) for skill {} (ttl {}s)", credentials.size(), skillId, effective.toSeconds());
        return sessionId;
    }

    // ------------------------------------------------------------------
    // Redeem
    // ------------------------------------------------------------------

    /**
     * Redeem a session.
     *
     * Checks run in a fixed order: blocked, unknown, skill mismatch, expired,
     * access limit. Every refusal except an already-blocked session counts as
     * a failed attempt; the attempt that reaches the failure limit is itself
     * reported as blocked.
     */
    public CredentialAccess get(String sessionId, String skillId, String requesterId) {
        Instant now = clock.instant();
        CredentialAccess access;
        synchronized (lock) {
            access = evaluate(sessionId, skillId, now);
            if (access.granted()) {
                totalGranted++;
            } else {
                totalDenied++;
            }
        }

        String message = access.granted()
                ? "Credentials for " + skillId + " accessed"
                : access.message();
        CredentialEventType type = access.granted()
                ? CredentialEventType.ACCESS
                : access.denialReason().eventType();
        if (access.granted()) {
            log.info("Credential session for skill {} redeemed by {}", skillId, requesterId);
        } else {
            log.warn("Credential access denied for skill {} by {}: {}", skillId, requesterId, message);
        }
        notify(requesterId, skillId, type, message, now);
        return access;
    }

    private CredentialAccess evaluate(String sessionId, String skillId, Instant now) {
        FailureCount prior = failedAttempts.get(sessionId);
        int failures = prior == null ? 0 : prior.count();
        if (failures >= settings.maxFailedAttempts()) {
            failedAttempts.put(sessionId, new FailureCount(failures, now));
            return CredentialAccess.denied(DenialReason.BLOCKED,
                    "Session blocked after " + failures + " failed attempts");
        }

        CredentialSet set = sessions.get(sessionId);
        if (set == null) {
            Tombstone tombstone = tombstones.get(sessionId);
            if (tombstone != null) {
                return fail(sessionId, failures, now, tombstone.reason(), "Credential session no longer available: " + tombstone.reason().name().toLowerCase());
            }
            return fail(sessionId, failures, now, DenialReason.NOT_FOUND, "Unknown credential session");
        }
        if (!set.skillId().equals(skillId)) {
            return fail(sessionId, failures, now, DenialReason.SKILL_MISMATCH,
                    "Credential session was not issued to skill " + skillId);
        }
        if (set.isExpired(now)) {
            eraseLocked(sessionId, DenialReason.EXPIRED, now);
            return fail(sessionId, failures, now, DenialReason.EXPIRED, "Credential session expired");
        }
        if (set.accessCount() >= settings.maxAccesses()) {
            eraseLocked(sessionId, DenialReason.LIMIT_REACHED, now);
            return fail(sessionId, failures, now, DenialReason.LIMIT_REACHED,
                    "Access limit of " + settings.maxAccesses() + " reached");
        }
        return CredentialAccess.granted(set.redeem());
    }

    private CredentialAccess fail(String sessionId, int priorFailures, Instant now, DenialReason reason, String message) {
        int failures = priorFailures + 1;
        failedAttempts.put(sessionId, new FailureCount(failures, now));
        if (failures >= settings.maxFailedAttempts()) {
            return CredentialAccess.denied(DenialReason.BLOCKED,
                    message + "; session blocked after " + failures + " failed attempts");
        }
        return CredentialAccess.denied(reason, message);
    }

    // ------------------------------------------------------------------
    // Destroy
    // ------------------------------------------------------------------

    /**
     * Securely erase a session. Safe to call repeatedly.
     *
     * @return true if a live session was erased by this call
     */
    public boolean release(String sessionId) {
        synchronized (lock) {
            CredentialSet set = sessions.remove(sessionId);
            if (set == null) {
                return false;
            }
            set.erase(random);
            totalErased++;
        }
        log.debug("Released credential session {}", sessionId);
        return true;
    }

    /**
     * Erase every expired session and prune old tombstones. Failure counters
     * are dropped once their session is gone, no tombstone is left and the
     * last failure is older than the tombstone retention.
     *
     * @return number of sessions erased
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int erased = 0;
        synchronized (lock) {
            List<String> expired = new ArrayList<>();
            sessions.forEach((id, set) -> {
                if (set.isExpired(now)) {
                    expired.add(id);
                }
            });
            for (String id : expired) {
                eraseLocked(id, DenialReason.EXPIRED, now);
                erased++;
            }

            Instant cutoff = now.minus(settings.tombstoneRetention());
            Iterator<Map.Entry<String, Tombstone>> it = tombstones.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().at().isBefore(cutoff)) {
                    it.remove();
                }
            }
            failedAttempts.entrySet().removeIf(entry ->
                    !sessions.containsKey(entry.getKey())
                            && !tombstones.containsKey(entry.getKey())
                            && entry.getValue().lastAt().isBefore(cutoff));
        }
        if (erased > 0) {
            log.info("Swept {} expired credential session(s)", erased);
        }
        return erased;
    }

    private void eraseLocked(String sessionId, DenialReason reason, Instant now) {
        CredentialSet set = sessions.remove(sessionId);
        if (set != null) {
            set.erase(random);
            totalErased++;
        }
        tombstones.put(sessionId, new Tombstone(reason, now));
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    /** Session ids with a failure counter, live or not. */
    int trackedFailureCount() {
        synchronized (lock) {
            return failedAttempts.size();
        }
    }

    public VaultStats stats() {
        Instant now = clock.instant();
        synchronized (lock) {
            int expiredPending = (int) sessions.values().stream().filter(s -> s.isExpired(now)).count();
            int blocked = (int) failedAttempts.values().stream()
                    .filter(f -> f.count() >= settings.maxFailedAttempts()).count();
            return new VaultStats(sessions.size() - expiredPending, expiredPending, blocked,
                    totalStored, totalGranted, totalDenied, totalErased);
        }
    }

    /** Whether a skill with these permissions may be issued credentials at all. */
    public boolean canRequestCredentials(Set<Permission> permissions) {
        return permissions.stream().anyMatch(CREDENTIAL_GATE::contains);
    }

    // ------------------------------------------------------------------

    private String newSessionId(String skillId, Instant now) {
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        return skillId + "_" + now.toEpochMilli() + "_" + HexFormat.of().formatHex(bytes);
    }

    private void notify(String userId, String skillId, CredentialEventType type, String message, Instant at) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", userId);
        payload.put("skill_id", skillId);
        payload.put("event_type", type.wireName());
        payload.put("message", message);
        payload.put("timestamp", at.toString());
        eventBus.publish(Topics.CREDENTIAL_EVENT, payload, SENDER);
    }

    private record Tombstone(DenialReason reason, Instant at) {}

    private record FailureCount(int count, Instant lastAt) {}
}
