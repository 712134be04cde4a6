package com.skillbox.runtime.lifecycle;

import com.skillbox.runtime.skill.SkillDescriptor;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Future;

/**
 * Bookkeeping for one tracked execution. Owned by
 * {@link SkillLifecycleManager}; removed exactly once, by cleanup.
 *
 * Exactly one of {@code process} and {@code task} is set, matching {@code mode}.
 * The stored context never contains redeemed credentials.
 */
final class ExecutionRecord {

    private final long                handle;
    private final SkillDescriptor     skill;
    private final String              sessionId;
    private final Map<String, Object> context;
    private final Instant             spawnedAt;
    private final ExecutionMode       mode;
    private final ResultChannel       channel;
    private final LaunchedProcess     process;
    private final Future<?>           task;
    private final String              credentialSession;

    private ExecutionRecord(long handle, SkillDescriptor skill, String sessionId, Map<String, Object> context,
                            Instant spawnedAt, ExecutionMode mode, ResultChannel channel,
                            LaunchedProcess process, Future<?> task, String credentialSession) {
        this.handle            = handle;
        this.skill             = skill;
        this.sessionId         = sessionId;
        this.context           = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.spawnedAt         = spawnedAt;
        this.mode              = mode;
        this.channel           = channel;
        this.process           = process;
        this.task              = task;
        this.credentialSession = credentialSession;
    }

    static ExecutionRecord forProcess(LaunchedProcess process, SkillDescriptor skill, String sessionId,
                                      Map<String, Object> context, Instant spawnedAt,
                                      ResultChannel channel, String credentialSession) {
        return new ExecutionRecord(process.process().pid(), skill, sessionId, context, spawnedAt,
                ExecutionMode.ISOLATED_PROCESS, channel, process, null, credentialSession);
    }

    static ExecutionRecord forTask(long handle, Future<?> task, SkillDescriptor skill, String sessionId,
                                   Map<String, Object> context, Instant spawnedAt,
                                   ResultChannel channel, String credentialSession) {
        return new ExecutionRecord(handle, skill, sessionId, context, spawnedAt,
                ExecutionMode.IN_PROCESS, channel, null, task, credentialSession);
    }

    long handle()               { return handle; }
    SkillDescriptor skill()     { return skill; }
    String skillId()            { return skill.id(); }
    String sessionId()          { return sessionId; }
    Map<String, Object> context() { return context; }
    Instant spawnedAt()         { return spawnedAt; }
    Duration maxLifetime()      { return skill.maxLifetime(); }
    ExecutionMode mode()        { return mode; }
    ResultChannel channel()     { return channel; }
    LaunchedProcess process()   { return process; }
    Future<?> task()            { return task; }
    String credentialSession()  { return credentialSession; }

    boolean isAlive() {
        return process != null ? process.isAlive() : !task.isDone();
    }

    ExecutionSnapshot snapshot() {
        return new ExecutionSnapshot(handle, skill.id(), sessionId, mode, spawnedAt,
                skill.maxLifetime().toSeconds(), isAlive());
    }
}
