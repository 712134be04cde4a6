package com.skillbox.runtime.skill;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/** Asynchronous variant of {@link SkillEntry}; same context and result contract. */
@FunctionalInterface
public interface AsyncSkillEntry {

    CompletionStage<Map<String, Object>> executeAsync(Map<String, Object> context);
}
