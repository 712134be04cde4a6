package com.skillbox.runtime.lifecycle.fixtures;

import com.skillbox.runtime.skill.AsyncSkillEntry;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

public class AsyncUpperSkill implements AsyncSkillEntry {

    @Override
    public CompletionStage<Map<String, Object>> executeAsync(Map<String, Object> context) {
        String task = String.valueOf(context.get("task"));
        return CompletableFuture.supplyAsync(() -> Map.of("success", true, "result", task.toUpperCase()));
    }
}
