package com.skillbox.runtime.lifecycle.fixtures;

import com.skillbox.runtime.skill.SkillEntry;

import java.util.Map;

/** Sleeps far longer than any test waits. */
public class SlowSkill implements SkillEntry {

    @Override
    public Map<String, Object> execute(Map<String, Object> context) throws InterruptedException {
        Thread.sleep(30_000);
        return Map.of("success", true, "result", "too late");
    }
}
