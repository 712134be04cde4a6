package com.skillbox.runtime.lifecycle.fixtures;

import com.skillbox.runtime.skill.SkillEntry;

import java.util.Map;

/** Returns the {@code api_key} credential it was handed. */
public class CredentialEchoSkill implements SkillEntry {

    @Override
    public Map<String, Object> execute(Map<String, Object> context) {
        Map<?, ?> credentials = (Map<?, ?>) context.get("credentials");
        if (credentials == null) {
            return Map.of("success", false, "error", "no credentials");
        }
        return Map.of("success", true, "result", credentials.get("api_key"));
    }
}
