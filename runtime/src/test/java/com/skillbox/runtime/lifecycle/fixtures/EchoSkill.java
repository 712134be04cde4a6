package com.skillbox.runtime.lifecycle.fixtures;

import com.skillbox.runtime.skill.SkillEntry;

import java.util.LinkedHashMap;
import java.util.Map;

/** Reports back what it was given. */
public class EchoSkill implements SkillEntry {

    @Override
    public Map<String, Object> execute(Map<String, Object> context) {
        Map<String, Object> echoed = new LinkedHashMap<>();
        echoed.put("task", context.get("task"));
        echoed.put("user_id", context.get("user_id"));
        echoed.put("session_id", context.get("session_id"));
        echoed.put("extra", context.get("extra"));
        echoed.put("has_credentials", context.containsKey("credentials"));
        echoed.put("has_credential_session", context.containsKey("credential_session"));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("result", echoed);
        return result;
    }
}
