package com.skillbox.runtime.lifecycle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbox.runtime.skill.SkillEntryInvoker;
import com.skillbox.runtime.skill.SkillException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Child-JVM entry point for isolated JVM skills.
 *
 * Reads the context from stdin, runs the entry class named by the single
 * argument and prints exactly one terminal JSON line tagged with the
 * session id. Failures of any kind are reported in that line; the exit code
 * is non-zero only for a usage error.
 */
public final class SkillProcessMain {

    private SkillProcessMain() {}

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("usage: SkillProcessMain <entry-class>");
            System.exit(2);
        }
        ObjectMapper mapper = new ObjectMapper();
        Map<String, Object> message = new LinkedHashMap<>();
        String sessionId = null;
        try {
            Map<String, Object> context = mapper.readValue(System.in, new TypeReference<>() {});
            Object session = context.get("session_id");
            sessionId = session == null ? null : session.toString();

            Object entry = SkillEntryInvoker.instantiate(args[0], SkillProcessMain.class.getClassLoader());
            Map<String, Object> result = SkillEntryInvoker.invoke(entry, context);
            if (result == null) {
                message.put("success", false);
                message.put("error", "skill returned no result");
            } else {
                message.putAll(result);
            }
        } catch (SkillException e) {
            message.put("success", false);
            message.put("error", e.getDetail());
        } catch (Exception | LinkageError e) {
            e.printStackTrace();
            message.put("success", false);
            message.put("error", InProcessRunner.describe(e));
        }
        message.put("session_id", sessionId);

        String line;
        try {
            line = mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            Map<String, Object> fallback = new LinkedHashMap<>();
            fallback.put("success", false);
            fallback.put("error", "result is not serialisable: " + e.getOriginalMessage());
            fallback.put("session_id", sessionId);
            try {
                line = mapper.writeValueAsString(fallback);
            } catch (JsonProcessingException impossible) {
                throw new IllegalStateException(impossible);
            }
        }
        System.out.println(line);
        System.out.flush();
        System.exit(0);
    }
}
