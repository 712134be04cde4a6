package com.skillbox.runtime.skill;

import java.util.Map;

/**
 * Entry point of a JVM skill ({@code "entry": "java:<class>"}).
 *
 * The context carries at least {@code task}, {@code user_id},
 * {@code timestamp} and {@code session_id}; skills granted the
 * {@code credentials} permission also find a {@code credentials} map.
 * The returned map must contain a boolean {@code success} plus either
 * {@code result} or {@code error}. A thrown exception is reported as a
 * failure carrying its message.
 *
 * Implementations need a public no-arg constructor.
 */
@FunctionalInterface
public interface SkillEntry {

    Map<String, Object> execute(Map<String, Object> context) throws Exception;
}
