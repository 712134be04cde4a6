package com.skillbox.runtime.gate;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Verdict of a {@link SkillValidator}. A failing report always carries at
 * least one reason.
 */
public record SafetyReport(
        boolean      ok,
        @JsonProperty("skill_id") String skillId,
        String       name,
        String       version,
        List<String> permissions,
        List<String> reasons) {

    public SafetyReport {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
        reasons     = reasons == null ? List.of() : List.copyOf(reasons);
        if (!ok && reasons.isEmpty()) {
            throw new IllegalArgumentException("A failing safety report needs at least one reason");
        }
    }

    public static SafetyReport passed(String skillId, String name, String version, List<String> permissions) {
        return new SafetyReport(true, skillId, name, version, permissions, List.of());
    }

    public static SafetyReport failed(String skillId, String name, String version,
                                      List<String> permissions, List<String> reasons) {
        return new SafetyReport(false, skillId, name, version, permissions, reasons);
    }

    /** Failure before anything about the skill is known. */
    public static SafetyReport failed(String reason) {
        return failed(null, null, null, List.of(), List.of(reason));
    }

    public SafetyReport withReason(String reason) {
        List<String> extended = new ArrayList<>(reasons);
        extended.add(reason);
        return new SafetyReport(ok, skillId, name, version, permissions, extended);
    }

    /** As {@link #withReason}, but also marks the report failed. */
    public SafetyReport failedWith(String reason) {
        List<String> extended = new ArrayList<>(reasons);
        extended.add(reason);
        return new SafetyReport(false, skillId, name, version, permissions, extended);
    }
}
