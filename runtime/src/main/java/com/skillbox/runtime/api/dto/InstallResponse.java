package com.skillbox.runtime.api.dto;

import com.skillbox.runtime.gate.InstallResult;

import java.util.List;

/** Response body for POST /submissions. */
public record InstallResponse(
        String       state,
        boolean      ok,
        String       skillId,
        String       version,
        List<String> reasons,
        String       location) {

    public static InstallResponse from(InstallResult r) {
        return new InstallResponse(
                r.state().name(),
                r.ok(),
                r.report().skillId(),
                r.report().version(),
                r.report().reasons(),
                r.location() == null ? null : r.location().toString());
    }
}
