package com.skillbox.runtime.api.dto;

import com.skillbox.runtime.skill.Permission;
import com.skillbox.runtime.skill.SkillDescriptor;

import java.util.List;

public record SkillView(
        String       id,
        String       name,
        String       version,
        List<String> permissions,
        String       entry,
        long         maxLifetimeSec,
        String       origin) {

    public static SkillView from(SkillDescriptor d) {
        return new SkillView(
                d.id(),
                d.name(),
                d.version(),
                d.permissions().stream().map(Permission::wireName).sorted().toList(),
                d.entry(),
                d.maxLifetime().toSeconds(),
                d.origin().name());
    }
}
