package com.skillbox.runtime.skill;

/**
 * Where a skill was resolved from, in lookup priority order.
 *
 * LIVE    - promoted by the safety gate ({@code live/<id>/}).
 * USER    - flat module reference ({@code skills_user/<id>.<ext>}).
 * BUILTIN - shipped with the host ({@code builtin/}).
 */
public enum SkillOrigin {
    LIVE,
    USER,
    BUILTIN
}
