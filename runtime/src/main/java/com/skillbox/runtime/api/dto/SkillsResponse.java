package com.skillbox.runtime.api.dto;

import java.util.List;

/**
 * Response body for GET /skills.
 *
 * available lists every resolvable name (live, user and built-in);
 * installed details the skills promoted by the safety gate.
 */
public record SkillsResponse(List<String> available, List<SkillView> installed) {}
