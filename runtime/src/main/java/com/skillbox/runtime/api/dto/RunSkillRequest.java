package com.skillbox.runtime.api.dto;

/**
 * Request body for POST /skills/{name}/runs.
 *
 * @param task       plain text, or a JSON object string whose keys are merged into the skill context
 * @param timeoutSec optional wait bound; defaults to the skill's declared max lifetime
 */
public record RunSkillRequest(String task, String userId, Integer timeoutSec) {}
