package com.skillbox.runtime.api.dto;

import java.util.Map;

/**
 * Request body for POST /credentials.
 *
 * @param ttlSec optional; clamped by the vault to its maximum TTL
 */
public record StoreCredentialsRequest(String skillId, Map<String, String> credentials, Integer ttlSec) {}
