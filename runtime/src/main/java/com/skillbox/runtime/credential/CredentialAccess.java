package com.skillbox.runtime.credential;

import java.util.Map;

/**
 * Outcome of {@link CredentialVault#get}. A denial never carries credentials.
 *
 * @param credentials a private copy of the secrets; empty when denied
 */
public record CredentialAccess(
        boolean             granted,
        Map<String, String> credentials,
        DenialReason        denialReason,
        String              message) {

    public CredentialAccess {
        credentials = granted ? Map.copyOf(credentials) : Map.of();
    }

    public static CredentialAccess granted(Map<String, String> credentials) {
        return new CredentialAccess(true, credentials, null, "Credential access granted");
    }

    public static CredentialAccess denied(DenialReason reason, String message) {
        return new CredentialAccess(false, Map.of(), reason, message);
    }
}
