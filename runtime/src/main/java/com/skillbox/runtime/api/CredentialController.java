package com.skillbox.runtime.api;

import com.skillbox.runtime.api.dto.CredentialSessionResponse;
import com.skillbox.runtime.api.dto.StoreCredentialsRequest;
import com.skillbox.runtime.credential.CredentialVault;
import com.skillbox.runtime.credential.VaultStats;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;

/**
 * Issue and revoke credential sessions.
 *
 * POST   /credentials              - store secrets for a skill, returns the session id
 * DELETE /credentials/{sessionId}  - erase a session now
 * GET    /credentials/stats        - vault counters (never secrets)
 *
 * Secrets are only ever redeemed by the lifecycle manager on behalf of a
 * skill; no endpoint returns them.
 */
@RestController
@RequestMapping("/credentials")
public class CredentialController {

    private final CredentialVault vault;

    public CredentialController(CredentialVault vault) {
        this.vault = vault;
    }

    @PostMapping
    public ResponseEntity<CredentialSessionResponse> store(@RequestBody StoreCredentialsRequest req) {
        if (req.skillId() == null || req.skillId().isBlank() || req.credentials() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "skillId and credentials are required");
        }
        Duration ttl = req.ttlSec() == null ? null : Duration.ofSeconds(req.ttlSec());
        String sessionId = vault.store(req.skillId(), req.credentials(), ttl);
        return ResponseEntity.status(HttpStatus.CREATED).body(new CredentialSessionResponse(sessionId, req.skillId()));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> release(@PathVariable String sessionId) {
        if (!vault.release(sessionId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No active credential session: " + sessionId);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/stats")
    public VaultStats stats() {
        return vault.stats();
    }
}
