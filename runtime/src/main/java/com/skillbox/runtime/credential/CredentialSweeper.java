package com.skillbox.runtime.credential;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background sweep that bounds secret lifetime even when a consumer crashes
 * without releasing its session.
 *
 * Runs on Spring's scheduler thread, independent of any caller. Both the
 * vault and this component are singletons, so exactly one sweep exists per
 * application context.
 */
@Component
@EnableScheduling
public class CredentialSweeper {

    private static final Logger log = LoggerFactory.getLogger(CredentialSweeper.class);

    private final CredentialVault vault;

    public CredentialSweeper(CredentialVault vault) {
        this.vault = vault;
    }

    @Scheduled(fixedDelayString = "${skillbox.vault.sweep-interval-ms:60000}",
               initialDelayString = "${skillbox.vault.sweep-interval-ms:60000}")
    public void sweep() {
        try {
            vault.sweepExpired();
        } catch (RuntimeException e) {
            log.error("Credential sweep failed: {}", e.getMessage(), e);
        }
    }
}
