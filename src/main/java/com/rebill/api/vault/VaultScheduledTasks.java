package com.rebill.api.vault;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Collection of scheduled tasks for {@link VaultService}.
 */
@Component
@Slf4j
class VaultScheduledTasks {

    private final VaultService vaultService;

    @Autowired
    VaultScheduledTasks(@NonNull VaultService vaultService) {
        this.vaultService = vaultService;
    }

    @Scheduled(cron = "${app.vault.cleanup-schedule}")
    void cleanupExpired() {
        log.info("performing expired payment method cleanup");
        val count = vaultService.cleanupExpired();
        log.info("deactivated {} expired payment methods", count);
    }
}
