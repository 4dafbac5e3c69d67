package com.rebill.api.vault.models;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
@Schema(name = "VaultStatistics")
public class VaultStatistics {

    private final long total;
    private final long active;

    /**
     * Active card entries past their expiry month.
     */
    private final long expired;
}
