package com.rebill.api.vault.exceptions;

import com.rebill.api.platform.exceptions.BillingException;
import lombok.NonNull;

import java.util.UUID;

/**
 * Thrown when a vault entry doesn't exist or is no longer active.
 */
public class VaultNotFoundException extends BillingException {

    public static final String ERROR_CODE = "VAULT_NOT_FOUND";

    public VaultNotFoundException(@NonNull UUID vaultId) {
        super(String.format("payment method '%s' not found or inactive", vaultId));
    }

    @NonNull
    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }
}
