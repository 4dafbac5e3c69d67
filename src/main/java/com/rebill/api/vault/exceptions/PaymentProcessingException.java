package com.rebill.api.vault.exceptions;

import com.rebill.api.platform.exceptions.BillingException;
import lombok.Getter;
import lombok.NonNull;

import java.util.UUID;

/**
 * Thrown when charging a vault entry failed with an exception, e.g. when the gateway could not be
 * reached. Declined charges are reported as results instead.
 */
public class PaymentProcessingException extends BillingException {

    public static final String ERROR_CODE = "PAYMENT_PROCESSING_ERROR";

    @Getter
    @NonNull
    private final UUID vaultId;

    public PaymentProcessingException(@NonNull UUID vaultId, @NonNull Throwable cause) {
        super("payment processing failed: " + cause.getMessage(), cause);
        this.vaultId = vaultId;
    }

    @NonNull
    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }
}
