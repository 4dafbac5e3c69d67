package com.rebill.api.vault.exceptions;

import com.rebill.api.platform.exceptions.BillingException;
import lombok.NonNull;

import java.util.UUID;

public class PaymentMethodExpiredException extends BillingException {

    public static final String ERROR_CODE = "PAYMENT_METHOD_EXPIRED";

    public PaymentMethodExpiredException(@NonNull UUID vaultId) {
        super(String.format("payment method '%s' has expired", vaultId));
    }

    @NonNull
    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }
}
