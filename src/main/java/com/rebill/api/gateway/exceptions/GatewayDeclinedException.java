package com.rebill.api.gateway.exceptions;

import com.rebill.api.platform.exceptions.BillingException;
import lombok.Getter;
import lombok.NonNull;

/**
 * Raised from a {@code DECLINED} gateway result when the processor explicitly refused a request.
 * Declined requests must never be retried automatically.
 */
public class GatewayDeclinedException extends BillingException {

    public static final String ERROR_CODE = "DECLINED";

    @Getter
    private final String declineCode;

    public GatewayDeclinedException(String declineCode, String message) {
        super(message);
        this.declineCode = declineCode;
    }

    @NonNull
    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }
}
