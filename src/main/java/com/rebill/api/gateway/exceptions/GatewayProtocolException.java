package com.rebill.api.gateway.exceptions;

import com.rebill.api.platform.exceptions.BillingException;
import lombok.NonNull;

/**
 * Raised when the processor returned a malformed or unexpected response. Unlike a decline, the
 * request may be retried by an external supervisor.
 */
public class GatewayProtocolException extends BillingException {

    public static final String ERROR_CODE = "PROTOCOL_ERROR";

    public GatewayProtocolException(String message) {
        super(message);
    }

    public GatewayProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    @NonNull
    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }
}
