package com.rebill.api.gateway.exceptions;

import com.rebill.api.platform.exceptions.BillingException;
import lombok.NonNull;

/**
 * Thrown by the gateway client when a request could not reach the payment processor or its
 * response could not be received, e.g. on timeouts, I/O failures and non-2xx HTTP responses.
 */
public class GatewayCommunicationException extends BillingException {

    public static final String ERROR_CODE = "TRANSPORT_ERROR";

    public GatewayCommunicationException(String message, Throwable cause) {
        super(message, cause);
    }

    @NonNull
    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }
}
