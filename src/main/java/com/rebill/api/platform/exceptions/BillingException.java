package com.rebill.api.platform.exceptions;

import lombok.NonNull;

/**
 * Base type of the checked exceptions thrown by the billing, vault and gateway services. Each
 * subtype carries a stable machine-readable {@link #getErrorCode() error code} next to its human
 * readable message so that the boundary layer can render it without re-deriving context.
 */
public abstract class BillingException extends Exception {

    protected BillingException(String message) {
        super(message);
    }

    protected BillingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return a not {@literal null} upper snake case error code, e.g. {@code VALIDATION_ERROR}.
     */
    @NonNull
    public abstract String getErrorCode();
}
