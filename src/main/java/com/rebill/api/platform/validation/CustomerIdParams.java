package com.rebill.api.platform.validation;

import com.rebill.api.platform.validation.annotations.CustomerId;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Wraps a lone customer id, e.g. a query parameter, for validation with {@link InputValidator}.
 */
@Data
@AllArgsConstructor
public class CustomerIdParams {

    @CustomerId
    private final String customerId;
}
