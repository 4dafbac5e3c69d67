package com.rebill.api.platform.exceptions;

import lombok.Getter;
import lombok.NonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown by service entry points when their inputs are not valid. It lists every violated field
 * with all of its violation messages, not just the first failure.
 */
public class ValidationException extends BillingException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    @Getter
    private final Map<String, List<String>> violations;

    public ValidationException(@NonNull Map<String, List<String>> violations) {
        super("invalid input: " + describe(violations));
        this.violations = Collections.unmodifiableMap(new LinkedHashMap<>(violations));
    }

    @NonNull
    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }

    private static String describe(Map<String, List<String>> violations) {
        return violations.entrySet()
            .stream()
            .map(e -> e.getKey() + ": " + String.join(", ", e.getValue()))
            .collect(Collectors.joining("; "));
    }
}
