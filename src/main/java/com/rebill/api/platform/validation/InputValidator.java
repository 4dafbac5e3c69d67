package com.rebill.api.platform.validation;

import com.rebill.api.platform.exceptions.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.NonNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Programmatic bean validation for service entry points. Every public service operation validates
 * its own inputs with it, even when the web layer has already validated them.
 */
@Component
public class InputValidator {

    private final Validator validator;

    @Autowired
    public InputValidator(@NonNull Validator validator) {
        this.validator = validator;
    }

    /**
     * Collects all constraint violations of the given object, grouped by property path. The
     * returned map is mutable so that callers can add violations of rules that can not be
     * expressed as annotations.
     *
     * @param params a not {@literal null} object with bean validation annotations.
     * @return a not {@literal null}, possibly empty, sorted map of property path to messages.
     */
    @NonNull
    public <T> Map<String, List<String>> violationsOf(@NonNull T params) {
        final Map<String, List<String>> violations = new TreeMap<>();
        validator.validate(params)
            .stream()
            .sorted(Comparator.comparing((ConstraintViolation<T> v) -> v.getPropertyPath().toString())
                .thenComparing(ConstraintViolation::getMessage))
            .forEach(v -> addViolation(violations, v.getPropertyPath().toString(), v.getMessage()));

        return violations;
    }

    /**
     * @throws ValidationException if the given object violates any of its constraints.
     */
    public <T> void validate(@NonNull T params) throws ValidationException {
        requireNoViolations(violationsOf(params));
    }

    /**
     * @throws ValidationException if {@code violations} is not empty.
     */
    public void requireNoViolations(@NonNull Map<String, List<String>> violations) throws ValidationException {
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    public static void addViolation(
        @NonNull Map<String, List<String>> violations,
        @NonNull String field,
        @NonNull String message
    ) {
        violations.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
    }
}
