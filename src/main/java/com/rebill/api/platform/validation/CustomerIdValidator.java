package com.rebill.api.platform.validation;

import com.rebill.api.platform.validation.annotations.CustomerId;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates a {@link String} as a customer id. It reports each broken rule as a separate
 * violation.
 */
public class CustomerIdValidator implements ConstraintValidator<CustomerId, String> {

    static final int MIN_LENGTH = 3;
    static final int MAX_LENGTH = 255;
    private static final Pattern ALLOWED = Pattern.compile("^[a-zA-Z0-9_-]+$");

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        final List<String> messages = new ArrayList<>();
        if (value == null || value.isBlank()) {
            messages.add("must not be blank");
        } else {
            if (value.length() < MIN_LENGTH || value.length() > MAX_LENGTH) {
                messages.add(String.format("length must be between %d and %d", MIN_LENGTH, MAX_LENGTH));
            }

            if (!ALLOWED.matcher(value).matches()) {
                messages.add("can only contain letters, numbers, underscores, and hyphens");
            }
        }

        if (messages.isEmpty()) {
            return true;
        }

        context.disableDefaultConstraintViolation();
        messages.forEach(m -> context.buildConstraintViolationWithTemplate(m).addConstraintViolation());
        return false;
    }
}
