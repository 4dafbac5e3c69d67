package com.rebill.api.platform.validation;

import com.rebill.api.platform.validation.annotations.CurrencyCode;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

/**
 * Validates a {@link String} as a 3 uppercase letter currency code.
 */
public class CurrencyCodeValidator implements ConstraintValidator<CurrencyCode, String> {

    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value != null && CURRENCY.matcher(value).matches()) {
            return true;
        }

        if (value == null || value.isBlank()) {
            context.disableDefaultConstraintViolation();
            context.buildConstraintViolationWithTemplate("must not be blank").addConstraintViolation();
        }

        return false;
    }
}
