package com.rebill.api.platform.validation.annotations;

import com.rebill.api.platform.validation.CurrencyCodeValidator;
import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Validates the annotated {@link String} field as an ISO 4217 alphabetic currency code, i.e.
 * exactly 3 uppercase letters.
 */
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Constraint(validatedBy = CurrencyCodeValidator.class)
public @interface CurrencyCode {

    String message() default "must be 3 uppercase letters";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
