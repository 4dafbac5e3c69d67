package com.rebill.api.platform.validation.annotations;

import com.rebill.api.platform.validation.CustomerIdValidator;
import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Validates the annotated {@link String} field as a customer id: 3 to 255 characters made of
 * letters, digits, underscores and hyphens.
 */
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Constraint(validatedBy = CustomerIdValidator.class)
public @interface CustomerId {

    String message() default "must be a valid customer id";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
