package com.rebill.api.platform.validation.annotations;

import com.rebill.api.platform.validation.HttpUrlValidator;
import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Validates the annotated {@link String} field as an absolute HTTP URL, e.g. the url where the
 * gateway's hosted payment form sends the customer back. {@code null} values are valid; combine it
 * with {@code @NotBlank} where the url is required.
 */
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Constraint(validatedBy = HttpUrlValidator.class)
public @interface HttpUrl {

    String message() default "must be an http or https url";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
