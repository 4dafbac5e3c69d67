package com.rebill.api.platform.validation;

import com.rebill.api.platform.validation.annotations.HttpUrl;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import lombok.val;

import java.net.MalformedURLException;
import java.net.URL;

/**
 * Accepts {@code http} and {@code https} urls with a non-blank host. Blank values are left to
 * {@code @NotBlank}.
 */
public class HttpUrlValidator implements ConstraintValidator<HttpUrl, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null || value.isBlank()) {
            return true;
        }

        try {
            val url = new URL(value);
            val scheme = url.getProtocol();
            return ("http".equals(scheme) || "https".equals(scheme)) && !url.getHost().isBlank();
        } catch (MalformedURLException e) {
            return false;
        }
    }
}
