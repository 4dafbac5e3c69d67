package com.rebill.api.platform;

import com.rebill.api.gateway.exceptions.GatewayCommunicationException;
import com.rebill.api.gateway.exceptions.GatewayDeclinedException;
import com.rebill.api.gateway.exceptions.GatewayProtocolException;
import com.rebill.api.platform.exceptions.BillingException;
import com.rebill.api.platform.exceptions.ValidationException;
import com.rebill.api.platform.payload.ErrorResponse;
import com.rebill.api.vault.exceptions.PaymentProcessingException;
import com.rebill.api.vault.exceptions.VaultNotFoundException;
import jakarta.validation.ConstraintViolationException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;


/**
 * Exception handlers for common, global handled and unhandled errors.
 */
@RestControllerAdvice
@Slf4j
public class GlobalControllerAdvice {

    @ExceptionHandler(Throwable.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    void handleInternalError(@NonNull final Throwable e) {
        log.error("uncaught exception while processing the request", e);
    }

    @ExceptionHandler(ValidationException.class)
    ResponseEntity<ErrorResponse> handleValidation(@NonNull final ValidationException e) {
        log.trace("service input is not valid", e);
        return ResponseEntity.badRequest().body(ErrorResponse.from(e));
    }

    @ExceptionHandler(GatewayDeclinedException.class)
    ResponseEntity<ErrorResponse> handleDeclined(@NonNull final GatewayDeclinedException e) {
        log.debug("payment declined by the gateway: {}", e.getDeclineCode());
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(ErrorResponse.from(e));
    }

    @ExceptionHandler(VaultNotFoundException.class)
    ResponseEntity<ErrorResponse> handleVaultNotFound(@NonNull final VaultNotFoundException e) {
        log.trace("vault entry not found", e);
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.from(e));
    }

    @ExceptionHandler({
        GatewayCommunicationException.class,
        GatewayProtocolException.class,
        PaymentProcessingException.class
    })
    ResponseEntity<ErrorResponse> handleGatewayFailure(@NonNull final BillingException e) {
        log.warn("gateway request failed with {}", e.getErrorCode(), e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorResponse.from(e));
    }

    /**
     * Fallback for the remaining billing exceptions, e.g. an expired payment method.
     */
    @ExceptionHandler(BillingException.class)
    ResponseEntity<ErrorResponse> handleBillingError(@NonNull final BillingException e) {
        log.debug("billing operation failed with {}", e.getErrorCode(), e);
        return ResponseEntity.unprocessableEntity().body(ErrorResponse.from(e));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    @ResponseStatus(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
    void handleHttpMediaTypeNotSupported(@NonNull final HttpMediaTypeNotSupportedException e) {
        log.trace("http media type not supported", e);
    }

    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    @ResponseStatus(HttpStatus.NOT_ACCEPTABLE)
    void handleHttpMediaNotAcceptable(@NonNull final HttpMediaTypeNotAcceptableException e) {
        log.trace("http media not acceptable", e);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    @ResponseStatus(HttpStatus.METHOD_NOT_ALLOWED)
    void handleHttpRequestMethodNotSupported(final HttpRequestMethodNotSupportedException e) {
        log.trace("http method not supported", e);
    }

    @ExceptionHandler(NoHandlerFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    void handleNotFound(final NoHandlerFoundException e) {
        log.trace("http handler not found", e);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        ServletRequestBindingException.class,
        BindException.class,
        MissingRequestHeaderException.class,
        TypeMismatchException.class,
        MethodArgumentNotValidException.class,
        ConstraintViolationException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    void handleBadRequest(final Throwable e) {
        log.trace("http request is not valid", e);
    }
}
