package com.rebill.api.platform.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rebill.api.platform.exceptions.BillingException;
import com.rebill.api.platform.exceptions.ValidationException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "ErrorResponse")
public class ErrorResponse {

    @Schema(required = true, description = "machine readable error code", example = "VALIDATION_ERROR")
    @NonNull
    private String code;

    @Schema(required = true, description = "human readable error description")
    @NonNull
    private String message;

    @Schema(description = "violation messages by field. only present for validation errors")
    private Map<String, List<String>> violations;

    @NonNull
    public static ErrorResponse from(@NonNull BillingException e) {
        return new ErrorResponse(
            e.getErrorCode(),
            e.getMessage(),
            e instanceof ValidationException ? ((ValidationException) e).getViolations() : null);
    }
}
