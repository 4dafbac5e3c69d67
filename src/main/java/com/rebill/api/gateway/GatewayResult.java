package com.rebill.api.gateway;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.rebill.api.gateway.exceptions.GatewayDeclinedException;
import com.rebill.api.gateway.exceptions.GatewayProtocolException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * Normalised outcome of a {@link GatewayClient} operation. The {@link #status} tags which of the
 * three outcomes occurred; the remaining fields are populated depending on the operation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "GatewayResult")
public class GatewayResult {

    @Schema(required = true, description = "outcome of the gateway request")
    @NonNull
    private Status status;

    @Schema(description = "processor result code for declines, or an error code for failures")
    private String code;

    @Schema(description = "human readable outcome description")
    private String message;

    @Schema(description = "gateway assigned transaction id")
    private String transactionId;

    @Schema(description = "approved or charged amount")
    private BigDecimal amount;

    @Schema(description = "ISO 4217 currency code of the amount")
    private String currency;

    @Schema(description = "last 4 digits of the card used, or '****' when the gateway doesn't expose them")
    private String maskedCardLast4;

    @Schema(description = "hosted form url to collect card details. only present for initialized charges")
    private String formUrl;

    @NonNull
    public static GatewayResult declined(String code, String message) {
        return GatewayResult.builder()
            .status(Status.DECLINED)
            .code(code)
            .message(message)
            .build();
    }

    @NonNull
    public static GatewayResult error(String code, String message) {
        return GatewayResult.builder()
            .status(Status.ERROR)
            .code(code)
            .message(message)
            .build();
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return status == Status.SUCCESS;
    }

    /**
     * @return {@literal true} only for {@link Status#ERROR} results. Declines are final.
     */
    @JsonIgnore
    public boolean isRetryable() {
        return status == Status.ERROR;
    }

    /**
     * Returns this result if it is successful and converts it to the matching exception otherwise.
     *
     * @throws GatewayDeclinedException if the processor declined the request.
     * @throws GatewayProtocolException if the processor failed to process the request.
     */
    @NonNull
    public GatewayResult orElseThrow() throws GatewayDeclinedException, GatewayProtocolException {
        switch (status) {
            case SUCCESS:
                return this;
            case DECLINED:
                throw new GatewayDeclinedException(code, message);
            case ERROR:
                throw new GatewayProtocolException(message);
            default:
                throw new IllegalStateException("unknown gateway result status: " + status);
        }
    }

    public enum Status {
        SUCCESS,
        DECLINED,
        ERROR,
    }
}
