package com.rebill.api.gateway;

import com.rebill.api.gateway.entities.PaymentTransactionRepository;
import com.rebill.api.gateway.exceptions.GatewayCommunicationException;
import com.rebill.api.gateway.exceptions.GatewayDeclinedException;
import com.rebill.api.gateway.exceptions.GatewayProtocolException;
import com.rebill.api.gateway.payload.CompleteChargeParams;
import com.rebill.api.gateway.payload.InitializeChargeParams;
import com.rebill.api.gateway.payload.RefundRequest;
import com.rebill.api.gateway.payload.TransactionResponse;
import com.rebill.api.platform.exceptions.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the interactive '{@code /v1/charges}' routes. The customer enters card
 * details on the gateway's hosted form between {@link #initializeCharge} and
 * {@link #completeCharge}.
 */
@Validated
@RestController
@RequestMapping("/v1/charges")
@Slf4j
@Tag(name = "charge")
class ChargeController {

    private final GatewayClient gatewayClient;
    private final PaymentTransactionRepository transactionRepository;

    @Autowired
    ChargeController(@NonNull GatewayClient gatewayClient, @NonNull PaymentTransactionRepository transactionRepository) {
        this.gatewayClient = gatewayClient;
        this.transactionRepository = transactionRepository;
    }

    /**
     * Starts a charge and returns the url of the gateway's hosted payment form. The form posts
     * card details directly to the gateway and then redirects the customer to {@code redirectUrl}
     * with a {@code token-id} query parameter.
     */
    @Operation(summary = "Initialize a charge")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "charge initialized"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "402", description = "gateway declined the request", content = @Content),
        @ApiResponse(responseCode = "429", description = "too many requests", content = @Content),
        @ApiResponse(responseCode = "502", description = "gateway is unavailable or misbehaving", content = @Content),
    })
    @NonNull
    @PostMapping
    ResponseEntity<GatewayResult> initializeCharge(@Valid @NotNull @RequestBody InitializeChargeParams params)
        throws ValidationException, GatewayCommunicationException, GatewayDeclinedException, GatewayProtocolException {
        val result = gatewayClient.initializeCharge(
            params.getAmount(),
            params.getCurrency(),
            params.getRedirectUrl(),
            params.getBilling(),
            params.getShipping());

        return ResponseEntity.status(HttpStatus.CREATED).body(result.orElseThrow());
    }

    @Operation(summary = "Complete an initialized charge")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "charge approved"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "402", description = "gateway declined the charge", content = @Content),
        @ApiResponse(responseCode = "429", description = "too many requests", content = @Content),
        @ApiResponse(responseCode = "502", description = "gateway is unavailable or misbehaving", content = @Content),
    })
    @NonNull
    @PostMapping("/complete")
    ResponseEntity<GatewayResult> completeCharge(@Valid @NotNull @RequestBody CompleteChargeParams params)
        throws ValidationException, GatewayCommunicationException, GatewayDeclinedException, GatewayProtocolException {
        return ResponseEntity.ok(gatewayClient.completeCharge(params.getTokenId()).orElseThrow());
    }

    /**
     * Refunds a previous charge, fully or partially.
     *
     * @param transactionId gateway assigned id of the charge to refund.
     */
    @Operation(summary = "Refund a charge")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "refund approved"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "402", description = "gateway declined the refund", content = @Content),
        @ApiResponse(responseCode = "429", description = "too many requests", content = @Content),
        @ApiResponse(responseCode = "502", description = "gateway is unavailable or misbehaving", content = @Content),
    })
    @NonNull
    @PostMapping("/{transactionId}/refunds")
    ResponseEntity<GatewayResult> refund(
        @NotBlank @PathVariable String transactionId,
        @Valid @NotNull @RequestBody RefundRequest params
    ) throws ValidationException, GatewayCommunicationException, GatewayDeclinedException, GatewayProtocolException {
        val result = gatewayClient.refund(transactionId, params.getAmount()).orElseThrow();
        log.info("refunded transaction '{}' with '{}'", transactionId, result.getTransactionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    /**
     * Lists the locally recorded gateway transactions, newest first.
     *
     * @param page 0-indexed page number.
     * @param size page size.
     */
    @Operation(summary = "List recorded transactions")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "429", description = "too many requests", content = @Content),
    })
    @NonNull
    @GetMapping
    ResponseEntity<List<TransactionResponse>> listTransactions(
        @Min(0) @RequestParam(defaultValue = "0") int page,
        @Min(1) @Max(100) @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(
            transactionRepository.findAllNewestFirst(PageRequest.of(page, size))
                .stream()
                .map(TransactionResponse::from)
                .collect(Collectors.toList()));
    }
}
