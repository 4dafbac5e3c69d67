package com.rebill.api.vault;

import com.rebill.api.gateway.GatewayResult;
import com.rebill.api.gateway.exceptions.GatewayDeclinedException;
import com.rebill.api.gateway.exceptions.GatewayProtocolException;
import com.rebill.api.platform.exceptions.ValidationException;
import com.rebill.api.vault.exceptions.PaymentMethodExpiredException;
import com.rebill.api.vault.exceptions.PaymentProcessingException;
import com.rebill.api.vault.exceptions.VaultNotFoundException;
import com.rebill.api.vault.models.VaultStatistics;
import com.rebill.api.vault.payload.PaymentMethodResponse;
import com.rebill.api.vault.payload.StorePaymentMethodParams;
import com.rebill.api.vault.payload.VaultChargeParams;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST controller for payment vault related '{@code /v1/vault}' routes.
 */
@Validated
@RestController
@RequestMapping("/v1/vault")
@Tag(name = "vault")
class VaultController {

    private final VaultService vaultService;
    private final Clock clock;

    @Autowired
    VaultController(@NonNull VaultService vaultService, @NonNull Clock clock) {
        this.vaultService = vaultService;
        this.clock = clock;
    }

    /**
     * Stores a payment method token that the gateway issued for a customer. The customer's first
     * payment method becomes the default.
     */
    @Operation(summary = "Store a payment method")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "payment method stored"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "429", description = "too many requests", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping
    ResponseEntity<PaymentMethodResponse> storePaymentMethod(@Valid @NotNull @RequestBody StorePaymentMethodParams params)
        throws ValidationException {
        val entry = vaultService.storePaymentMethod(
            params.getCustomerId(),
            params.getGatewayCustomerId(),
            params.getPaymentMethodToken(),
            params.getDetails());

        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentMethodResponse.from(entry, LocalDate.now(clock)));
    }

    @Operation(summary = "List active payment methods of a customer")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping
    ResponseEntity<List<PaymentMethodResponse>> listPaymentMethods(@NotBlank @RequestParam String customerId)
        throws ValidationException {
        val today = LocalDate.now(clock);
        return ResponseEntity.ok(
            vaultService.listActive(customerId)
                .stream()
                .map(e -> PaymentMethodResponse.from(e, today))
                .collect(Collectors.toList()));
    }

    @Operation(summary = "Get the default payment method of a customer")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "customer has no default payment method", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/default")
    ResponseEntity<PaymentMethodResponse> getDefaultPaymentMethod(@NotBlank @RequestParam String customerId)
        throws ValidationException {
        val today = LocalDate.now(clock);
        return vaultService.getDefault(customerId)
            .map(e -> ResponseEntity.ok(PaymentMethodResponse.from(e, today)))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "Get a payment method")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "payment method doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/{vaultId}")
    ResponseEntity<PaymentMethodResponse> getPaymentMethod(@NonNull @PathVariable UUID vaultId) {
        val today = LocalDate.now(clock);
        return vaultService.getPaymentMethod(vaultId)
            .map(e -> ResponseEntity.ok(PaymentMethodResponse.from(e, today)))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "Make a payment method the default of its customer")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "payment method is now the default"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "payment method doesn't exist or is inactive", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PutMapping("/{vaultId}/default")
    ResponseEntity<Void> setDefaultPaymentMethod(@NonNull @PathVariable UUID vaultId) {
        return vaultService.setDefault(vaultId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @Operation(summary = "Deactivate a payment method")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "payment method deactivated"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "payment method doesn't exist or is inactive", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @DeleteMapping("/{vaultId}")
    ResponseEntity<Void> deactivatePaymentMethod(@NonNull @PathVariable UUID vaultId) {
        return vaultService.deactivate(vaultId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    /**
     * Charges a stored payment method without customer interaction.
     */
    @Operation(summary = "Charge a payment method")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "charge approved"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "402", description = "gateway declined the charge", content = @Content),
        @ApiResponse(responseCode = "404", description = "payment method doesn't exist or is inactive", content = @Content),
        @ApiResponse(responseCode = "422", description = "payment method has expired", content = @Content),
        @ApiResponse(responseCode = "502", description = "gateway is unavailable or misbehaving", content = @Content),
    })
    @NonNull
    @PostMapping("/{vaultId}/charges")
    ResponseEntity<GatewayResult> chargePaymentMethod(
        @NonNull @PathVariable UUID vaultId,
        @Valid @NotNull @RequestBody VaultChargeParams params
    ) throws ValidationException, VaultNotFoundException, PaymentMethodExpiredException, PaymentProcessingException,
        GatewayDeclinedException, GatewayProtocolException {
        val result = vaultService.chargeWithVault(vaultId, params.getAmount(), params.getCurrency(), params.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(result.orElseThrow());
    }

    @Operation(summary = "Get vault statistics")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/statistics")
    ResponseEntity<VaultStatistics> getStatistics() {
        return ResponseEntity.ok(vaultService.getStatistics());
    }
}
