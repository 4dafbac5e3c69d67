package com.rebill.api.subscription;

import com.rebill.api.platform.exceptions.ValidationException;
import com.rebill.api.subscription.models.SubscriptionStatistics;
import com.rebill.api.subscription.payload.CreateSubscriptionParams;
import com.rebill.api.subscription.payload.SubscriptionResponse;
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
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST controller for subscription related '{@code /v1/subscriptions}' routes.
 */
@Validated
@RestController
@RequestMapping("/v1/subscriptions")
@Tag(name = "subscription")
class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @Autowired
    SubscriptionController(@NonNull SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    /**
     * Creates an active subscription. The first charge is due one billing interval after its
     * creation.
     */
    @Operation(summary = "Create a subscription")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "subscription created"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "429", description = "too many requests", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping
    ResponseEntity<SubscriptionResponse> createSubscription(@Valid @NotNull @RequestBody CreateSubscriptionParams params)
        throws ValidationException {
        val subscription = subscriptionService.createSubscription(
            params.getCustomerId(),
            params.getAmount(),
            params.getCurrency(),
            params.getFrequency(),
            params.getMetadata());

        return ResponseEntity.status(HttpStatus.CREATED).body(SubscriptionResponse.from(subscription));
    }

    /**
     * Lists the active subscriptions of a customer, newest first.
     */
    @Operation(summary = "List customer subscriptions")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "429", description = "too many requests", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping
    ResponseEntity<List<SubscriptionResponse>> listSubscriptions(@NotBlank @RequestParam String customerId)
        throws ValidationException {
        return ResponseEntity.ok(
            subscriptionService.listCustomerSubscriptions(customerId)
                .stream()
                .map(SubscriptionResponse::from)
                .collect(Collectors.toList()));
    }

    @Operation(summary = "Get subscription")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "subscription with given id doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/{subscriptionId}")
    ResponseEntity<SubscriptionResponse> getSubscription(@NonNull @PathVariable UUID subscriptionId) {
        return subscriptionService.getSubscription(subscriptionId)
            .map(SubscriptionResponse::from)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Cancels an active subscription. No further charges are made for it.
     */
    @Operation(summary = "Cancel subscription")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "subscription cancelled"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "409", description = "subscription is already cancelled", content = @Content),
        @ApiResponse(responseCode = "404", description = "subscription with given id doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @DeleteMapping("/{subscriptionId}")
    ResponseEntity<Void> cancelSubscription(@NonNull @PathVariable UUID subscriptionId) {
        if (subscriptionService.cancelSubscription(subscriptionId)) {
            return ResponseEntity.noContent().build();
        }

        return subscriptionService.getSubscription(subscriptionId).isPresent()
            ? ResponseEntity.status(HttpStatus.CONFLICT).build()
            : ResponseEntity.notFound().build();
    }

    @Operation(summary = "Get subscription statistics")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/statistics")
    ResponseEntity<SubscriptionStatistics> getStatistics() {
        return ResponseEntity.ok(subscriptionService.getStatistics());
    }
}
