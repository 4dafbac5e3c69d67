package com.rebill.api.gateway;

import com.rebill.api.gateway.exceptions.GatewayCommunicationException;
import com.rebill.api.platform.exceptions.ValidationException;
import lombok.NonNull;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Defines the contract of an external, tokenized payment processor. Implementations normalise the
 * processor's responses into {@link GatewayResult}s and must keep the success, declined and error
 * outcomes distinguishable.
 *
 * <p>
 * Implementations must persist a local transaction record before reporting a
 * {@link GatewayResult.Status#SUCCESS success}, and must validate their inputs before making any
 * network call.</p>
 */
public interface GatewayClient {

    /**
     * Metadata key with the subscription uuid of a rebilling charge.
     */
    String METADATA_SUBSCRIPTION_ID = "subscription_id";

    /**
     * Metadata key with the billing cycle number of a rebilling charge.
     */
    String METADATA_BILLING_CYCLE = "billing_cycle";

    /**
     * Metadata key with the vault entry uuid of a vault charge.
     */
    String METADATA_VAULT_ID = "vault_id";

    /**
     * Metadata key with the stored payment method token to charge.
     */
    String METADATA_PAYMENT_METHOD_TOKEN = "payment_method_token";

    /**
     * Starts an interactive charge where the customer enters card details on a hosted form.
     *
     * @param amount       amount to charge, must be greater than 0.
     * @param currency     ISO 4217 currency code.
     * @param redirectUrl  url where the hosted form redirects after card entry.
     * @param billingInfo  optional billing address fields.
     * @param shippingInfo optional shipping address fields.
     * @return a result with the {@link GatewayResult#getFormUrl() form url} on success.
     * @throws ValidationException           if the amount or currency is not valid.
     * @throws GatewayCommunicationException if the processor could not be reached.
     */
    @NonNull
    GatewayResult initializeCharge(
        BigDecimal amount,
        String currency,
        String redirectUrl,
        Map<String, String> billingInfo,
        Map<String, String> shippingInfo
    ) throws ValidationException, GatewayCommunicationException;

    /**
     * Finalises a charge started by {@link #initializeCharge}.
     *
     * @param tokenId the completion token returned to the redirect url.
     * @return a result with transaction id, approved amount, currency and masked card digits.
     * @throws ValidationException           if the token is blank.
     * @throws GatewayCommunicationException if the processor could not be reached.
     */
    @NonNull
    GatewayResult completeCharge(String tokenId) throws ValidationException, GatewayCommunicationException;

    /**
     * Refunds a previous transaction, fully or partially.
     *
     * @param originalTransactionId id of the transaction to refund.
     * @param amount                amount to refund, must be greater than 0.
     * @return a result with the refund's transaction id on success.
     * @throws ValidationException           if the transaction id or amount is not valid.
     * @throws GatewayCommunicationException if the processor could not be reached.
     */
    @NonNull
    GatewayResult refund(String originalTransactionId, BigDecimal amount)
        throws ValidationException, GatewayCommunicationException;

    /**
     * Charges a customer's stored payment method without customer interaction. It is used for
     * both subscription rebilling and vault charges.
     *
     * @param customerRef customer id known to the processor.
     * @param amount      amount to charge, must be greater than 0.
     * @param currency    ISO 4217 currency code.
     * @param metadata    optional metadata, see the {@code METADATA_*} keys.
     * @return a result with transaction id, amount and currency on success.
     * @throws ValidationException           if any of the inputs is not valid.
     * @throws GatewayCommunicationException if the processor could not be reached.
     */
    @NonNull
    GatewayResult chargeCustomer(String customerRef, BigDecimal amount, String currency, Map<String, Object> metadata)
        throws ValidationException, GatewayCommunicationException;
}
