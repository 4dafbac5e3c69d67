package com.rebill.api.gateway;

import com.rebill.api.gateway.entities.PaymentTransaction;
import com.rebill.api.gateway.entities.PaymentTransactionRepository;
import com.rebill.api.gateway.exceptions.GatewayCommunicationException;
import com.rebill.api.gateway.exceptions.GatewayProtocolException;
import com.rebill.api.platform.exceptions.ValidationException;
import com.rebill.api.platform.validation.InputValidator;
import jakarta.validation.Validation;
import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@ExtendWith(MockitoExtension.class)
public class NmiGatewayClientTest {

    private static final String THREE_STEP_URL = "https://gateway.test/api/v2/three-step";
    private static final String API_KEY = "test-api-key";

    @Mock
    private PaymentTransactionRepository transactionRepository;

    private MockRestServiceServer server;
    private NmiGatewayClient client;

    @BeforeEach
    void setUp() {
        val restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new NmiGatewayClient(
            restTemplate,
            API_KEY,
            THREE_STEP_URL,
            transactionRepository,
            new InputValidator(Validation.buildDefaultValidatorFactory().getValidator()));

        lenient()
            .when(transactionRepository.save(any(PaymentTransaction.class)))
            .thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void initializeCharge() throws Exception {
        server.expect(requestTo(THREE_STEP_URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().string(allOf(
                containsString("<sale>"),
                containsString("<api-key>" + API_KEY + "</api-key>"),
                containsString("<amount>10.50</amount>"),
                containsString("<redirect-url>https://shop.test/return</redirect-url>"),
                containsString("<first-name>Ada</first-name>"),
                not(containsString("<shipping>")))))
            .andRespond(withSuccess(response("1", "Step 1 completed", "<form-url>https://gateway.test/form/abc</form-url>"),
                MediaType.TEXT_XML));

        val result = client.initializeCharge(
            new BigDecimal("10.5"), "USD", "https://shop.test/return", Map.of("first-name", "Ada"), null);

        server.verify();
        assertEquals(GatewayResult.Status.SUCCESS, result.getStatus());
        assertEquals("https://gateway.test/form/abc", result.getFormUrl());
        verify(transactionRepository, never()).save(any());
    }

    @Test
    void initializeCharge_withMissingFormUrl() throws Exception {
        server.expect(requestTo(THREE_STEP_URL))
            .andRespond(withSuccess(response("1", "Step 1 completed", ""), MediaType.TEXT_XML));

        val result = client.initializeCharge(new BigDecimal("10.00"), "USD", "https://shop.test/return", null, null);
        assertEquals(GatewayResult.Status.ERROR, result.getStatus());
        assertEquals(GatewayProtocolException.ERROR_CODE, result.getCode());
    }

    @Test
    void initializeCharge_withInvalidRedirectUrl() {
        val e = assertThrows(ValidationException.class,
            () -> client.initializeCharge(new BigDecimal("10.00"), "USD", "ftp://shop.test/return", null, null));

        assertEquals(Set.of("redirectUrl"), e.getViolations().keySet());
        server.verify();
    }

    @Test
    void completeCharge() throws Exception {
        server.expect(requestTo(THREE_STEP_URL))
            .andExpect(content().string(containsString("<token-id>tok_abc</token-id>")))
            .andRespond(withSuccess(
                response("1", "SUCCESS",
                    "<transaction-id>tx_100</transaction-id><amount>10.50</amount>" +
                        "<billing><cc-number>4xxxxxxxxxxx1111</cc-number></billing>"),
                MediaType.TEXT_XML));

        val result = client.completeCharge("tok_abc");
        assertEquals(GatewayResult.Status.SUCCESS, result.getStatus());
        assertEquals("tx_100", result.getTransactionId());
        assertEquals(new BigDecimal("10.50"), result.getAmount());
        assertEquals("USD", result.getCurrency());
        assertEquals("1111", result.getMaskedCardLast4());

        val captor = ArgumentCaptor.forClass(PaymentTransaction.class);
        verify(transactionRepository).save(captor.capture());
        assertEquals("tx_100", captor.getValue().getTransactionId());
        assertEquals(PaymentTransaction.PaymentStatus.APPROVED, captor.getValue().getPaymentStatus());
        assertEquals("1111", captor.getValue().getLast4Digits());
    }

    @ParameterizedTest(name = "{index} - result: {0}, expected status: {2}, expected code: {3}")
    @MethodSource("failedResponseTestCases")
    void completeCharge_withFailedResponse(
        String resultValue,
        String extraElements,
        GatewayResult.Status expectedStatus,
        String expectedCode
    ) throws Exception {
        server.expect(requestTo(THREE_STEP_URL))
            .andRespond(withSuccess(response(resultValue, "DECLINE", extraElements), MediaType.TEXT_XML));

        val result = client.completeCharge("tok_abc");
        assertEquals(expectedStatus, result.getStatus());
        assertEquals(expectedCode, result.getCode());
        assertEquals("DECLINE", result.getMessage());
        verify(transactionRepository, never()).save(any());
    }

    static Stream<Arguments> failedResponseTestCases() {
        return Stream.of(
            // result, extra elements, expected status, expected code
            arguments("2", "<result-code>200</result-code>", GatewayResult.Status.DECLINED, "200"),
            arguments("2", "", GatewayResult.Status.DECLINED, "2"),
            arguments("3", "<result-code>300</result-code>", GatewayResult.Status.ERROR, "300"),
            arguments("3", "", GatewayResult.Status.ERROR, "3")
        );
    }

    @ParameterizedTest(name = "{index} - body: {0}")
    @MethodSource("malformedResponseTestCases")
    void completeCharge_withMalformedResponse(String body) throws Exception {
        server.expect(requestTo(THREE_STEP_URL)).andRespond(withSuccess(body, MediaType.TEXT_XML));

        val result = client.completeCharge("tok_abc");
        assertEquals(GatewayResult.Status.ERROR, result.getStatus());
        assertEquals(GatewayProtocolException.ERROR_CODE, result.getCode());
        verify(transactionRepository, never()).save(any());
    }

    static Stream<Arguments> malformedResponseTestCases() {
        return Stream.of(
            arguments("<response><result>1</result"),
            arguments("not xml at all"),
            arguments("<response><result-text>no result</result-text></response>"),
            arguments("<!DOCTYPE response [<!ENTITY x \"y\">]><response><result>1</result></response>"),
            arguments("<response><result>1</result><amount>10.00</amount></response>"),
            arguments("<response><result>1</result><transaction-id>tx</transaction-id><amount>ten</amount></response>")
        );
    }

    @Test
    void completeCharge_withTransportFailure() {
        server.expect(requestTo(THREE_STEP_URL)).andRespond(withException(new IOException("connection reset")));
        assertThrows(GatewayCommunicationException.class, () -> client.completeCharge("tok_abc"));
        verify(transactionRepository, never()).save(any());
    }

    @Test
    void completeCharge_withServerError() {
        server.expect(requestTo(THREE_STEP_URL)).andRespond(withServerError());
        assertThrows(GatewayCommunicationException.class, () -> client.completeCharge("tok_abc"));
    }

    @Test
    void completeCharge_withBlankToken() {
        assertThrows(ValidationException.class, () -> client.completeCharge(" "));
        server.verify();
    }

    @ParameterizedTest(name = "{index} - original amount: {0}, refund amount: {1}, expected status: {2}")
    @MethodSource("refundTestCases")
    void refund(
        BigDecimal originalAmount,
        @NonNull BigDecimal refundAmount,
        @NonNull PaymentTransaction.PaymentStatus expectedStatus
    ) throws Exception {
        final List<PaymentTransaction> originals = originalAmount == null ? List.of() : List.of(
            PaymentTransaction.builder()
                .transactionId("tx_100")
                .amount(originalAmount)
                .currencyCode("EUR")
                .paymentStatus(PaymentTransaction.PaymentStatus.APPROVED)
                .build());

        when(transactionRepository.findAllByTransactionId("tx_100")).thenReturn(originals);
        server.expect(requestTo(THREE_STEP_URL))
            .andExpect(content().string(allOf(
                containsString("<refund>"),
                containsString("<transaction-id>tx_100</transaction-id>"))))
            .andRespond(withSuccess(response("1", "SUCCESS", "<transaction-id>tx_200</transaction-id>"), MediaType.TEXT_XML));

        val result = client.refund("tx_100", refundAmount);
        assertEquals(GatewayResult.Status.SUCCESS, result.getStatus());
        assertEquals("tx_200", result.getTransactionId());
        assertEquals(originalAmount == null ? "USD" : "EUR", result.getCurrency());

        val captor = ArgumentCaptor.forClass(PaymentTransaction.class);
        verify(transactionRepository).save(captor.capture());
        assertEquals(expectedStatus, captor.getValue().getPaymentStatus());
        assertEquals("tx_100", captor.getValue().getOriginalTransactionId());
    }

    static Stream<Arguments> refundTestCases() {
        return Stream.of(
            // original amount, refund amount, expected status
            arguments(new BigDecimal("50.00"), new BigDecimal("20.00"), PaymentTransaction.PaymentStatus.PARTIALLY_REFUNDED),
            arguments(new BigDecimal("50.00"), new BigDecimal("50.00"), PaymentTransaction.PaymentStatus.REFUNDED),
            arguments(null, new BigDecimal("50.00"), PaymentTransaction.PaymentStatus.REFUNDED)
        );
    }

    @Test
    void refund_withInvalidInputs() {
        val e = assertThrows(ValidationException.class, () -> client.refund("tx!", BigDecimal.ZERO));
        assertEquals(2, e.getViolations().size());
        assertTrue(e.getViolations().containsKey("transactionId"));
        assertTrue(e.getViolations().containsKey("amount"));
        server.verify();
    }

    @Test
    void chargeCustomer() throws Exception {
        server.expect(requestTo(THREE_STEP_URL))
            .andExpect(content().string(allOf(
                containsString("<customer-vault-id>cust_123</customer-vault-id>"),
                containsString("<amount>29.99</amount>"),
                containsString("<order-description>Subscription billing - ID: sub_1 - Cycle: 3</order-description>"),
                not(containsString("<billing-id>")))))
            .andRespond(withSuccess(response("1", "SUCCESS", "<transaction-id>tx_300</transaction-id>"), MediaType.TEXT_XML));

        val result = client.chargeCustomer("cust_123", new BigDecimal("29.99"), "USD",
            Map.of(GatewayClient.METADATA_SUBSCRIPTION_ID, "sub_1", GatewayClient.METADATA_BILLING_CYCLE, 3));

        assertEquals(GatewayResult.Status.SUCCESS, result.getStatus());
        assertEquals("tx_300", result.getTransactionId());
        assertEquals(NmiGatewayClient.MASKED_CARD_UNKNOWN, result.getMaskedCardLast4());

        val captor = ArgumentCaptor.forClass(PaymentTransaction.class);
        verify(transactionRepository).save(captor.capture());
        assertEquals("tx_300", captor.getValue().getTransactionId());
        assertNull(captor.getValue().getUsedToken());
    }

    @Test
    void chargeCustomer_withVaultToken() throws Exception {
        server.expect(requestTo(THREE_STEP_URL))
            .andExpect(content().string(allOf(
                containsString("<billing-id>tok_1</billing-id>"),
                containsString("<order-description>Vault charge - ID: vault_1</order-description>"))))
            .andRespond(withSuccess(response("1", "SUCCESS", "<transaction-id>tx_400</transaction-id>"), MediaType.TEXT_XML));

        val result = client.chargeCustomer("gw_cust_1", new BigDecimal("5.00"), "USD",
            Map.of(GatewayClient.METADATA_VAULT_ID, "vault_1", GatewayClient.METADATA_PAYMENT_METHOD_TOKEN, "tok_1"));

        assertEquals(GatewayResult.Status.SUCCESS, result.getStatus());
        val captor = ArgumentCaptor.forClass(PaymentTransaction.class);
        verify(transactionRepository).save(captor.capture());
        assertEquals("tok_1", captor.getValue().getUsedToken());
    }

    @Test
    void chargeCustomer_persistsBeforeReportingSuccess() throws Exception {
        server.expect(requestTo(THREE_STEP_URL))
            .andRespond(withSuccess(response("1", "SUCCESS", "<transaction-id>tx_500</transaction-id>"), MediaType.TEXT_XML));

        when(transactionRepository.save(any(PaymentTransaction.class))).thenThrow(new IllegalStateException("db down"));
        assertThrows(IllegalStateException.class,
            () -> client.chargeCustomer("cust_123", new BigDecimal("5.00"), "USD", null));

        verify(transactionRepository).save(any(PaymentTransaction.class));
    }

    @Test
    void chargeCustomer_withInvalidInputs() {
        val e = assertThrows(ValidationException.class,
            () -> client.chargeCustomer("", new BigDecimal("-5"), "dollars", null));

        assertEquals(3, e.getViolations().size());
        server.verify();
    }

    @Test
    void orderDescriptionOf() {
        assertEquals("Token charge", NmiGatewayClient.orderDescriptionOf(null));
        assertEquals("Token charge", NmiGatewayClient.orderDescriptionOf(Map.of("other", "x")));
        assertEquals("Subscription billing - ID: s - Cycle: ?",
            NmiGatewayClient.orderDescriptionOf(Map.of(GatewayClient.METADATA_SUBSCRIPTION_ID, "s")));
    }

    @Test
    void formatAmount() {
        assertEquals("10.00", NmiGatewayClient.formatAmount(BigDecimal.TEN));
        assertEquals("0.13", NmiGatewayClient.formatAmount(new BigDecimal("0.125")));
    }

    @NonNull
    private static String response(@NonNull String result, @NonNull String resultText, @NonNull String extraElements) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?><response>" +
            "<result>" + result + "</result>" +
            "<result-text>" + resultText + "</result-text>" +
            extraElements +
            "</response>";
    }
}
