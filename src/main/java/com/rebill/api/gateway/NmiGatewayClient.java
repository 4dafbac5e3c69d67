package com.rebill.api.gateway;

import com.rebill.api.gateway.entities.PaymentTransaction;
import com.rebill.api.gateway.entities.PaymentTransactionRepository;
import com.rebill.api.gateway.exceptions.GatewayCommunicationException;
import com.rebill.api.gateway.exceptions.GatewayProtocolException;
import com.rebill.api.gateway.payload.CompleteChargeParams;
import com.rebill.api.gateway.payload.CustomerChargeParams;
import com.rebill.api.gateway.payload.InitializeChargeParams;
import com.rebill.api.gateway.payload.RefundParams;
import com.rebill.api.platform.exceptions.ValidationException;
import com.rebill.api.platform.validation.InputValidator;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.UUID;

/**
 * A {@link GatewayClient} for the NMI Three-Step Redirect API. Requests and responses are XML
 * documents exchanged over HTTPS with the configured endpoint.
 *
 * @see <a href="https://secure.nmi.com/merchants/resources/integration/integration_portal.php">
 * NMI integration portal</a>
 */
@Slf4j
public class NmiGatewayClient implements GatewayClient {

    static final String RESULT_APPROVED = "1";
    static final String RESULT_DECLINED = "2";
    static final String MASKED_CARD_UNKNOWN = "****";
    static final String DEFAULT_CURRENCY = "USD";
    static final String INTERACTIVE_ORDER_DESCRIPTION = "Payment Gateway Order";

    private final RestTemplate restTemplate;
    private final String apiKey;
    private final String threeStepUrl;
    private final PaymentTransactionRepository transactionRepository;
    private final InputValidator inputValidator;
    private final DocumentBuilderFactory documentBuilderFactory;
    private final TransformerFactory transformerFactory;

    public NmiGatewayClient(
        @NonNull RestTemplate restTemplate,
        @NonNull String apiKey,
        @NonNull String threeStepUrl,
        @NonNull PaymentTransactionRepository transactionRepository,
        @NonNull InputValidator inputValidator
    ) {
        this.restTemplate = restTemplate;
        this.apiKey = apiKey;
        this.threeStepUrl = threeStepUrl;
        this.transactionRepository = transactionRepository;
        this.inputValidator = inputValidator;
        this.documentBuilderFactory = DocumentBuilderFactory.newDefaultInstance();
        this.transformerFactory = TransformerFactory.newDefaultInstance();
        try {
            documentBuilderFactory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            documentBuilderFactory.setExpandEntityReferences(false);
            transformerFactory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            transformerFactory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
        } catch (ParserConfigurationException e) {
            // shouldn't happen with the JDK's default parser.
            throw new IllegalStateException(e);
        }
    }

    @NonNull
    @Override
    public GatewayResult initializeCharge(
        BigDecimal amount,
        String currency,
        String redirectUrl,
        Map<String, String> billingInfo,
        Map<String, String> shippingInfo
    ) throws ValidationException, GatewayCommunicationException {
        inputValidator.validate(new InitializeChargeParams(amount, currency, redirectUrl, billingInfo, shippingInfo));
        val request = newRequest("sale");
        val sale = request.getDocumentElement();
        appendText(sale, "api-key", apiKey);
        appendText(sale, "redirect-url", redirectUrl);
        appendText(sale, "amount", formatAmount(amount));
        appendText(sale, "currency", currency);
        appendText(sale, "order-id", "ORD-" + UUID.randomUUID());
        appendText(sale, "order-description", INTERACTIVE_ORDER_DESCRIPTION);
        appendText(sale, "tax-amount", "0.00");
        appendText(sale, "shipping-amount", "0.00");
        appendSection(sale, "billing", billingInfo);
        appendSection(sale, "shipping", shippingInfo);

        try {
            val response = send(request);
            if (!response.isApproved()) {
                return failureOf("initialize charge", response);
            }

            val formUrl = response.text("form-url");
            if (formUrl == null) {
                throw new GatewayProtocolException("approved response is missing 'form-url'");
            }

            log.info("initialized a charge of {} {}", formatAmount(amount), currency);
            return GatewayResult.builder()
                .status(GatewayResult.Status.SUCCESS)
                .transactionId(response.text("transaction-id"))
                .amount(amount)
                .currency(currency)
                .formUrl(formUrl)
                .build();
        } catch (GatewayProtocolException e) {
            return protocolError("initialize charge", e);
        }
    }

    @NonNull
    @Override
    public GatewayResult completeCharge(String tokenId) throws ValidationException, GatewayCommunicationException {
        inputValidator.validate(new CompleteChargeParams(tokenId));
        val request = newRequest("complete-action");
        val action = request.getDocumentElement();
        appendText(action, "api-key", apiKey);
        appendText(action, "token-id", tokenId);

        try {
            val response = send(request);
            if (!response.isApproved()) {
                return failureOf("complete charge", response);
            }

            val transactionId = response.requireText("transaction-id");
            val amount = response.requireAmount();
            val currency = response.textOrDefault("currency", DEFAULT_CURRENCY);
            val last4 = lastFourDigits(response.billingText("cc-number"));
            transactionRepository.save(
                PaymentTransaction.builder()
                    .transactionId(transactionId)
                    .usedToken(tokenId)
                    .amount(amount)
                    .currencyCode(currency)
                    .paymentStatus(PaymentTransaction.PaymentStatus.APPROVED)
                    .last4Digits(last4)
                    .build());

            log.info("completed charge '{}' of {} {}", transactionId, formatAmount(amount), currency);
            return GatewayResult.builder()
                .status(GatewayResult.Status.SUCCESS)
                .transactionId(transactionId)
                .amount(amount)
                .currency(currency)
                .maskedCardLast4(last4 != null ? last4 : MASKED_CARD_UNKNOWN)
                .build();
        } catch (GatewayProtocolException e) {
            return protocolError("complete charge", e);
        }
    }

    @NonNull
    @Override
    public GatewayResult refund(String originalTransactionId, BigDecimal amount)
        throws ValidationException, GatewayCommunicationException {
        inputValidator.validate(new RefundParams(originalTransactionId, amount));
        val request = newRequest("refund");
        val refund = request.getDocumentElement();
        appendText(refund, "api-key", apiKey);
        appendText(refund, "transaction-id", originalTransactionId);
        appendText(refund, "amount", formatAmount(amount));

        try {
            val response = send(request);
            if (!response.isApproved()) {
                return failureOf("refund", response);
            }

            val refundTransactionId = response.requireText("transaction-id");
            val original = transactionRepository.findAllByTransactionId(originalTransactionId)
                .stream()
                .findFirst();

            // a refund of less than the original amount is partial; unknown originals count as full refunds.
            val status = original.map(t -> amount.compareTo(t.getAmount()) < 0).orElse(false)
                ? PaymentTransaction.PaymentStatus.PARTIALLY_REFUNDED
                : PaymentTransaction.PaymentStatus.REFUNDED;

            val currency = original.map(PaymentTransaction::getCurrencyCode)
                .orElseGet(() -> response.textOrDefault("currency", DEFAULT_CURRENCY));

            transactionRepository.save(
                PaymentTransaction.builder()
                    .transactionId(refundTransactionId)
                    .originalTransactionId(originalTransactionId)
                    .amount(amount)
                    .currencyCode(currency)
                    .paymentStatus(status)
                    .build());

            log.info("refunded {} {} of transaction '{}' as {}", formatAmount(amount), currency, originalTransactionId, status);
            return GatewayResult.builder()
                .status(GatewayResult.Status.SUCCESS)
                .transactionId(refundTransactionId)
                .amount(amount)
                .currency(currency)
                .build();
        } catch (GatewayProtocolException e) {
            return protocolError("refund", e);
        }
    }

    @NonNull
    @Override
    public GatewayResult chargeCustomer(
        String customerRef,
        BigDecimal amount,
        String currency,
        Map<String, Object> metadata
    ) throws ValidationException, GatewayCommunicationException {
        inputValidator.validate(new CustomerChargeParams(customerRef, amount, currency));
        val request = newRequest("sale");
        val sale = request.getDocumentElement();
        appendText(sale, "api-key", apiKey);
        appendText(sale, "amount", formatAmount(amount));
        appendText(sale, "currency", currency);
        appendText(sale, "customer-vault-id", customerRef);
        appendText(sale, "order-description", orderDescriptionOf(metadata));

        val token = metadata != null ? metadata.get(METADATA_PAYMENT_METHOD_TOKEN) : null;
        if (token != null) {
            appendText(sale, "billing-id", token.toString());
        }

        try {
            val response = send(request);
            if (!response.isApproved()) {
                return failureOf("charge customer", response);
            }

            val transactionId = response.requireText("transaction-id");
            transactionRepository.save(
                PaymentTransaction.builder()
                    .transactionId(transactionId)
                    .usedToken(token != null ? token.toString() : null)
                    .amount(amount)
                    .currencyCode(currency)
                    .paymentStatus(PaymentTransaction.PaymentStatus.APPROVED)
                    .build());

            log.info("charged {} {} to customer '{}' with transaction '{}'", formatAmount(amount), currency, customerRef, transactionId);
            return GatewayResult.builder()
                .status(GatewayResult.Status.SUCCESS)
                .transactionId(transactionId)
                .amount(amount)
                .currency(currency)
                .maskedCardLast4(MASKED_CARD_UNKNOWN)
                .build();
        } catch (GatewayProtocolException e) {
            return protocolError("charge customer", e);
        }
    }

    @NonNull
    private Document newRequest(@NonNull String rootElement) {
        try {
            val doc = documentBuilderFactory.newDocumentBuilder().newDocument();
            doc.appendChild(doc.createElement(rootElement));
            return doc;
        } catch (ParserConfigurationException e) {
            // shouldn't happen normally.
            throw new IllegalStateException(e);
        }
    }

    @NonNull
    private NmiResponse send(@NonNull Document request) throws GatewayCommunicationException, GatewayProtocolException {
        val headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_XML);
        final String body;
        try {
            body = restTemplate.exchange(threeStepUrl, HttpMethod.POST, new HttpEntity<>(serialize(request), headers), String.class)
                .getBody();
        } catch (RestClientException e) {
            throw new GatewayCommunicationException("gateway request failed: " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new GatewayProtocolException("gateway returned an empty response");
        }

        final Document doc;
        try {
            doc = documentBuilderFactory.newDocumentBuilder().parse(new InputSource(new StringReader(body)));
        } catch (SAXException | IOException e) {
            throw new GatewayProtocolException("gateway returned a malformed response", e);
        } catch (ParserConfigurationException e) {
            // shouldn't happen normally.
            throw new IllegalStateException(e);
        }

        doc.getDocumentElement().normalize();
        val response = new NmiResponse(doc.getDocumentElement());
        if (response.text("result") == null) {
            throw new GatewayProtocolException("gateway response is missing 'result'");
        }

        return response;
    }

    @NonNull
    private String serialize(@NonNull Document doc) {
        try {
            val transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            val writer = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            // shouldn't happen normally.
            throw new IllegalStateException(e);
        }
    }

    @NonNull
    private static GatewayResult failureOf(@NonNull String operation, @NonNull NmiResponse response) {
        val message = response.textOrDefault("result-text", "no result text");
        if (RESULT_DECLINED.equals(response.text("result"))) {
            log.info("{} declined by the gateway: {}", operation, message);
            return GatewayResult.declined(response.textOrDefault("result-code", RESULT_DECLINED), message);
        }

        log.warn("{} failed at the gateway: {}", operation, message);
        return GatewayResult.error(response.textOrDefault("result-code", response.text("result")), message);
    }

    @NonNull
    private static GatewayResult protocolError(@NonNull String operation, @NonNull GatewayProtocolException e) {
        log.warn("{} received an unexpected gateway response", operation, e);
        return GatewayResult.error(e.getErrorCode(), e.getMessage());
    }

    @NonNull
    static String formatAmount(@NonNull BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * Describes a token based charge with the references found in its metadata, e.g.
     * {@code Subscription billing - ID: 42 - Cycle: 3}.
     */
    @NonNull
    static String orderDescriptionOf(Map<String, Object> metadata) {
        if (metadata == null) {
            return "Token charge";
        }

        val subscriptionId = metadata.get(METADATA_SUBSCRIPTION_ID);
        if (subscriptionId != null) {
            return String.format("Subscription billing - ID: %s - Cycle: %s",
                subscriptionId, metadata.getOrDefault(METADATA_BILLING_CYCLE, "?"));
        }

        val vaultId = metadata.get(METADATA_VAULT_ID);
        if (vaultId != null) {
            return String.format("Vault charge - ID: %s", vaultId);
        }

        return "Token charge";
    }

    private static String lastFourDigits(String cardNumber) {
        if (cardNumber == null) {
            return null;
        }

        val digits = cardNumber.replaceAll("\\D", "");
        return digits.length() < 4 ? null : digits.substring(digits.length() - 4);
    }

    private static void appendText(@NonNull Element parent, @NonNull String name, @NonNull String value) {
        val child = parent.getOwnerDocument().createElement(name);
        child.setTextContent(value);
        parent.appendChild(child);
    }

    private static void appendSection(@NonNull Element parent, @NonNull String name, Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return;
        }

        val section = parent.getOwnerDocument().createElement(name);
        fields.forEach((k, v) -> {
            if (v != null) {
                appendText(section, k, v);
            }
        });

        parent.appendChild(section);
    }

    /**
     * Read access to the direct children of a gateway response's root element.
     */
    private static class NmiResponse {

        private final Element root;

        NmiResponse(@NonNull Element root) {
            this.root = root;
        }

        boolean isApproved() {
            return RESULT_APPROVED.equals(text("result"));
        }

        String text(@NonNull String name) {
            return childText(root, name);
        }

        @NonNull
        String textOrDefault(@NonNull String name, @NonNull String defaultValue) {
            val value = text(name);
            return value != null ? value : defaultValue;
        }

        @NonNull
        String requireText(@NonNull String name) throws GatewayProtocolException {
            val value = text(name);
            if (value == null) {
                throw new GatewayProtocolException(String.format("approved response is missing '%s'", name));
            }

            return value;
        }

        @NonNull
        BigDecimal requireAmount() throws GatewayProtocolException {
            val value = requireText("amount");
            try {
                return new BigDecimal(value);
            } catch (NumberFormatException e) {
                throw new GatewayProtocolException(String.format("approved response has an invalid amount '%s'", value), e);
            }
        }

        String billingText(@NonNull String name) {
            val billing = childElement(root, "billing");
            return billing != null ? childText(billing, name) : null;
        }

        private static String childText(@NonNull Element parent, @NonNull String name) {
            val child = childElement(parent, name);
            if (child == null) {
                return null;
            }

            val text = child.getTextContent().trim();
            return text.isEmpty() ? null : text;
        }

        private static Element childElement(@NonNull Element parent, @NonNull String name) {
            for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
                if (n.getNodeType() == Node.ELEMENT_NODE && name.equals(n.getNodeName())) {
                    return (Element) n;
                }
            }

            return null;
        }
    }
}
