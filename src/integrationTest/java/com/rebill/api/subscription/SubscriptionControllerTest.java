package com.rebill.api.subscription;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebill.api.gateway.GatewayClient;
import com.rebill.api.gateway.GatewayResult;
import com.rebill.api.subscription.entities.Subscription;
import com.rebill.api.subscription.entities.SubscriptionRepository;
import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
public class SubscriptionControllerTest {

    @MockBean
    private GatewayClient gatewayClient;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private SubscriptionService subscriptionService;

    @Autowired
    private SubscriptionRepository subscriptionRepository;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void createSubscription() throws Exception {
        mockMvc.perform(
                post("/v1/subscriptions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(createSubscriptionBody("cust_create", "29.99", "monthly")))
            .andExpect(status().isCreated())
            .andExpect(header().exists("X-RateLimit-Limit"))
            .andExpect(jsonPath("$.customerId").value("cust_create"))
            .andExpect(jsonPath("$.amount").value(29.99))
            .andExpect(jsonPath("$.status").value("active"))
            .andExpect(jsonPath("$.frequency").value("monthly"))
            .andExpect(jsonPath("$.billingCycle").value(0))
            .andExpect(jsonPath("$.metadata.plan").value("pro"));
    }

    @Test
    void createSubscription_withInvalidBody() throws Exception {
        mockMvc.perform(
                post("/v1/subscriptions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(createSubscriptionBody("x", "-1", "hourly")))
            .andExpect(status().isBadRequest());
    }

    @Test
    void getSubscription() throws Exception {
        val id = createSubscription("cust_get");
        val created = subscriptionService.getSubscription(id).orElseThrow();

        mockMvc.perform(get("/v1/subscriptions/" + id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(id.toString()))
            .andExpect(jsonPath("$.customerId").value(created.getCustomerId()))
            .andExpect(jsonPath("$.currency").value(created.getCurrency()))
            .andExpect(jsonPath("$.billingCycle").value(created.getBillingCycle()));

        mockMvc.perform(get("/v1/subscriptions/" + UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }

    @Test
    void listSubscriptions() throws Exception {
        createSubscription("cust_list");
        createSubscription("cust_list");
        val cancelled = createSubscription("cust_list");
        subscriptionService.cancelSubscription(cancelled);

        mockMvc.perform(get("/v1/subscriptions").queryParam("customerId", "cust_list"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(get("/v1/subscriptions").queryParam("customerId", "a b"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.violations.customerId").isArray());
    }

    @Test
    void cancelSubscription() throws Exception {
        val id = createSubscription("cust_cancel");
        mockMvc.perform(delete("/v1/subscriptions/" + id))
            .andExpect(status().isNoContent());

        val cancelledAt = subscriptionService.getSubscription(id).orElseThrow().getCancelledAt();
        mockMvc.perform(delete("/v1/subscriptions/" + id))
            .andExpect(status().isConflict());

        assertEquals(cancelledAt, subscriptionService.getSubscription(id).orElseThrow().getCancelledAt());
        mockMvc.perform(delete("/v1/subscriptions/" + UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }

    @Test
    void processDue() throws Exception {
        val id = createSubscription("cust_rebill");
        val createdAt = OffsetDateTime.now();
        when(gatewayClient.chargeCustomer(eq("cust_rebill"), eq(new BigDecimal("29.99")), eq("USD"), anyMap()))
            .thenReturn(GatewayResult.builder()
                .status(GatewayResult.Status.SUCCESS)
                .transactionId("tx_rebill")
                .amount(new BigDecimal("29.99"))
                .currency("USD")
                .build());

        assertTrue(subscriptionService.processDue(createdAt)
            .stream()
            .noneMatch(r -> r.getSubscriptionId().equals(id)));

        val results = subscriptionService.processDue(createdAt.plusDays(31))
            .stream()
            .filter(r -> r.getSubscriptionId().equals(id))
            .collect(Collectors.toList());

        assertEquals(1, results.size());
        assertTrue(results.get(0).isSuccessful());
        assertEquals(1, results.get(0).getBillingCycle());
        assertEquals("tx_rebill", results.get(0).getTransactionId());

        mockMvc.perform(get("/v1/subscriptions/" + id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.billingCycle").value(1));
    }

    @Test
    void processDue_withDecline() throws Exception {
        val id = createSubscription("cust_declined");
        val before = subscriptionService.getSubscription(id).orElseThrow();
        when(gatewayClient.chargeCustomer(eq("cust_declined"), any(), anyString(), anyMap()))
            .thenReturn(GatewayResult.declined("200", "Insufficient funds"));

        val result = subscriptionService.processDue(OffsetDateTime.now().plusDays(31))
            .stream()
            .filter(r -> r.getSubscriptionId().equals(id))
            .findFirst()
            .orElseThrow();

        assertEquals(GatewayResult.Status.DECLINED, result.getStatus());
        val after = subscriptionService.getSubscription(id).orElseThrow();
        assertEquals(before.getBillingCycle(), after.getBillingCycle());
        assertTrue(before.getNextBillingAt().isEqual(after.getNextBillingAt()));
        assertEquals(before.getLastBillingAt(), after.getLastBillingAt());
    }

    @Test
    void getStatistics() throws Exception {
        createSubscription("cust_stats");
        mockMvc.perform(get("/v1/subscriptions/statistics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").isNumber())
            .andExpect(jsonPath("$.active").isNumber())
            .andExpect(jsonPath("$.cancelled").isNumber());
    }

    @Test
    void getStatistics_isCachedUntilSubscriptionsChange() throws Exception {
        createSubscription("cust_cached_stats");
        val before = readStatistics();

        val created = createSubscription("cust_cached_stats");
        val afterCreate = readStatistics();
        assertEquals(before.get("total") + 1, afterCreate.get("total"));
        assertEquals(before.get("active") + 1, afterCreate.get("active"));

        // writes that bypass the service are only visible once the cached value is evicted.
        subscriptionRepository.save(Subscription.builder()
            .customerId("cust_cached_stats")
            .amount(new BigDecimal("9.99"))
            .currency("USD")
            .frequency(Subscription.Frequency.MONTHLY)
            .createdAt(OffsetDateTime.now())
            .nextBillingAt(OffsetDateTime.now().plusMonths(1))
            .build());

        assertEquals(afterCreate, readStatistics());

        mockMvc.perform(delete("/v1/subscriptions/" + created))
            .andExpect(status().isNoContent());

        val afterCancel = readStatistics();
        assertEquals(afterCreate.get("total") + 1, afterCancel.get("total"));
        assertEquals(afterCreate.get("active"), afterCancel.get("active"));
        assertEquals(afterCreate.get("cancelled") + 1, afterCancel.get("cancelled"));
    }

    @NonNull
    private Map<String, Long> readStatistics() throws Exception {
        val result = mockMvc.perform(get("/v1/subscriptions/statistics"))
            .andExpect(status().isOk())
            .andReturn();

        val json = objectMapper.readTree(result.getResponse().getContentAsString());
        return Map.of(
            "total", json.get("total").asLong(),
            "active", json.get("active").asLong(),
            "cancelled", json.get("cancelled").asLong());
    }

    @NonNull
    private UUID createSubscription(@NonNull String customerId) throws Exception {
        val result = mockMvc.perform(
                post("/v1/subscriptions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(createSubscriptionBody(customerId, "29.99", "monthly")))
            .andExpect(status().isCreated())
            .andReturn();

        return UUID.fromString(objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText());
    }

    @NonNull
    private String createSubscriptionBody(String customerId, String amount, String frequency) throws Exception {
        final Map<String, Object> body = new HashMap<>();
        body.put("customerId", customerId);
        body.put("amount", new BigDecimal(amount));
        body.put("currency", "USD");
        body.put("frequency", frequency);
        body.put("metadata", Map.of("plan", "pro"));
        return objectMapper.writeValueAsString(body);
    }
}
