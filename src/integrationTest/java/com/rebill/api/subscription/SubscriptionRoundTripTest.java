package com.rebill.api.subscription;

import com.rebill.api.gateway.GatewayClient;
import lombok.val;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.params.provider.Arguments.arguments;

/**
 * Runs without a surrounding transaction so that every read loads a new instance from the
 * database.
 */
@SpringBootTest
@ActiveProfiles("test")
public class SubscriptionRoundTripTest {

    @MockBean
    private GatewayClient gatewayClient;

    @Autowired
    private SubscriptionService subscriptionService;

    @ParameterizedTest(name = "{index} - frequency: {1}, metadata: {2}")
    @MethodSource("roundTripTestCases")
    void createThenGet(String customerId, String frequency, Map<String, Object> metadata) throws Exception {
        val created = subscriptionService.createSubscription(customerId, new BigDecimal("29.99"), "USD", frequency, metadata);
        val fetched = subscriptionService.getSubscription(created.getUuid()).orElseThrow();

        assertNotSame(created, fetched);
        assertEquals(created, fetched);
        assertEquals(metadata, fetched.getMetadata());
    }

    static Stream<Arguments> roundTripTestCases() {
        return Stream.of(
            // customer id, frequency, metadata
            arguments("cust_round_trip_1", "monthly", null),
            arguments("cust_round_trip_2", "weekly", Map.of()),
            arguments("cust_round_trip_3", "yearly", Map.of("plan", "pro", "seats", 3, "trial", true))
        );
    }
}
