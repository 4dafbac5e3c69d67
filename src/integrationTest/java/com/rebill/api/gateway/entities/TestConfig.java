package com.rebill.api.gateway.entities;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.test.context.TestConfiguration;

/**
 * Test configuration that limits the application context to {@link PaymentTransaction} and its repository.
 */
@TestConfiguration
@SpringBootApplication
public class TestConfig {
}
