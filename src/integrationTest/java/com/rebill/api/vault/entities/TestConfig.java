package com.rebill.api.vault.entities;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.test.context.TestConfiguration;

/**
 * Test configuration that limits the application context to {@link PaymentVaultEntry} and its repository.
 */
@TestConfiguration
@SpringBootApplication
public class TestConfig {
}
