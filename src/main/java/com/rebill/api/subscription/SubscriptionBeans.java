package com.rebill.api.subscription;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.NonNull;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Beans used by the subscription package.
 */
@Configuration
class SubscriptionBeans {

    static final String CACHE_NAME = "subscription_cache";

    @NonNull
    @Bean(name = CACHE_NAME)
    Cache cache(@NonNull SubscriptionConfiguration config) {
        return new CaffeineCache(CACHE_NAME, Caffeine.newBuilder()
            .expireAfterWrite(config.getCacheTtl())
            .initialCapacity(1)
            .maximumSize(10)
            .recordStats()
            .build());
    }
}
