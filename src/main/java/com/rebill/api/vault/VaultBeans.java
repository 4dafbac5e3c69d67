package com.rebill.api.vault;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.NonNull;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Beans used by the vault package.
 */
@Configuration
class VaultBeans {

    static final String CACHE_NAME = "vault_cache";

    @NonNull
    @Bean(name = CACHE_NAME)
    Cache cache(@NonNull VaultConfiguration config) {
        return new CaffeineCache(CACHE_NAME, Caffeine.newBuilder()
            .expireAfterWrite(config.getCacheTtl())
            .initialCapacity(100)
            .maximumSize(config.getCacheMaxSize())
            .recordStats()
            .build());
    }
}
