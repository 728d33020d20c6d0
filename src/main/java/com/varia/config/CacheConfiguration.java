package com.varia.config;

import com.varia.service.HttpResponseCache;
import com.varia.service.InvalidationCoordinator;
import com.varia.service.MetadataValidator;
import com.varia.service.canonicalization.RequestKeyGenerator;
import com.varia.service.selection.CandidateSelector;
import com.varia.store.ResponseStore;
import com.varia.store.memory.InMemoryResponseStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ForkJoinPool;

/**
 * Response cache wiring: the in-memory Caffeine store and the cache facade over whichever
 * store is active.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final VariaProperties properties;

    public CacheConfiguration(VariaProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnProperty(prefix = "varia.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public InMemoryResponseStore inMemoryResponseStore(Clock clock) {
        long maxSize = properties.getStore().getMemory().getMaxSize();
        log.info("Configured in-memory response store, max size {}", maxSize);
        return new InMemoryResponseStore(maxSize, clock, ForkJoinPool.commonPool());
    }

    @Bean
    public HttpResponseCache<?> httpResponseCache(
            ResponseStore<?> store,
            CandidateSelector selector,
            InvalidationCoordinator invalidationCoordinator,
            MetadataValidator metadataValidator,
            RequestKeyGenerator keyGenerator) {
        log.info("Response cache using {} store, selection policy {}, serve stale {}",
                store.name(), properties.getSelection().getPolicy(), properties.getSelection().isServeStale());
        return new HttpResponseCache<>(store, selector, invalidationCoordinator, metadataValidator,
                keyGenerator, properties, ForkJoinPool.commonPool());
    }
}
