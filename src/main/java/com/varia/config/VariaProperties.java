package com.varia.config;

import com.varia.service.selection.SelectionPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for Varia.
 */
@Data
@Component
@ConfigurationProperties(prefix = "varia")
public class VariaProperties {

    private StoreConfig store = new StoreConfig();
    private SelectionConfig selection = new SelectionConfig();
    private KeysConfig keys = new KeysConfig();
    private NotifyConfig notify = new NotifyConfig();

    @Data
    public static class StoreConfig {
        /**
         * memory or redis.
         */
        private String type = "memory";
        private MemoryConfig memory = new MemoryConfig();
        private RedisConfig redis = new RedisConfig();
    }

    @Data
    public static class MemoryConfig {
        private long maxSize = 10000;
    }

    @Data
    public static class RedisConfig {
        private String keyPrefix = "varia:";
        private Duration commandTimeout = Duration.ofSeconds(5);
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class SelectionConfig {
        private SelectionPolicy policy = SelectionPolicy.NEWEST_CREATED;
        private boolean serveStale = true;
    }

    @Data
    public static class KeysConfig {
        private String defaultBucket = "default";
    }

    @Data
    public static class NotifyConfig {
        private boolean enabled = true;
    }
}
