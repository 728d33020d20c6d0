package com.varia.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.varia.store.redis.RedisResponseStore;
import com.varia.store.redis.ResponseDocumentCodec;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Redis configuration for the Redis response store.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "varia.store", name = "type", havingValue = "redis")
public class RedisConfiguration {

    private final VariaProperties properties;

    public RedisConfiguration(VariaProperties properties) {
        this.properties = properties;
    }

    /**
     * Configure Redis connection factory with timeouts and resilience.
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory(RedisProperties redisProperties) {
        VariaProperties.RedisConfig redis = properties.getStore().getRedis();

        // Socket options
        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(redis.getConnectTimeout())
                .keepAlive(true)
                .build();

        // Client options with timeouts
        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.enabled(redis.getCommandTimeout()))
                .build();

        // Lettuce client configuration
        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(redis.getCommandTimeout())
                .build();

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(
                redisProperties.getHost(), redisProperties.getPort());
        server.setDatabase(redisProperties.getDatabase());
        if (redisProperties.getPassword() != null) {
            server.setPassword(redisProperties.getPassword());
        }

        LettuceConnectionFactory factory = new LettuceConnectionFactory(server, clientConfig);

        log.info("Configured Redis connection factory for {}:{} with command timeout {}",
                redisProperties.getHost(), redisProperties.getPort(), redis.getCommandTimeout());
        return factory;
    }

    /**
     * Redis template for byte array storage (compressed heads, raw bodies, id sets).
     */
    @Bean
    public RedisTemplate<String, byte[]> responseRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        // Use String serializer for keys
        template.setKeySerializer(new StringRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());

        // Values are stored as given, compression is done by the codec
        template.setValueSerializer(RedisSerializer.byteArray());
        template.setHashValueSerializer(RedisSerializer.byteArray());

        template.afterPropertiesSet();

        log.info("Configured RedisTemplate for byte array storage");
        return template;
    }

    /**
     * Runs Redis calls that carry a per-call timeout.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService redisCallExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public RedisResponseStore redisResponseStore(RedisTemplate<String, byte[]> responseRedisTemplate,
                                                 ObjectMapper objectMapper,
                                                 Clock clock,
                                                 ExecutorService redisCallExecutor) {
        String keyPrefix = properties.getStore().getRedis().getKeyPrefix();
        log.info("Configured Redis response store with key prefix '{}'", keyPrefix);
        return new RedisResponseStore(responseRedisTemplate, new ResponseDocumentCodec(objectMapper),
                keyPrefix, clock, redisCallExecutor);
    }
}
