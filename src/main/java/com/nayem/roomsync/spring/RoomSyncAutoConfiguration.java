package com.nayem.roomsync.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.roomsync.core.RoomStateEngine;
import com.nayem.roomsync.notify.InMemoryRoomChannelBus;
import com.nayem.roomsync.store.InMemoryRoomStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;

@Configuration
@ConditionalOnProperty(name = "roomsync.enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RoomSyncProperties.class)
public class RoomSyncAutoConfiguration {

    @Bean(destroyMethod = "disconnect")
    @ConditionalOnMissingBean
    public RoomStateEngine roomStateEngine(RoomSyncProperties properties,
            ObjectProvider<RedisConnectionFactory> connectionFactoryProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<MeterRegistry> registryProvider) {

        RoomStateEngine.Builder builder = RoomStateEngine.builder()
                .objectMapper(objectMapperProvider.getIfAvailable(ObjectMapper::new))
                .metrics(registryProvider.getIfAvailable())
                .historyLimit(properties.getHistoryLimit())
                .timeout(properties.getTimeout())
                .shutdownTimeout(properties.getShutdownTimeout())
                .maxCommitAttempts(properties.getMaxCommitAttempts())
                .cacheMaxSize(properties.getCache().getMaxSize())
                .cacheExpireAfterWrite(properties.getCache().getExpireAfterWrite())
                .threads(properties.getExecutor().getThreads())
                .threadNamePrefix(properties.getExecutor().getThreadNamePrefix());

        if ("memory".equalsIgnoreCase(properties.getStore())) {
            builder.store(new InMemoryRoomStateStore()).bus(new InMemoryRoomChannelBus());
        } else {
            RedisConnectionFactory connectionFactory = connectionFactoryProvider.getIfAvailable();
            if (connectionFactory == null) {
                throw new IllegalStateException("A RedisConnectionFactory is required for the Redis room state store");
            }
            builder.redis(connectionFactory);
        }

        return builder.build();
    }
}
