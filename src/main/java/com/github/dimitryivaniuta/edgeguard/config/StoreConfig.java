package com.github.dimitryivaniuta.edgeguard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.edgeguard.push.PushSubscriptionService;
import com.github.dimitryivaniuta.edgeguard.store.InMemoryKeyValueStore;
import com.github.dimitryivaniuta.edgeguard.store.KeyValueStore;
import com.github.dimitryivaniuta.edgeguard.store.RedisKeyValueStore;
import com.github.dimitryivaniuta.edgeguard.sync.SyncService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "edge.redis", name = "enabled", havingValue = "true")
    public KeyValueStore redisKeyValueStore(StringRedisTemplate redis) {
        return new RedisKeyValueStore(redis);
    }

    @Bean
    @ConditionalOnProperty(prefix = "edge.redis", name = "enabled", havingValue = "false", matchIfMissing = true)
    public KeyValueStore inMemoryKeyValueStore() {
        log.warn("edge.redis.enabled=false: sync and push data are kept in process memory only");
        return new InMemoryKeyValueStore();
    }

    @Bean
    public SyncService syncService(KeyValueStore keyValueStore, ObjectMapper objectMapper) {
        return new SyncService(keyValueStore, objectMapper);
    }

    @Bean
    public PushSubscriptionService pushSubscriptionService(KeyValueStore keyValueStore) {
        return new PushSubscriptionService(keyValueStore);
    }
}
