package com.caf.backend.modules.realtime.infrastructure;

import com.caf.backend.modules.realtime.application.RealtimeDispatcher;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Cross-node delivery for deployments with more than one instance. Off unless
 * {@code caf.realtime.redis-relay.enabled} is set.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(value = "caf.realtime.redis-relay.enabled", havingValue = "true")
public class RealtimeRelayConfig {

    @Bean
    public RedisRealtimeRelay redisRealtimeRelay(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            @Lazy RealtimeDispatcher realtimeDispatcher,
            @Value("${caf.realtime.redis-relay.channel:caf:realtime}") String channel
    ) {
        return new RedisRealtimeRelay(redisTemplate, objectMapper, realtimeDispatcher, channel);
    }

    @Bean
    public RedisMessageListenerContainer realtimeRelayListenerContainer(
            RedisConnectionFactory connectionFactory,
            RedisRealtimeRelay relay,
            @Value("${caf.realtime.redis-relay.channel:caf:realtime}") String channel
    ) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(relay, new ChannelTopic(channel));
        return container;
    }
}
