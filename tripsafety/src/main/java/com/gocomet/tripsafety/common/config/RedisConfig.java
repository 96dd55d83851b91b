package com.gocomet.tripsafety.common.config;

import com.gocomet.tripsafety.tracking.event.BroadcastBus;
import com.gocomet.tripsafety.tracking.event.BroadcastMessageListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.util.List;

/**
 * Every instance listens to the whole broadcast bus and filters locally,
 * so no per-trip channel subscriptions have to be managed.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisMessageListenerContainer broadcastListenerContainer(
            RedisConnectionFactory connectionFactory,
            BroadcastMessageListener listener) {

        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(listener, List.of(
                new PatternTopic(BroadcastBus.LOCATION_CHANNEL_PATTERN),
                new ChannelTopic(BroadcastBus.SOS_CHANNEL)));
        return container;
    }
}
