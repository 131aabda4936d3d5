package com.shlawgathon.drawcheck.backend.config;

import com.shlawgathon.drawcheck.backend.pubsub.ValidationEventSubscriber;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.adapter.MessageListenerAdapter;

/**
 * Redis Pub/Sub wiring for validation progress fan-out across instances.
 */
@Configuration
public class RedisMessageConfig {

    public static final String VALIDATION_EVENTS_CHANNEL = "drawcheck:validation-events";

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory,
            MessageListenerAdapter messageListenerAdapter) {

        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(messageListenerAdapter, new ChannelTopic(VALIDATION_EVENTS_CHANNEL));
        return container;
    }

    @Bean
    public MessageListenerAdapter messageListenerAdapter(ValidationEventSubscriber subscriber) {
        return new MessageListenerAdapter(subscriber, "handleMessage");
    }
}
