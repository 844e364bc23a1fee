package com.odin.call_signaling_service.transport;

import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.exception.SignalingTransportException;

import lombok.extern.slf4j.Slf4j;

/**
 * Signaling channels on Redis pub/sub. Every pod subscribed to a channel
 * receives every message published on it.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "signaling.transport.type", havingValue = "redis", matchIfMissing = true)
public class RedisSignalingTransport implements SignalingTransport {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final SignalingCodec codec;

    public RedisSignalingTransport(StringRedisTemplate redisTemplate,
                                   RedisMessageListenerContainer listenerContainer,
                                   SignalingCodec codec) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.codec = codec;
    }

    @Override
    public void publish(String channelName, SignalingMessage message) {
        String payload = codec.encode(message);
        try {
            redisTemplate.convertAndSend(redisChannel(channelName), payload);
            log.debug("Published {} from {} to {} on {}", message.getEvent(), message.getFrom(),
                    message.getTo(), channelName);
        } catch (Exception e) {
            throw new SignalingTransportException("Failed to publish " + message.getEvent() + " on " + channelName, e);
        }
    }

    @Override
    public ChannelSubscription subscribe(String channelName, SignalingListener listener) {
        ChannelTopic topic = new ChannelTopic(redisChannel(channelName));
        MessageListener adapter = (message, pattern) ->
                codec.decode(message.getBody()).ifPresent(decoded -> deliver(channelName, listener, decoded));
        listenerContainer.addMessageListener(adapter, topic);
        log.info("Subscribed to signaling channel {}", channelName);
        return new RedisChannelSubscription(channelName, topic, adapter);
    }

    private void deliver(String channelName, SignalingListener listener, SignalingMessage message) {
        try {
            listener.onMessage(channelName, message);
        } catch (Exception e) {
            log.error("Listener on {} failed for {} message: {}", channelName, message.getEvent(), e.getMessage(), e);
        }
    }

    private static String redisChannel(String channelName) {
        return ApplicationConstants.REDIS_CHANNEL_PREFIX + channelName;
    }

    private class RedisChannelSubscription implements ChannelSubscription {

        private final String channelName;
        private final ChannelTopic topic;
        private final MessageListener adapter;
        private final AtomicBoolean active = new AtomicBoolean(true);

        RedisChannelSubscription(String channelName, ChannelTopic topic, MessageListener adapter) {
            this.channelName = channelName;
            this.topic = topic;
            this.adapter = adapter;
        }

        @Override
        public String getChannelName() {
            return channelName;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void unsubscribe() {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            try {
                listenerContainer.removeMessageListener(adapter, topic);
                log.info("Unsubscribed from signaling channel {}", channelName);
            } catch (Exception e) {
                log.error("Failed to unsubscribe from {}: {}", channelName, e.getMessage(), e);
            }
        }
    }
}
