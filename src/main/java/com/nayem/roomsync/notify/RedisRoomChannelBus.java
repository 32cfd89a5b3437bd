package com.nayem.roomsync.notify;

import com.nayem.roomsync.core.StoreFailures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Redis Pub/Sub transport.
 * <p>
 * Publishing goes through the command connection held by the
 * {@link StringRedisTemplate}. Listening uses a
 * {@link RedisMessageListenerContainer} owned by this bus, which keeps its own
 * subscribe-mode connection: Redis refuses ordinary commands on a connection
 * that is subscribed to a channel.
 * </p>
 */
public class RedisRoomChannelBus implements RoomChannelBus {

    private static final Logger log = LoggerFactory.getLogger(RedisRoomChannelBus.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer container;
    private final Map<String, MessageListener> listeners = new ConcurrentHashMap<>();

    public RedisRoomChannelBus(RedisConnectionFactory connectionFactory, StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.container = new RedisMessageListenerContainer();
        this.container.setConnectionFactory(connectionFactory);
        this.container.afterPropertiesSet();
        this.container.start();
    }

    @Override
    public void publish(String channel, String message) {
        StoreFailures.call(null, "PUBLISH " + channel, () -> redisTemplate.convertAndSend(channel, message));
    }

    @Override
    public void subscribe(String channel, Consumer<String> handler) {
        MessageListener listener = (message, pattern) ->
                handler.accept(new String(message.getBody(), StandardCharsets.UTF_8));
        MessageListener previous = listeners.put(channel, listener);
        StoreFailures.run(null, "SUBSCRIBE " + channel, () -> {
            if (previous != null) {
                container.removeMessageListener(previous, new ChannelTopic(channel));
            }
            container.addMessageListener(listener, new ChannelTopic(channel));
        });
        log.debug("Listening on channel {}", channel);
    }

    @Override
    public void unsubscribe(String channel) {
        MessageListener listener = listeners.remove(channel);
        if (listener != null) {
            StoreFailures.run(null, "UNSUBSCRIBE " + channel,
                    () -> container.removeMessageListener(listener, new ChannelTopic(channel)));
            log.debug("Stopped listening on channel {}", channel);
        }
    }

    @Override
    public void close() {
        listeners.clear();
        try {
            container.stop();
            container.destroy();
        } catch (Exception e) {
            log.warn("Failed to close Redis listener container: {}", e.getMessage());
        }
    }
}
