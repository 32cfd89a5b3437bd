package com.nayem.roomsync.notify;

import java.util.function.Consumer;

/**
 * Publish/subscribe transport between engine instances.
 * <p>
 * A bus instance holds at most one local handler per channel;
 * {@link ChangeNotifier} multiplexes callbacks on top of it.
 * </p>
 */
public interface RoomChannelBus extends AutoCloseable {

    void publish(String channel, String message);

    /**
     * Starts delivering messages published on {@code channel} to {@code handler}.
     * Replaces any handler previously registered for the channel.
     */
    void subscribe(String channel, Consumer<String> handler);

    /**
     * Stops listening on {@code channel}. No-op if not subscribed.
     */
    void unsubscribe(String channel);

    /**
     * Releases the subscribe-mode connection. The bus is unusable afterwards.
     */
    @Override
    void close();
}
