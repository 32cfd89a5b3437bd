package com.nayem.roomsync.notify;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process {@link RoomChannelBus}.
 * <p>
 * Buses created from the same {@link Broker} see each other's messages, which
 * lets several engine instances share one "network" in tests. Messages are
 * delivered synchronously on the publishing thread.
 * </p>
 */
public class InMemoryRoomChannelBus implements RoomChannelBus {

    private final Broker broker;
    private final Map<String, Consumer<String>> handlers = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public InMemoryRoomChannelBus(Broker broker) {
        this.broker = broker;
    }

    public InMemoryRoomChannelBus() {
        this(new Broker());
    }

    @Override
    public void publish(String channel, String message) {
        ensureOpen();
        broker.deliver(channel, message);
    }

    @Override
    public void subscribe(String channel, Consumer<String> handler) {
        ensureOpen();
        Consumer<String> previous = handlers.put(channel, handler);
        if (previous != null) {
            broker.remove(channel, previous);
        }
        broker.add(channel, handler);
    }

    @Override
    public void unsubscribe(String channel) {
        Consumer<String> handler = handlers.remove(channel);
        if (handler != null) {
            broker.remove(channel, handler);
        }
    }

    /**
     * Returns true if this bus currently listens on {@code channel}.
     */
    public boolean isSubscribed(String channel) {
        return handlers.containsKey(channel);
    }

    @Override
    public void close() {
        closed = true;
        handlers.forEach(broker::remove);
        handlers.clear();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Channel bus is closed");
        }
    }

    /**
     * Shared message fabric for in-memory buses.
     */
    public static class Broker {

        private final Map<String, List<Consumer<String>>> channels = new ConcurrentHashMap<>();

        void add(String channel, Consumer<String> handler) {
            channels.computeIfAbsent(channel, k -> new CopyOnWriteArrayList<>()).add(handler);
        }

        void remove(String channel, Consumer<String> handler) {
            List<Consumer<String>> list = channels.get(channel);
            if (list != null) {
                list.remove(handler);
            }
        }

        void deliver(String channel, String message) {
            List<Consumer<String>> list = channels.get(channel);
            if (list != null) {
                for (Consumer<String> handler : list) {
                    handler.accept(message);
                }
            }
        }

        /**
         * Returns the number of buses listening on {@code channel}.
         */
        public int listenerCount(String channel) {
            List<Consumer<String>> list = channels.get(channel);
            return list == null ? 0 : list.size();
        }
    }
}
