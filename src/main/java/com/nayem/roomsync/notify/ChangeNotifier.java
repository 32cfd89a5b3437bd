package com.nayem.roomsync.notify;

import com.nayem.roomsync.core.RoomEvent;
import com.nayem.roomsync.core.RoomKeys;
import com.nayem.roomsync.core.StateChange;
import com.nayem.roomsync.core.StateCodec;
import com.nayem.roomsync.core.StateSerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Per-instance registry of room callbacks on top of a {@link RoomChannelBus}.
 * <p>
 * The first callback for a room opens the room's channel listener; the last
 * one to leave closes it. Inbound messages are delivered only to callbacks of
 * the room the channel belongs to.
 * </p>
 */
public class ChangeNotifier implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChangeNotifier.class);

    private final RoomChannelBus bus;
    private final StateCodec codec;
    private final Registry<StateChange> updates;
    private final Registry<RoomEvent> events;

    public ChangeNotifier(RoomChannelBus bus, StateCodec codec) {
        this.bus = bus;
        this.codec = codec;
        this.updates = new Registry<>("state update", RoomKeys::updatesChannel, codec::readChange);
        this.events = new Registry<>("room event", RoomKeys::eventsChannel, codec::readEvent);
    }

    public Subscription<StateChange> subscribe(String roomId, Consumer<StateChange> callback) {
        return updates.add(roomId, callback);
    }

    public void unsubscribe(String roomId, Consumer<StateChange> callback) {
        updates.remove(roomId, callback);
    }

    public Subscription<RoomEvent> subscribeEvents(String roomId, Consumer<RoomEvent> callback) {
        return events.add(roomId, callback);
    }

    public void unsubscribeEvents(String roomId, Consumer<RoomEvent> callback) {
        events.remove(roomId, callback);
    }

    /**
     * Removes a subscription of either kind by id.
     *
     * @return true if a subscription was removed
     */
    public boolean unsubscribe(String subscriptionId) {
        return updates.removeById(subscriptionId) || events.removeById(subscriptionId);
    }

    public void publishChange(StateChange change) {
        bus.publish(RoomKeys.updatesChannel(change.roomId()), codec.writeChange(change));
    }

    public void publishEvent(String roomId, RoomEvent event) {
        bus.publish(RoomKeys.eventsChannel(roomId), codec.writeEvent(roomId, event));
    }

    /**
     * Drops every local callback for the room and closes its channel listeners.
     */
    public void dropRoom(String roomId) {
        updates.drop(roomId);
        events.drop(roomId);
    }

    /**
     * Number of rooms with at least one state-update callback on this instance.
     */
    public int subscribedRoomCount() {
        return updates.roomCount();
    }

    public boolean hasSubscribers(String roomId) {
        return updates.has(roomId) || events.has(roomId);
    }

    @Override
    public void close() {
        updates.clear();
        events.clear();
        bus.close();
    }

    private final class Registry<M> {

        private final String kind;
        private final Function<String, String> channelOf;
        private final BiFunction<String, String, M> decoder;
        private final Map<String, List<Subscription<M>>> rooms = new ConcurrentHashMap<>();
        private final Object lock = new Object();

        Registry(String kind, Function<String, String> channelOf, BiFunction<String, String, M> decoder) {
            this.kind = kind;
            this.channelOf = channelOf;
            this.decoder = decoder;
        }

        Subscription<M> add(String roomId, Consumer<M> callback) {
            Subscription<M> subscription = new Subscription<>(UUID.randomUUID().toString(), roomId, callback);
            synchronized (lock) {
                List<Subscription<M>> subscriptions = rooms.get(roomId);
                if (subscriptions == null) {
                    subscriptions = new CopyOnWriteArrayList<>();
                    bus.subscribe(channelOf.apply(roomId), message -> dispatch(roomId, message));
                    rooms.put(roomId, subscriptions);
                }
                subscriptions.add(subscription);
            }
            log.debug("Subscribed to {}s of room {} (subscriptionId={})", kind, roomId, subscription.subscriptionId());
            return subscription;
        }

        void remove(String roomId, Consumer<M> callback) {
            synchronized (lock) {
                List<Subscription<M>> subscriptions = rooms.get(roomId);
                if (subscriptions == null) {
                    return;
                }
                subscriptions.removeIf(s -> s.callback().equals(callback));
                closeIfEmpty(roomId, subscriptions);
            }
            log.debug("Unsubscribed from {}s of room {}", kind, roomId);
        }

        boolean removeById(String subscriptionId) {
            synchronized (lock) {
                for (Map.Entry<String, List<Subscription<M>>> entry : rooms.entrySet()) {
                    if (entry.getValue().removeIf(s -> s.subscriptionId().equals(subscriptionId))) {
                        closeIfEmpty(entry.getKey(), entry.getValue());
                        return true;
                    }
                }
                return false;
            }
        }

        void drop(String roomId) {
            synchronized (lock) {
                if (rooms.remove(roomId) != null) {
                    bus.unsubscribe(channelOf.apply(roomId));
                }
            }
        }

        void clear() {
            synchronized (lock) {
                rooms.clear();
            }
        }

        boolean has(String roomId) {
            return rooms.containsKey(roomId);
        }

        int roomCount() {
            return rooms.size();
        }

        private void closeIfEmpty(String roomId, List<Subscription<M>> subscriptions) {
            if (subscriptions.isEmpty()) {
                rooms.remove(roomId);
                bus.unsubscribe(channelOf.apply(roomId));
            }
        }

        private void dispatch(String roomId, String message) {
            List<Subscription<M>> subscriptions = rooms.get(roomId);
            if (subscriptions == null || subscriptions.isEmpty()) {
                return;
            }

            M decoded;
            try {
                decoded = decoder.apply(roomId, message);
            } catch (StateSerializationException e) {
                log.error("Dropping unreadable {} message for room {}", kind, roomId, e);
                return;
            }

            for (Subscription<M> subscription : subscriptions) {
                try {
                    subscription.callback().accept(decoded);
                } catch (RuntimeException e) {
                    log.error("Subscriber {} of room {} failed handling {}",
                            subscription.subscriptionId(), roomId, kind, e);
                }
            }
        }
    }
}
