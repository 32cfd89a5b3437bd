package com.nayem.roomsync.notify;

import java.util.function.Consumer;

/**
 * A callback registered for one room on one channel kind.
 *
 * @param <M> the message type delivered to the callback
 */
public record Subscription<M>(String subscriptionId, String roomId, Consumer<M> callback) {
}
