package com.nayem.roomsync.store;

import com.nayem.roomsync.core.RoomState;
import com.nayem.roomsync.core.StateChange;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of {@link RoomStateStore}.
 * <p>
 * Suitable for:
 * - Development and testing
 * - Single-process deployments
 * </p>
 * <p>
 * One instance may be shared by several engines to stand in for a shared
 * Redis. State is lost on restart.
 * </p>
 */
public class InMemoryRoomStateStore implements RoomStateStore {

    private final Map<String, RoomState> states = new HashMap<>();
    private final Map<String, Deque<StateChange>> histories = new HashMap<>();

    @Override
    public synchronized Optional<RoomState> find(String roomId) {
        RoomState state = states.get(roomId);
        return state == null ? Optional.empty() : Optional.of(state.copy());
    }

    @Override
    public synchronized void save(RoomState state) {
        states.put(state.roomId(), state.copy());
    }

    @Override
    public synchronized boolean compareAndSet(RoomState next, long expectedVersion, StateChange change,
            int historyLimit) {
        RoomState current = states.get(next.roomId());
        long actual = current == null ? 0 : current.version();
        if (actual != expectedVersion) {
            return false;
        }
        states.put(next.roomId(), next.copy());

        Deque<StateChange> history = histories.computeIfAbsent(next.roomId(), k -> new ArrayDeque<>());
        history.addFirst(change);
        while (history.size() > historyLimit) {
            history.removeLast();
        }
        return true;
    }

    @Override
    public synchronized boolean delete(String roomId) {
        return states.remove(roomId) != null;
    }

    @Override
    public synchronized List<StateChange> history(String roomId, int limit) {
        Deque<StateChange> history = histories.get(roomId);
        if (history == null || limit <= 0) {
            return List.of();
        }
        List<StateChange> result = new ArrayList<>(Math.min(limit, history.size()));
        Iterator<StateChange> it = history.iterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    /**
     * Returns the number of rooms currently holding a document.
     */
    public synchronized int size() {
        return states.size();
    }
}
