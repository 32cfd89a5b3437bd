package com.nayem.roomsync.store;

import com.nayem.roomsync.core.RoomState;
import com.nayem.roomsync.core.StateChange;

import java.util.List;
import java.util.Optional;

/**
 * Persistence SPI for room documents and their change history.
 * <p>
 * Implementations:
 * - {@link RedisRoomStateStore} (shared across a fleet of processes)
 * - {@link InMemoryRoomStateStore} (tests, single-process deployments)
 * </p>
 * <p>
 * All methods must be safe to call from multiple threads. Only
 * {@link #compareAndSet} may be used for mutations; it is the sole guard
 * against lost updates between engine instances.
 * </p>
 */
public interface RoomStateStore extends AutoCloseable {

    /**
     * Reads the current document, bypassing any cache.
     *
     * @param roomId the room identifier
     * @return the stored state, or empty if the room does not exist
     */
    Optional<RoomState> find(String roomId);

    /**
     * Unconditionally writes {@code state}. Used only to initialize a room.
     *
     * @param state the state to persist
     */
    void save(RoomState state);

    /**
     * Atomically writes {@code next} and records {@code change} if, and only if,
     * the stored version still equals {@code expectedVersion}.
     *
     * @param next            the new revision
     * @param expectedVersion version the new revision was computed from;
     *                        0 means the room must not exist
     * @param change          history record pushed in the same atomic step
     * @param historyLimit    number of most recent history records kept
     * @return true if written, false if another writer got there first
     */
    boolean compareAndSet(RoomState next, long expectedVersion, StateChange change, int historyLimit);

    /**
     * Deletes the document. History is left in place.
     *
     * @param roomId the room identifier
     * @return true if a document was removed
     */
    boolean delete(String roomId);

    /**
     * Returns up to {@code limit} history records, newest first.
     *
     * @param roomId the room identifier
     * @param limit  maximum number of records
     * @return the records, possibly empty
     */
    List<StateChange> history(String roomId, int limit);

    /**
     * Releases connections owned by this store.
     */
    @Override
    default void close() {
    }
}
