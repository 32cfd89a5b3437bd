package com.nayem.roomsync.core;

import com.nayem.roomsync.notify.InMemoryRoomChannelBus;
import com.nayem.roomsync.store.InMemoryRoomStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.nayem.roomsync.RoomFixtures.await;
import static com.nayem.roomsync.RoomFixtures.failureOf;
import static com.nayem.roomsync.RoomFixtures.json;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Races between writers on one instance and across instances sharing a store.
 */
class RoomStateEngineConcurrencyTest {

    /**
     * Store that lets a rival writer commit right before each of the engine's
     * compare-and-set attempts, for as many attempts as configured.
     */
    static class InterferingStore extends InMemoryRoomStateStore {

        private final AtomicInteger interferences;
        final AtomicInteger attempts = new AtomicInteger();

        InterferingStore(int interferences) {
            this.interferences = new AtomicInteger(interferences);
        }

        @Override
        public synchronized boolean compareAndSet(RoomState next, long expectedVersion, StateChange change,
                                                  int historyLimit) {
            attempts.incrementAndGet();
            if (interferences.getAndDecrement() > 0) {
                RoomState current = find(next.roomId()).orElseThrow();
                RoomState rival = current.next(json("{\"rival\":" + current.version() + "}"), "rival", Instant.now());
                StateChange rivalChange = new StateChange(rival.roomId(), rival.version(), ChangeType.REPLACE,
                        rival.data(), "rival", rival.lastUpdatedAt());
                super.compareAndSet(rival, current.version(), rivalChange, historyLimit);
            }
            return super.compareAndSet(next, expectedVersion, change, historyLimit);
        }
    }

    @Test
    void testLostRaceIsRecomputedOnFreshState() throws Exception {
        InterferingStore store = new InterferingStore(1);
        RoomStateEngine engine = RoomStateEngine.builder()
                .store(store)
                .bus(new InMemoryRoomChannelBus())
                .build();
        try {
            await(engine.initializeRoomState("room-1"));

            RoomState merged = await(engine.updateState("room-1", UpdateRequest.merge(json("{\"mine\":true}")), "me"));

            assertEquals(3, merged.version());
            assertEquals(json("{\"rival\":1,\"mine\":true}"), merged.data());
            assertEquals(2, store.attempts.get());
        } finally {
            engine.disconnect();
        }
    }

    @Test
    void testLostRaceWithExpectedVersionIsNotRetried() throws Exception {
        InterferingStore store = new InterferingStore(1);
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        RoomStateEngine engine = RoomStateEngine.builder()
                .store(store)
                .bus(new InMemoryRoomChannelBus())
                .metrics(registry)
                .build();
        try {
            await(engine.initializeRoomState("room-1"));

            Throwable cause = failureOf(engine.updateState("room-1",
                    UpdateRequest.merge(json("{\"mine\":true}")), "me", 1L));

            assertInstanceOf(VersionConflictException.class, cause);
            assertEquals(1, store.attempts.get());
            assertEquals(json("{\"rival\":1}"), store.find("room-1").orElseThrow().data());
            assertEquals(1.0, registry.get("roomsync.conflicts").counter().count());
        } finally {
            engine.disconnect();
        }
    }

    @Test
    void testRetriesAreBounded() throws Exception {
        InterferingStore store = new InterferingStore(Integer.MAX_VALUE);
        RoomStateEngine engine = RoomStateEngine.builder()
                .store(store)
                .bus(new InMemoryRoomChannelBus())
                .maxCommitAttempts(3)
                .build();
        try {
            await(engine.initializeRoomState("room-1"));

            Throwable cause = failureOf(engine.patchState("room-1", "mine", true, "me"));

            assertInstanceOf(VersionConflictException.class, cause);
            assertEquals(3, store.attempts.get());
            assertNull(store.find("room-1").orElseThrow().data().get("mine"));
        } finally {
            engine.disconnect();
        }
    }

    @Test
    void testConcurrentMergesLoseNoUpdates() throws Exception {
        RoomStateEngine engine = RoomStateEngine.builder()
                .store(new InMemoryRoomStateStore())
                .bus(new InMemoryRoomChannelBus())
                .maxCommitAttempts(100)
                .threads(8)
                .build();
        try {
            await(engine.initializeRoomState("room-1"));

            int writers = 50;
            List<CompletableFuture<RoomState>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                futures.add(engine.updateState("room-1",
                        UpdateRequest.merge(json("{\"k" + i + "\":" + i + "}")), "writer-" + i));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            RoomState finalState = await(engine.getState("room-1"));
            assertEquals(writers + 1, finalState.version());
            for (int i = 0; i < writers; i++) {
                assertEquals(i, finalState.data().get("k" + i).asInt(), "missing write k" + i);
            }
            assertEquals(writers, futures.stream().map(CompletableFuture::join)
                    .map(RoomState::version).distinct().count(), "each commit gets its own version");
        } finally {
            engine.disconnect();
        }
    }

    @Test
    void testInstancesSharingStoreAndBroker() throws Exception {
        InMemoryRoomStateStore store = new InMemoryRoomStateStore();
        InMemoryRoomChannelBus.Broker broker = new InMemoryRoomChannelBus.Broker();
        RoomStateEngine first = RoomStateEngineTest.newEngine(store, new InMemoryRoomChannelBus(broker), 50);
        RoomStateEngine second = RoomStateEngineTest.newEngine(store, new InMemoryRoomChannelBus(broker), 50);
        try {
            List<StateChange> seenByFirst = new CopyOnWriteArrayList<>();
            await(first.subscribeToRoom("room-1", seenByFirst::add));

            await(first.updateState("room-1", UpdateRequest.replace(json("{\"a\":1}")), "u"));
            // warm the first instance's cache at version 1
            assertEquals(1, await(first.getState("room-1")).version());

            await(second.updateState("room-1", UpdateRequest.replace(json("{\"a\":2}")), "u"));

            assertEquals(2, seenByFirst.size());
            assertEquals(2, seenByFirst.get(1).version());

            // the version check reads the store, not the stale local cache
            Throwable cause = failureOf(first.updateState("room-1",
                    UpdateRequest.replace(json("{\"a\":3}")), "u", 1L));
            assertInstanceOf(VersionConflictException.class, cause);
            assertEquals(2, store.find("room-1").orElseThrow().version());
        } finally {
            first.disconnect();
            second.disconnect();
        }
    }

    @Test
    void testOwnCommitReplacesCachedStateOfCleanedUpRoom() throws Exception {
        InMemoryRoomStateStore store = new InMemoryRoomStateStore();
        InMemoryRoomChannelBus.Broker broker = new InMemoryRoomChannelBus.Broker();
        RoomStateEngine first = RoomStateEngineTest.newEngine(store, new InMemoryRoomChannelBus(broker), 50);
        RoomStateEngine second = RoomStateEngineTest.newEngine(store, new InMemoryRoomChannelBus(broker), 50);
        try {
            for (int i = 1; i <= 3; i++) {
                await(second.updateState("room-1", UpdateRequest.replace(json("{\"old\":" + i + "}")), "u"));
            }
            assertEquals(3, await(second.getState("room-1")).version());

            // the room restarts while the second instance still caches version 3
            await(first.cleanupRoomState("room-1"));
            await(first.updateState("room-1", UpdateRequest.replace(json("{\"fresh\":true}")), "u"));

            RoomState committed = await(second.updateState("room-1",
                    UpdateRequest.merge(json("{\"mine\":1}")), "u"));
            assertEquals(2, committed.version());

            RoomState read = await(second.getState("room-1"));
            assertEquals(2, read.version());
            assertEquals(json("{\"fresh\":true,\"mine\":1}"), read.data());
        } finally {
            first.disconnect();
            second.disconnect();
        }
    }

    @Test
    void testLoadOverlappingCleanupIsNotCached() throws Exception {
        CountDownLatch readDone = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean holdNextRead = new AtomicBoolean();
        InMemoryRoomStateStore store = new InMemoryRoomStateStore() {
            @Override
            public Optional<RoomState> find(String roomId) {
                Optional<RoomState> found = super.find(roomId);
                if (holdNextRead.compareAndSet(true, false)) {
                    readDone.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return found;
            }
        };
        RoomStateEngine engine = RoomStateEngineTest.newEngine(store, new InMemoryRoomChannelBus(), 50);
        try {
            // written behind the engine's back, so the first read misses the cache
            store.save(new RoomState("room-1", 1, json("{\"a\":3}"), Instant.now(), "u"));

            holdNextRead.set(true);
            CompletableFuture<RoomState> load = engine.getState("room-1");
            assertTrue(readDone.await(5, TimeUnit.SECONDS));

            await(engine.cleanupRoomState("room-1"));
            release.countDown();
            assertEquals(json("{\"a\":3}"), await(load).data());

            assertNull(await(engine.getState("room-1")), "deleted room must not be served from the cache");
        } finally {
            engine.disconnect();
        }
    }
}
