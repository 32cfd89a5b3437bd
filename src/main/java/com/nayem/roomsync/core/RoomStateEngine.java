package com.nayem.roomsync.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.nayem.roomsync.notify.ChangeNotifier;
import com.nayem.roomsync.notify.RedisRoomChannelBus;
import com.nayem.roomsync.notify.RoomChannelBus;
import com.nayem.roomsync.read.SingleFlightGroup;
import com.nayem.roomsync.store.RedisRoomStateStore;
import com.nayem.roomsync.store.RoomStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Shared, versioned room state with optimistic concurrency and change
 * notification.
 * <p>
 * Any number of engines, one per backend process, may point at the same
 * {@link RoomStateStore}. Writes are serialized only by the store's
 * compare-and-set; the local cache serves {@link #getState} and is never used
 * to decide whether a write may proceed.
 * </p>
 * <p>
 * Every operation returns a future that completes on the engine's executor and
 * fails with {@link StoreTimeoutException} after the configured timeout. A
 * write that reached the store before the timeout stays committed.
 * </p>
 */
public class RoomStateEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RoomStateEngine.class);

    private final RoomStateStore store;
    private final ChangeNotifier notifier;
    private final StateCodec codec;
    private final Cache<String, RoomState> cache;
    private final SingleFlightGroup<RoomState> reads;
    private final RoomSyncMetrics metrics;
    private final ExecutorService executor;
    private final Duration timeout;
    private final Duration shutdownTimeout;
    private final int historyLimit;
    private final int maxCommitAttempts;
    private final Clock clock;
    private final List<AutoCloseable> resources;
    private final AtomicBoolean disconnected = new AtomicBoolean(false);
    // bumped on every eviction; a read-through load that overlaps one is not cached
    private final AtomicLong evictions = new AtomicLong();

    RoomStateEngine(RoomStateStore store,
            RoomChannelBus bus,
            StateCodec codec,
            RoomSyncMetrics metrics,
            ExecutorService executor,
            Duration timeout,
            Duration shutdownTimeout,
            int historyLimit,
            int maxCommitAttempts,
            long cacheMaxSize,
            Duration cacheExpireAfterWrite,
            Clock clock,
            List<AutoCloseable> resources) {
        this.store = store;
        this.codec = codec;
        this.notifier = new ChangeNotifier(bus, codec);
        this.metrics = metrics;
        this.executor = executor;
        this.timeout = timeout;
        this.shutdownTimeout = shutdownTimeout;
        this.historyLimit = historyLimit;
        this.maxCommitAttempts = maxCommitAttempts;
        this.clock = clock;
        this.resources = resources;
        this.reads = new SingleFlightGroup<>(executor);

        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .expireAfterWrite(cacheExpireAfterWrite);
        if (cacheMaxSize > 0) {
            builder.maximumSize(cacheMaxSize);
        }
        this.cache = builder.build();

        metrics.trackSubscribedRooms(notifier::subscribedRoomCount);
    }

    // ---------------------------------------------------------------- state

    /**
     * Creates (or overwrites) the room with {@code {version: 1, data: {}}}.
     */
    public CompletableFuture<RoomState> initializeRoomState(String roomId) {
        return submit(roomId, "initializeRoomState", () -> {
            RoomState state = RoomState.initial(roomId, clock.instant());
            store.save(state);
            cache.put(roomId, state);
            log.debug("Room state initialized: {}", roomId);
            return state.copy();
        });
    }

    /**
     * Returns the room's state, from the local cache when this instance holds
     * it. Completes with {@code null} if the room does not exist.
     */
    public CompletableFuture<RoomState> getState(String roomId) {
        CompletableFuture<Void> guard = guard(roomId);
        if (guard != null) {
            return guard.thenApply(v -> null);
        }

        RoomState cached = cache.getIfPresent(roomId);
        if (cached != null) {
            metrics.recordCacheHit();
            return CompletableFuture.completedFuture(cached.copy());
        }

        metrics.recordCacheMiss();
        CompletableFuture<RoomState> load;
        try {
            load = reads.doCall(roomId, () -> {
                long evictionsAtStart = evictions.get();
                return store.find(roomId)
                        .map(state -> cacheLoaded(state, evictionsAtStart))
                        .orElse(null);
            });
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(disconnectedError());
        }
        return withTimeout(roomId, "getState", load.thenApply(state -> state == null ? null : state.copy()));
    }

    public CompletableFuture<RoomState> updateState(String roomId, UpdateRequest request, String actor) {
        return updateState(roomId, request, actor, null);
    }

    /**
     * Replaces or shallow-merges the room document and bumps its version.
     * <p>
     * If the room does not exist the update becomes version 1. With a non-null
     * {@code expectedVersion} the call fails with
     * {@link VersionConflictException}, writing nothing, unless the stored
     * version equals it (use 0 to require that the room does not exist yet).
     * </p>
     */
    public CompletableFuture<RoomState> updateState(String roomId, UpdateRequest request, String actor,
            Long expectedVersion) {
        Objects.requireNonNull(request, "request");
        return submit(roomId, "updateState", () -> commitWithRetry(roomId, actor, expectedVersion, false,
                current -> new PendingChange(
                        request.applyTo(current == null ? JsonNodeFactory.instance.objectNode() : current.data()),
                        request.changeType(),
                        request.data().deepCopy())));
    }

    /**
     * Sets the value at a dot-delimited path, creating intermediate objects.
     */
    public CompletableFuture<RoomState> patchState(String roomId, String path, Object value, String actor) {
        return submit(roomId, "patchState", () -> {
            DocumentPaths.parse(path);
            JsonNode node = value == null ? NullNode.getInstance() : codec.toTree(roomId, value);
            return commitWithRetry(roomId, actor, null, true, current -> {
                ObjectNode data = current.data().deepCopy();
                DocumentPaths.set(data, path, node.deepCopy());
                ObjectNode changes = JsonNodeFactory.instance.objectNode();
                changes.set(path, node.deepCopy());
                return new PendingChange(data, ChangeType.PATCH, changes);
            });
        });
    }

    /**
     * Removes the value at a dot-delimited path. If nothing is there the
     * current state is returned unchanged: no version bump, no history, no
     * notification.
     */
    public CompletableFuture<RoomState> deleteStateKey(String roomId, String path, String actor) {
        return submit(roomId, "deleteStateKey", () -> {
            DocumentPaths.parse(path);
            return commitWithRetry(roomId, actor, null, true, current -> {
                ObjectNode data = current.data().deepCopy();
                if (!DocumentPaths.remove(data, path)) {
                    return null;
                }
                ObjectNode changes = JsonNodeFactory.instance.objectNode();
                changes.putNull(path);
                return new PendingChange(data, ChangeType.DELETE, changes);
            });
        });
    }

    // ---------------------------------------------------------------- notification

    /**
     * Registers {@code callback} for state changes of this room.
     *
     * @return the subscription id
     */
    public CompletableFuture<String> subscribeToRoom(String roomId, Consumer<StateChange> callback) {
        Objects.requireNonNull(callback, "callback");
        return submit(roomId, "subscribeToRoom",
                () -> notifier.subscribe(roomId, callback).subscriptionId());
    }

    public CompletableFuture<Void> unsubscribeFromRoom(String roomId, Consumer<StateChange> callback) {
        return submit(roomId, "unsubscribeFromRoom", () -> {
            notifier.unsubscribe(roomId, callback);
            return null;
        });
    }

    /**
     * Removes one subscription, of either kind, by the id returned at subscribe time.
     *
     * @return true if a subscription was removed
     */
    public CompletableFuture<Boolean> unsubscribe(String subscriptionId) {
        return submit(null, "unsubscribe", () -> notifier.unsubscribe(subscriptionId));
    }

    /**
     * Publishes an ad-hoc domain event on the room's event channel.
     */
    public CompletableFuture<Void> publishRoomUpdate(String roomId, String eventType, Object payload) {
        return submit(roomId, "publishRoomUpdate", () -> {
            JsonNode node = payload == null ? NullNode.getInstance() : codec.toTree(roomId, payload);
            notifier.publishEvent(roomId, new RoomEvent(eventType, node, clock.instant()));
            return null;
        });
    }

    public CompletableFuture<String> subscribeToRoomEvents(String roomId, Consumer<RoomEvent> callback) {
        Objects.requireNonNull(callback, "callback");
        return submit(roomId, "subscribeToRoomEvents",
                () -> notifier.subscribeEvents(roomId, callback).subscriptionId());
    }

    public CompletableFuture<Void> unsubscribeFromRoomEvents(String roomId, Consumer<RoomEvent> callback) {
        return submit(roomId, "unsubscribeFromRoomEvents", () -> {
            notifier.unsubscribeEvents(roomId, callback);
            return null;
        });
    }

    // ---------------------------------------------------------------- history & lifecycle

    public CompletableFuture<List<StateChange>> getStateHistory(String roomId) {
        return getStateHistory(roomId, 10);
    }

    /**
     * Returns up to {@code limit} change records, newest first. History
     * survives {@link #cleanupRoomState}.
     */
    public CompletableFuture<List<StateChange>> getStateHistory(String roomId, int limit) {
        return submit(roomId, "getStateHistory", () -> store.history(roomId, limit));
    }

    /**
     * Deletes the room document and drops this instance's listeners for it.
     */
    public CompletableFuture<Void> cleanupRoomState(String roomId) {
        return submit(roomId, "cleanupRoomState", () -> {
            store.delete(roomId);
            evict(roomId);
            notifier.dropRoom(roomId);
            log.debug("Room state cleaned up: {}", roomId);
            return null;
        });
    }

    /**
     * Returns true if this instance has local callbacks for the room.
     */
    public boolean hasLocalSubscribers(String roomId) {
        return notifier.hasSubscribers(roomId);
    }

    /**
     * Waits for in-flight operations, then releases the subscribe-mode
     * connection, the store and any resources handed to the builder.
     * Safe to call more than once.
     */
    public void disconnect() {
        if (!disconnected.compareAndSet(false, true)) {
            return;
        }
        log.info("RoomStateEngine disconnecting...");

        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Executor did not terminate within {}ms, forcing shutdown", shutdownTimeout.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        closeQuietly(notifier);
        closeQuietly(store);
        for (AutoCloseable resource : resources) {
            closeQuietly(resource);
        }
        cache.invalidateAll();
        log.info("RoomStateEngine disconnected.");
    }

    @Override
    public void close() {
        disconnect();
    }

    // ---------------------------------------------------------------- internals

    private RoomState commitWithRetry(String roomId, String actor, Long expectedVersion, boolean requireExisting,
            Function<RoomState, PendingChange> compute) {
        long start = System.nanoTime();
        for (int attempt = 1;; attempt++) {
            RoomState current = store.find(roomId).orElse(null);
            if (current == null && requireExisting) {
                throw new RoomNotFoundException(roomId);
            }

            long currentVersion = current == null ? 0 : current.version();
            if (expectedVersion != null && expectedVersion != currentVersion) {
                metrics.recordConflict();
                throw new VersionConflictException(roomId, expectedVersion, currentVersion);
            }

            PendingChange change = compute.apply(current);
            if (change == null) {
                return current.copy();
            }

            Instant now = clock.instant();
            RoomState next = current == null
                    ? new RoomState(roomId, 1, change.data(), now, actor)
                    : current.next(change.data(), actor, now);
            StateChange record = new StateChange(roomId, next.version(), change.type(), change.changes(), actor, now);

            if (store.compareAndSet(next, currentVersion, record, historyLimit)) {
                cacheCommitted(next);
                metrics.recordCommit(change.type(), start);
                log.debug("Room state updated: {} (version={}, type={})", roomId, next.version(), change.type());
                publishQuietly(record);
                return next.copy();
            }

            metrics.recordConflict();
            if (expectedVersion != null) {
                throw VersionConflictException.overwritten(roomId, expectedVersion, attempt);
            }
            if (attempt >= maxCommitAttempts) {
                log.warn("Giving up on room {} after {} conflicting commit attempts", roomId, attempt);
                throw VersionConflictException.overwritten(roomId, currentVersion, attempt);
            }
            log.debug("Concurrent write on room {} over version {}, retrying (attempt {} of {})",
                    roomId, currentVersion, attempt, maxCommitAttempts);
        }
    }

    private void publishQuietly(StateChange change) {
        try {
            notifier.publishChange(change);
        } catch (RuntimeException e) {
            metrics.recordPublishFailure();
            log.warn("Committed version {} of room {} but failed to publish the change: {}",
                    change.version(), change.roomId(), e.getMessage());
        }
    }

    /**
     * Caches a state this instance just wrote. It is what the store holds at
     * commit time, so it replaces the entry unless a later local commit got
     * there first.
     */
    private void cacheCommitted(RoomState state) {
        cache.asMap().merge(state.roomId(), state,
                (existing, candidate) -> supersedes(existing, candidate) ? existing : candidate);
    }

    /**
     * Caches a state read from the store, unless the room was evicted while
     * the read was in flight.
     */
    private RoomState cacheLoaded(RoomState state, long evictionsAtStart) {
        cache.asMap().compute(state.roomId(), (roomId, existing) -> {
            if (evictions.get() != evictionsAtStart) {
                return existing;
            }
            return existing != null && supersedes(existing, state) ? existing : state;
        });
        return state;
    }

    private void evict(String roomId) {
        cache.asMap().compute(roomId, (key, existing) -> {
            evictions.incrementAndGet();
            return null;
        });
    }

    /**
     * A room restarts at version 1 after cleanup, so a higher version alone
     * does not make a state newer; it must also have been written later.
     */
    private static boolean supersedes(RoomState existing, RoomState candidate) {
        return existing.version() > candidate.version()
                && existing.lastUpdatedAt() != null
                && candidate.lastUpdatedAt() != null
                && existing.lastUpdatedAt().isAfter(candidate.lastUpdatedAt());
    }

    private <R> CompletableFuture<R> submit(String roomId, String operation, Supplier<R> task) {
        CompletableFuture<Void> guard = guard(roomId);
        if (guard != null) {
            return guard.thenApply(v -> null);
        }
        CompletableFuture<R> future;
        try {
            future = CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(disconnectedError());
        }
        return withTimeout(roomId, operation, future);
    }

    /**
     * @return a failed future if the call must not proceed, otherwise null
     */
    private CompletableFuture<Void> guard(String roomId) {
        if (disconnected.get()) {
            return CompletableFuture.failedFuture(disconnectedError());
        }
        if (roomId != null) {
            try {
                RoomKeys.requireRoomId(roomId);
            } catch (IllegalArgumentException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return null;
    }

    private <R> CompletableFuture<R> withTimeout(String roomId, String operation, CompletableFuture<R> source) {
        CompletableFuture<R> result = new CompletableFuture<>();
        source.copy()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((value, error) -> {
                    if (error == null) {
                        result.complete(value);
                        return;
                    }
                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        result.completeExceptionally(new StoreTimeoutException(roomId, operation, timeout));
                    } else {
                        result.completeExceptionally(cause);
                    }
                });
        return result;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static IllegalStateException disconnectedError() {
        return new IllegalStateException("RoomStateEngine is disconnected");
    }

    private static void closeQuietly(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to close {}: {}", resource.getClass().getSimpleName(), e.getMessage());
        }
    }

    private record PendingChange(ObjectNode data, ChangeType type, JsonNode changes) {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for creating a {@link RoomStateEngine} instance.
     * <p>
     * Either call {@link #redis(RedisConnectionFactory)} or supply both a
     * {@link #store(RoomStateStore) store} and a {@link #bus(RoomChannelBus) bus}.
     * </p>
     */
    public static class Builder {
        private RoomStateStore store;
        private RoomChannelBus bus;
        private RedisConnectionFactory redisConnectionFactory;
        private ObjectMapper objectMapper;
        private MeterRegistry registry;
        private int historyLimit = 50;
        private Duration timeout = Duration.ofSeconds(5);
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private int maxCommitAttempts = 5;
        private long cacheMaxSize = 10_000;
        private Duration cacheExpireAfterWrite = Duration.ofSeconds(30);
        private int threads = 16;
        private String threadNamePrefix = "roomsync-";
        private Clock clock = Clock.systemUTC();
        private final List<AutoCloseable> resources = new ArrayList<>();

        /**
         * Uses Redis for both state and notifications. The connection factory is
         * not closed on disconnect unless also passed to
         * {@link #releaseOnDisconnect(AutoCloseable)}.
         *
         * @param connectionFactory factory for the command and subscribe connections
         * @return this builder
         */
        public Builder redis(RedisConnectionFactory connectionFactory) {
            this.redisConnectionFactory = connectionFactory;
            return this;
        }

        public Builder store(RoomStateStore store) {
            this.store = store;
            return this;
        }

        public Builder bus(RoomChannelBus bus) {
            this.bus = bus;
            return this;
        }

        /**
         * Sets the mapper used for state documents and channel messages. A copy
         * is taken and configured with ISO-8601 {@code java.time} support.
         *
         * @param objectMapper the mapper
         * @return this builder
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Sets the Micrometer registry for recording metrics.
         *
         * @param registry The Micrometer registry.
         * @return this builder
         */
        public Builder metrics(MeterRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Number of most recent change records kept per room. Default is 50.
         *
         * @param historyLimit history length
         * @return this builder
         */
        public Builder historyLimit(int historyLimit) {
            this.historyLimit = historyLimit;
            return this;
        }

        /**
         * Per-operation timeout. Default is 5 seconds.
         *
         * @param timeout the timeout
         * @return this builder
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Grace period for in-flight operations during {@link RoomStateEngine#disconnect()}.
         *
         * @param shutdownTimeout the grace period
         * @return this builder
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        /**
         * How many times a write without an expected version is recomputed after
         * losing a compare-and-set race. Default is 5.
         *
         * @param maxCommitAttempts attempts, including the first
         * @return this builder
         */
        public Builder maxCommitAttempts(int maxCommitAttempts) {
            this.maxCommitAttempts = maxCommitAttempts;
            return this;
        }

        /**
         * Maximum number of cached room states. Set to 0 for unbounded.
         *
         * @param cacheMaxSize the maximum
         * @return this builder
         */
        public Builder cacheMaxSize(long cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        /**
         * How long a cached state may serve reads before it is re-read from the store.
         *
         * @param cacheExpireAfterWrite the expiry
         * @return this builder
         */
        public Builder cacheExpireAfterWrite(Duration cacheExpireAfterWrite) {
            this.cacheExpireAfterWrite = cacheExpireAfterWrite;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        /**
         * Sets the prefix for executor thread names. Default is "roomsync-".
         *
         * @param prefix The thread name prefix.
         * @return this builder
         */
        public Builder threadNamePrefix(String prefix) {
            this.threadNamePrefix = prefix;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Registers a resource (e.g. a connection factory this caller created)
         * to be closed when the engine disconnects.
         *
         * @param resource the resource
         * @return this builder
         */
        public Builder releaseOnDisconnect(AutoCloseable resource) {
            this.resources.add(resource);
            return this;
        }

        /**
         * Builds and returns a configured {@link RoomStateEngine}.
         *
         * @return The new engine instance.
         * @throws IllegalStateException if no store or bus can be resolved.
         */
        public RoomStateEngine build() {
            if (historyLimit < 1) {
                throw new IllegalStateException("historyLimit must be >= 1");
            }
            if (maxCommitAttempts < 1) {
                throw new IllegalStateException("maxCommitAttempts must be >= 1");
            }

            StateCodec codec = new StateCodec(objectMapper != null ? objectMapper : new ObjectMapper());

            if (redisConnectionFactory != null) {
                StringRedisTemplate template = new StringRedisTemplate(redisConnectionFactory);
                template.afterPropertiesSet();
                if (store == null) {
                    store = new RedisRoomStateStore(template, codec);
                }
                if (bus == null) {
                    bus = new RedisRoomChannelBus(redisConnectionFactory, template);
                }
            }
            if (store == null || bus == null) {
                throw new IllegalStateException("A RoomStateStore and a RoomChannelBus are required.");
            }

            ExecutorService executor = Executors.newFixedThreadPool(threads, new NamedThreadFactory(threadNamePrefix));

            log.info("RoomStateEngine started (store={}, bus={}, historyLimit={}, timeout={}ms)",
                    store.getClass().getSimpleName(), bus.getClass().getSimpleName(),
                    historyLimit, timeout.toMillis());

            return new RoomStateEngine(store, bus, codec, new RoomSyncMetrics(registry), executor,
                    timeout, shutdownTimeout, historyLimit, maxCommitAttempts, cacheMaxSize,
                    cacheExpireAfterWrite, clock, List.copyOf(resources));
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
