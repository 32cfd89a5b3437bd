package com.nayem.roomsync.core;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer metrics for commit throughput, conflicts and notification health.
 * A {@code null} registry turns every method into a no-op.
 */
public class RoomSyncMetrics {

    private final MeterRegistry registry;
    private final Map<ChangeType, Counter> commitCounters;
    private final Timer commitTimer;
    private final Counter conflictCounter;
    private final Counter publishFailureCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public RoomSyncMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.commitCounters = new EnumMap<>(ChangeType.class);

        if (registry != null) {
            for (ChangeType type : ChangeType.values()) {
                commitCounters.put(type, Counter.builder("roomsync.commits")
                        .description("Committed room state mutations")
                        .tag("type", type.name().toLowerCase())
                        .register(registry));
            }

            this.commitTimer = Timer.builder("roomsync.commit.duration")
                    .description("Time from first read to successful compare-and-set")
                    .register(registry);

            this.conflictCounter = Counter.builder("roomsync.conflicts")
                    .description("Rejected compare-and-set attempts and stale expected versions")
                    .register(registry);

            this.publishFailureCounter = Counter.builder("roomsync.publish.failures")
                    .description("Change notifications that failed after a successful commit")
                    .register(registry);

            this.cacheHitCounter = Counter.builder("roomsync.cache")
                    .tag("result", "hit")
                    .register(registry);

            this.cacheMissCounter = Counter.builder("roomsync.cache")
                    .tag("result", "miss")
                    .register(registry);
        } else {
            this.commitTimer = null;
            this.conflictCounter = null;
            this.publishFailureCounter = null;
            this.cacheHitCounter = null;
            this.cacheMissCounter = null;
        }
    }

    public void trackSubscribedRooms(Supplier<Number> subscribedRooms) {
        if (registry != null) {
            Gauge.builder("roomsync.subscriptions.rooms", subscribedRooms)
                    .description("Rooms with at least one local state subscriber")
                    .register(registry);
        }
    }

    public void recordCommit(ChangeType type, long startNanos) {
        if (registry != null) {
            commitCounters.get(type).increment();
            commitTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }

    public void recordConflict() {
        if (conflictCounter != null) {
            conflictCounter.increment();
        }
    }

    public void recordPublishFailure() {
        if (publishFailureCounter != null) {
            publishFailureCounter.increment();
        }
    }

    public void recordCacheHit() {
        if (cacheHitCounter != null) {
            cacheHitCounter.increment();
        }
    }

    public void recordCacheMiss() {
        if (cacheMissCounter != null) {
            cacheMissCounter.increment();
        }
    }
}
