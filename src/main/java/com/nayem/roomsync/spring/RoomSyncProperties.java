package com.nayem.roomsync.spring;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the room state engine.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code roomsync} prefix. The Redis connection itself is configured through
 * the standard {@code spring.data.redis.*} properties.
 * </p>
 */
@ConfigurationProperties(prefix = "roomsync")
@Validated
public class RoomSyncProperties {

    /**
     * Whether the engine bean is created at all.
     */
    private boolean enabled = true;

    /**
     * Backing store: 'redis' (shared across processes) or 'memory' (single
     * process, development and tests).
     */
    @NotBlank
    @Pattern(regexp = "(?i)redis|memory")
    private String store = "redis";

    /**
     * Number of most recent change records kept per room.
     */
    @Min(1)
    private int historyLimit = 50;

    /**
     * Upper bound for every engine operation, including its store round trips.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration timeout = Duration.ofSeconds(5);

    /**
     * How often a write without an expected version is recomputed after losing
     * a compare-and-set race before failing with a version conflict.
     */
    @Min(1)
    @Max(100)
    private int maxCommitAttempts = 5;

    /**
     * Grace period for in-flight operations when the engine is disconnected.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Executor executor = new Executor();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxCommitAttempts() {
        return maxCommitAttempts;
    }

    public void setMaxCommitAttempts(int maxCommitAttempts) {
        this.maxCommitAttempts = maxCommitAttempts;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    /**
     * Local read-through cache used by {@code getState}.
     */
    public static class Cache {
        /**
         * Maximum cached rooms. Set to 0 for unbounded.
         */
        @Min(0)
        private long maxSize = 10_000;

        /**
         * How long a cached state may serve reads before it is re-read.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration expireAfterWrite = Duration.ofSeconds(30);

        /** @return the maximum number of cached rooms */
        public long getMaxSize() {
            return maxSize;
        }

        /** @param maxSize the maximum number of cached rooms */
        public void setMaxSize(long maxSize) {
            this.maxSize = maxSize;
        }

        /** @return the cache expiry */
        public Duration getExpireAfterWrite() {
            return expireAfterWrite;
        }

        /** @param expireAfterWrite the cache expiry */
        public void setExpireAfterWrite(Duration expireAfterWrite) {
            this.expireAfterWrite = expireAfterWrite;
        }
    }

    /**
     * Thread pool that runs store round trips.
     */
    public static class Executor {
        @Min(1)
        private int threads = 16;

        /**
         * Prefix for engine thread names. Useful for monitoring and debugging.
         */
        private String threadNamePrefix = "roomsync-";

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
