package com.nayem.roomsync.core;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;

import java.util.function.Supplier;

/**
 * Translates Spring Data Redis exceptions into the engine's own taxonomy.
 */
public final class StoreFailures {

    private StoreFailures() {
    }

    public static <R> R call(String roomId, String operation, Supplier<R> call) {
        try {
            return call.get();
        } catch (QueryTimeoutException e) {
            throw new StoreTimeoutException(roomId, operation + " timed out: " + e.getMessage(), e);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(roomId, operation + " failed: " + e.getMessage(), e);
        }
    }

    public static void run(String roomId, String operation, Runnable call) {
        call(roomId, operation, () -> {
            call.run();
            return null;
        });
    }
}
