package com.nayem.roomsync.store;

import com.nayem.roomsync.core.RoomKeys;
import com.nayem.roomsync.core.RoomState;
import com.nayem.roomsync.core.StateChange;
import com.nayem.roomsync.core.StateCodec;
import com.nayem.roomsync.core.StateSerializationException;
import com.nayem.roomsync.core.StoreFailures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed implementation of {@link RoomStateStore}.
 * <p>
 * Each room is one JSON string at {@code room:{roomId}:state}. Mutations go
 * through a Lua script that checks the stored version and, in the same atomic
 * step, writes the new document and pushes the history record onto
 * {@code room:{roomId}:state:history}. A plain GET-then-SET would let two
 * writers that both read version N both commit N+1.
 * </p>
 */
public class RedisRoomStateStore implements RoomStateStore {

    private static final Logger log = LoggerFactory.getLogger(RedisRoomStateStore.class);
    private static final String COMPARE_AND_SET_SCRIPT = "scripts/roomsync/compare_and_set.lua";
    private static final long COMMITTED = -1L;

    private final StringRedisTemplate redisTemplate;
    private final StateCodec codec;
    private final RedisScript<Long> compareAndSetScript;

    public RedisRoomStateStore(StringRedisTemplate redisTemplate, StateCodec codec) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource(COMPARE_AND_SET_SCRIPT)));
        script.setResultType(Long.class);
        this.compareAndSetScript = script;
    }

    @Override
    public Optional<RoomState> find(String roomId) {
        String json = StoreFailures.call(roomId, "GET state",
                () -> redisTemplate.opsForValue().get(RoomKeys.stateKey(roomId)));
        if (json == null) {
            return Optional.empty();
        }
        return Optional.of(codec.readState(roomId, json));
    }

    @Override
    public void save(RoomState state) {
        String json = codec.writeState(state);
        StoreFailures.run(state.roomId(), "SET state",
                () -> redisTemplate.opsForValue().set(RoomKeys.stateKey(state.roomId()), json));
    }

    @Override
    public boolean compareAndSet(RoomState next, long expectedVersion, StateChange change, int historyLimit) {
        String roomId = next.roomId();
        String stateJson = codec.writeState(next);
        String changeJson = codec.writeChange(change);

        Long result = StoreFailures.call(roomId, "compare-and-set state",
                () -> redisTemplate.execute(compareAndSetScript,
                        List.of(RoomKeys.stateKey(roomId), RoomKeys.historyKey(roomId)),
                        String.valueOf(expectedVersion),
                        stateJson,
                        changeJson,
                        String.valueOf(historyLimit)));

        if (result != null && result == COMMITTED) {
            return true;
        }
        log.debug("Compare-and-set rejected for room {}: expected version {}, store holds {}",
                roomId, expectedVersion, result);
        return false;
    }

    @Override
    public boolean delete(String roomId) {
        Boolean deleted = StoreFailures.call(roomId, "DEL state",
                () -> redisTemplate.delete(RoomKeys.stateKey(roomId)));
        return Boolean.TRUE.equals(deleted);
    }

    @Override
    public List<StateChange> history(String roomId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<String> entries = StoreFailures.call(roomId, "LRANGE history",
                () -> redisTemplate.opsForList().range(RoomKeys.historyKey(roomId), 0, limit - 1));
        if (entries == null) {
            return List.of();
        }

        List<StateChange> results = new ArrayList<>(entries.size());
        for (String json : entries) {
            try {
                results.add(codec.readChange(roomId, json));
            } catch (StateSerializationException e) {
                log.error("Skipping unreadable history entry for room {}", roomId, e);
            }
        }
        return results;
    }
}
