package com.nayem.roomsync.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.nayem.roomsync.RoomFixtures.json;
import static org.junit.jupiter.api.Assertions.*;

public class StateCodecTest {

    private final StateCodec codec = new StateCodec();

    @Test
    void testStateIsStoredWithIsoTimestamp() {
        RoomState state = new RoomState("room-1", 3, json("{\"a\":1}"),
                Instant.parse("2024-05-01T10:15:30Z"), "user-1");

        String stored = codec.writeState(state);

        assertTrue(stored.contains("\"lastUpdatedAt\":\"2024-05-01T10:15:30Z\""), stored);
        assertEquals(state, codec.readState("room-1", stored));
    }

    @Test
    void testUnknownFieldsAreIgnored() {
        RoomState state = codec.readState("room-1",
                "{\"roomId\":\"room-1\",\"version\":2,\"data\":{},\"schema\":\"v2\"}");
        assertEquals(2, state.version());
        assertNull(state.lastUpdatedBy());
    }

    @Test
    void testCorruptStateIsReported() {
        StateSerializationException e = assertThrows(StateSerializationException.class,
                () -> codec.readState("room-1", "{not json"));
        assertEquals("room-1", e.getRoomId());
        assertFalse(e.isRetryable());

        assertThrows(StateSerializationException.class, () -> codec.readState("room-1", "null"));
    }

    @Test
    void testInvalidVersionIsRejected() {
        assertThrows(StateSerializationException.class,
                () -> codec.readState("room-1", "{\"roomId\":\"room-1\",\"version\":0,\"data\":{}}"));
    }
}
