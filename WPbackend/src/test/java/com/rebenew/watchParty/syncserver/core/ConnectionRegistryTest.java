package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.model.ConnectionSession;
import com.rebenew.watchParty.syncserver.support.ManualClock;
import com.rebenew.watchParty.syncserver.support.RecordingSocket;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class ConnectionRegistryTest {
    private final ManualClock clock = new ManualClock(5_000L);
    private final ConnectionRegistry registry = new ConnectionRegistry(clock);

    @Test
    void registerAssignsDistinctClientIdsAndConnectTime() {
        RecordingSocket first = new RecordingSocket("socket-1");
        RecordingSocket second = new RecordingSocket("socket-2");

        ConnectionSession a = registry.register(first.session());
        clock.advance(1_500);
        ConnectionSession b = registry.register(second.session());

        assertEquals(10, a.getId().length());
        assertNotEquals(a.getId(), b.getId());
        assertEquals(5_000L, a.getConnectedAtMs());
        assertEquals(6_500L, b.getConnectedAtMs());
        assertSame(a, registry.find(first.session()));
        assertSame(b, registry.findById(b.getId()));
        assertEquals(2, registry.size());
    }

    @Test
    void unregisterRemovesBothLookups() {
        RecordingSocket socket = new RecordingSocket("socket-1");
        ConnectionSession connection = registry.register(socket.session());

        assertSame(connection, registry.unregister(socket.session()));

        assertNull(registry.find(socket.session()));
        assertNull(registry.findById(connection.getId()));
        assertNull(registry.unregister(socket.session()));
        assertEquals(0, registry.size());
    }
}
