package com.rebenew.watchParty.syncserver.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebenew.watchParty.syncserver.model.ConnectionSession;
import com.rebenew.watchParty.syncserver.model.RoomSession;
import com.rebenew.watchParty.syncserver.support.RecordingSocket;
import com.rebenew.watchParty.syncserver.support.SyncTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;

import static com.rebenew.watchParty.syncserver.support.SyncTestFixture.START_MS;
import static com.rebenew.watchParty.syncserver.support.SyncTestFixture.join;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncWebSocketHandlerTest {
    private SyncTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SyncTestFixture();
    }

    @Test
    void hostAndViewerStayInSync() {
        RecordingSocket a = fixture.connect();
        RecordingSocket b = fixture.connect();

        fixture.send(a, join("R1", "A", true, "movie1"));
        String aId = fixture.connection(a).getId();
        JsonNode aState = a.last("state");
        assertEquals("movie1", aState.get("media_id").asText());
        assertEquals(0.0, aState.get("position").asDouble());
        assertFalse(aState.get("playing").asBoolean());
        assertEquals(aId, aState.get("host_id").asText());

        fixture.send(b, join("R1", "B", false));
        JsonNode bState = b.last("state");
        assertEquals("movie1", bState.get("media_id").asText());
        assertEquals(aId, bState.get("host_id").asText());
        assertEquals(2, bState.get("members").size());
        assertEquals("B", a.last("member_joined").get("name").asText());

        fixture.send(a, "{\"type\":\"play\"}");
        JsonNode play = b.last("play");
        assertEquals(0.0, play.get("position").asDouble());
        assertEquals(START_MS, play.get("timestamp").asLong());

        fixture.clock.advance(5_000);
        fixture.send(a, "{\"type\":\"pause\"}");
        assertEquals(5.0, b.last("pause").get("position").asDouble(), 1e-9);

        assertTrue(a.messages("play").isEmpty());
        assertTrue(a.messages("pause").isEmpty());
    }

    @Test
    void lateJoinerReceivesDriftCompensatedSnapshot() {
        RecordingSocket host = fixture.connect();
        fixture.send(host, join("R1", "Host", true, "movie1"));
        fixture.send(host, "{\"type\":\"seek\",\"position\":10,\"playing\":true}");
        fixture.clock.advance(7_500);

        RecordingSocket late = fixture.connect();
        fixture.send(late, join("R1", "Late", false));

        JsonNode state = late.last("state");
        assertEquals(17.5, state.get("position").asDouble(), 1e-9);
        assertTrue(state.get("playing").asBoolean());
        assertEquals(START_MS + 7_500, state.get("server_ts").asLong());
    }

    @Test
    void seekAcceptsTheLegacyToField() {
        RecordingSocket host = fixture.connect();
        RecordingSocket viewer = fixture.connect();
        fixture.send(host, join("R1", "Host", true));
        fixture.send(viewer, join("R1", "Viewer", false));

        fixture.send(host, "{\"type\":\"seek\",\"to\":42.5}");

        assertEquals(42.5, viewer.last("seek").get("position").asDouble());
    }

    @Test
    void commandBeforeJoinIsAProtocolError() {
        RecordingSocket socket = fixture.connect();

        fixture.send(socket, "{\"type\":\"play\"}");

        assertEquals("protocol_error", socket.last("error").get("code").asText());
        assertEquals(CloseStatus.PROTOCOL_ERROR, socket.closeStatus());
        assertEquals(0, fixture.rooms.size());
    }

    @Test
    void joinWithoutRoomIsAPolicyViolation() {
        RecordingSocket socket = fixture.connect();

        fixture.send(socket, "{\"type\":\"join\",\"name\":\"Ann\"}");

        assertEquals("protocol_error", socket.last("error").get("code").asText());
        assertEquals(CloseStatus.POLICY_VIOLATION, socket.closeStatus());
    }

    @Test
    void malformedAndUnknownMessagesCloseTheConnection() {
        RecordingSocket garbage = fixture.connect();
        fixture.send(garbage, "{not json");
        assertEquals("protocol_error", garbage.last("error").get("code").asText());
        assertEquals(CloseStatus.PROTOCOL_ERROR, garbage.closeStatus());

        RecordingSocket untyped = fixture.connect();
        fixture.send(untyped, "{\"room\":\"R1\"}");
        assertEquals(CloseStatus.PROTOCOL_ERROR, untyped.closeStatus());

        RecordingSocket unknown = fixture.connect();
        fixture.send(unknown, join("R1", "Ann", false));
        fixture.send(unknown, "{\"type\":\"rewind\"}");
        assertEquals("protocol_error", unknown.last("error").get("code").asText());
        assertEquals(CloseStatus.PROTOCOL_ERROR, unknown.closeStatus());
    }

    @Test
    void nonHostCommandErrorsOnlyToTheSender() {
        RecordingSocket host = fixture.connect();
        RecordingSocket viewer = fixture.connect();
        fixture.send(host, join("R1", "Host", true));
        fixture.send(viewer, join("R1", "Viewer", false));
        host.clear();
        viewer.clear();

        fixture.send(viewer, "{\"type\":\"seek\",\"position\":300}");

        assertEquals("not_authorized", viewer.last("error").get("code").asText());
        assertEquals(1, viewer.count());
        assertEquals(0, host.count());
        assertTrue(viewer.isOpen());
        assertEquals(0.0, fixture.rooms.require("R1").getPosition());
    }

    @Test
    void invalidArgumentKeepsTheConnectionOpen() {
        RecordingSocket host = fixture.connect();
        fixture.send(host, join("R1", "Host", true));

        fixture.send(host, "{\"type\":\"seek\",\"position\":-3}");

        assertEquals("invalid_argument", host.last("error").get("code").asText());
        assertTrue(host.isOpen());
    }

    @Test
    void nonNumericSeekIsRejectedWithoutClosingOrLosingHost() {
        RecordingSocket host = fixture.connect();
        RecordingSocket viewer = fixture.connect();
        fixture.send(host, join("R1", "Host", true));
        fixture.send(viewer, join("R1", "Viewer", false));
        String hostId = fixture.connection(host).getId();
        viewer.clear();

        fixture.send(host, "{\"type\":\"seek\",\"position\":\"abc\"}");
        assertEquals("invalid_argument", host.last("error").get("code").asText());

        fixture.send(host, "{\"type\":\"seek\",\"position\":20,\"playing\":\"yes\"}");
        assertEquals("invalid_argument", host.last("error").get("code").asText());

        assertTrue(host.isOpen());
        assertNull(host.closeStatus());
        RoomSession room = fixture.rooms.require("R1");
        assertEquals(hostId, room.getHostSessionId());
        assertEquals(0.0, room.getPosition());
        assertFalse(room.isPlaying());
        assertEquals(0, viewer.count());

        fixture.send(host, "{\"type\":\"seek\",\"to\":20,\"playing\":true}");
        assertEquals(20.0, viewer.last("seek").get("position").asDouble());
    }

    @Test
    void pingIsAnsweredWithPong() {
        RecordingSocket socket = fixture.connect();
        fixture.send(socket, join("R1", "Ann", false));
        fixture.clock.advance(250);

        fixture.send(socket, "{\"type\":\"ping\",\"t\":12345}");

        JsonNode pong = socket.last("pong");
        assertEquals(12345, pong.get("t").asInt());
        assertEquals(START_MS + 250, pong.get("server_ts").asLong());
    }

    @Test
    void leaveMessageRemovesMemberAndClosesNormally() {
        RecordingSocket host = fixture.connect();
        RecordingSocket viewer = fixture.connect();
        fixture.send(host, join("R1", "Host", true));
        fixture.send(viewer, join("R1", "Viewer", false));

        fixture.send(viewer, "{\"type\":\"leave\"}");

        assertEquals("Viewer", host.last("member_left").get("name").asText());
        assertEquals(CloseStatus.NORMAL, viewer.closeStatus());
        assertEquals(1, fixture.rooms.require("R1").getMemberCount());
    }

    @Test
    void hostDisconnectBlocksCommandsUntilReclaimed() {
        RecordingSocket host = fixture.connect();
        RecordingSocket viewer = fixture.connect();
        fixture.send(host, join("R1", "Host", true, "movie1"));
        fixture.send(viewer, join("R1", "Viewer", false));
        fixture.send(host, "{\"type\":\"play\"}");
        fixture.clock.advance(4_000);

        fixture.disconnect(host);

        JsonNode left = viewer.last("member_left");
        assertTrue(left.get("host_id").isNull());
        assertNull(fixture.connection(host));

        fixture.send(viewer, "{\"type\":\"pause\"}");
        assertEquals("not_authorized", viewer.last("error").get("code").asText());

        RecordingSocket late = fixture.connect();
        fixture.send(late, join("R1", "Late", false));
        JsonNode lateState = late.last("state");
        assertEquals(4.0, lateState.get("position").asDouble(), 1e-9);
        assertTrue(lateState.get("playing").asBoolean());
        assertTrue(lateState.get("host_id").isNull());

        fixture.send(viewer, join("R1", "Viewer", true));
        ConnectionSession reclaimed = fixture.connection(viewer);
        assertEquals(reclaimed.getId(), late.last("state").get("host_id").asText());

        fixture.clock.advance(1_000);
        fixture.send(viewer, "{\"type\":\"pause\"}");
        assertEquals(5.0, late.last("pause").get("position").asDouble(), 1e-9);
    }

    @Test
    void lastDisconnectRemovesTheRoom() {
        RecordingSocket socket = fixture.connect();
        fixture.send(socket, join("R1", "Ann", true));
        RoomSession room = fixture.rooms.require("R1");

        fixture.disconnect(socket);

        assertTrue(room.isTerminated());
        assertEquals(0, fixture.rooms.size());
        assertEquals(0, fixture.connections.size());
    }
}
