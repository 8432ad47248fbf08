package com.rebenew.watchParty.syncserver.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebenew.watchParty.syncserver.core.PlaybackClock;
import com.rebenew.watchParty.syncserver.core.RoomBroadcaster;
import com.rebenew.watchParty.syncserver.core.RoomRegistry;
import com.rebenew.watchParty.syncserver.exception.InvalidArgumentException;
import com.rebenew.watchParty.syncserver.exception.NotAuthorizedException;
import com.rebenew.watchParty.syncserver.exception.ProtocolException;
import com.rebenew.watchParty.syncserver.model.ConnectionSession;
import com.rebenew.watchParty.syncserver.model.RoomSession;
import com.rebenew.watchParty.syncserver.model.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.function.Consumer;

@Service
public class PlaybackService {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackService.class);

    private final RoomRegistry roomRegistry;
    private final RoomBroadcaster broadcaster;
    private final PlaybackClock clock;

    public PlaybackService(RoomRegistry roomRegistry, RoomBroadcaster broadcaster, PlaybackClock clock) {
        this.roomRegistry = roomRegistry;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    public void setMedia(ConnectionSession sender, String mediaId) {
        String media = mediaId != null ? mediaId.trim() : "";
        withHostRoom(sender, "set_media", room -> {
            if (media.isEmpty()) {
                throw new InvalidArgumentException("set_media requires a non-empty media_id");
            }
            long now = clock.currentTimeMillis();
            room.setMedia(media, now);
            broadcaster.broadcast(room, ServerMessage.state(room.snapshot(now)), sender.getId());
            logger.info("🎞️ Media cambiada en sala {} por {}: {}", room.getRoomId(), sender.getId(), media);
        });
    }

    public void play(ConnectionSession sender) {
        withHostRoom(sender, "play", room -> {
            long now = clock.currentTimeMillis();
            boolean wasPlaying = room.isPlaying();
            room.play(now);
            broadcaster.broadcast(room, ServerMessage.play(room.getPosition(), now), sender.getId());
            logger.info("▶️ Play en sala {} por {} (position: {}s{})", room.getRoomId(), sender.getId(),
                    room.getPosition(), wasPlaying ? ", ya reproduciendo" : "");
        });
    }

    public void pause(ConnectionSession sender) {
        withHostRoom(sender, "pause", room -> {
            long now = clock.currentTimeMillis();
            room.pause(now);
            broadcaster.broadcast(room, ServerMessage.pause(room.getPosition()), sender.getId());
            logger.info("⏸️ Pausa en sala {} por {} (position: {}s)", room.getRoomId(), sender.getId(),
                    room.getPosition());
        });
    }

    /**
     * Seek con los campos tal como llegan en el mensaje; la conversión se valida después
     * de comprobar que el emisor es host.
     */
    public void seek(ConnectionSession sender, JsonNode position, JsonNode playing) {
        withHostRoom(sender, "seek", room -> applySeek(sender, room, toPosition(position), toPlaying(playing)));
    }

    /**
     * @param playing si es {@code null} se mantiene el estado de reproducción actual
     */
    public void seek(ConnectionSession sender, Double position, Boolean playing) {
        withHostRoom(sender, "seek", room -> applySeek(sender, room, position, playing));
    }

    private void applySeek(ConnectionSession sender, RoomSession room, Double position, Boolean playing) {
        if (position == null || position.isNaN() || position.isInfinite() || position < 0) {
            throw new InvalidArgumentException("seek requires a non-negative position, got " + position);
        }
        long now = clock.currentTimeMillis();
        room.seek(position, playing, now);
        broadcaster.broadcast(room, ServerMessage.seek(room.getPosition(), room.isPlaying()), sender.getId());
        logger.info("🔍 Seek en sala {} por {} a {}s", room.getRoomId(), sender.getId(), position);
    }

    private static Double toPosition(JsonNode node) {
        if (node == null || node.isNull())
            return null;
        if (!node.isNumber()) {
            throw new InvalidArgumentException("seek position must be a number, got " + node);
        }
        return node.doubleValue();
    }

    private static Boolean toPlaying(JsonNode node) {
        if (node == null || node.isNull())
            return null;
        if (!node.isBoolean()) {
            throw new InvalidArgumentException("seek playing must be a boolean, got " + node);
        }
        return node.booleanValue();
    }

    // Resuelve la sala del emisor, toma su lock y verifica que sea el host
    private void withHostRoom(ConnectionSession sender, String command, Consumer<RoomSession> action) {
        RoomSession room = roomRegistry.find(sender.getRoomId())
                .orElseThrow(() -> new ProtocolException("Room " + sender.getRoomId() + " no longer exists"));

        synchronized (room) {
            if (!room.isHost(sender.getId())) {
                logger.warn("🚫 {} sin permisos para '{}' en sala {} (host actual: {})",
                        sender.getId(), command, room.getRoomId(), room.getHostSessionId());
                throw new NotAuthorizedException(command);
            }
            action.accept(room);
        }
    }
}
