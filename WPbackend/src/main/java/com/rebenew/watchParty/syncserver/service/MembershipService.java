package com.rebenew.watchParty.syncserver.service;

import com.rebenew.watchParty.syncserver.config.SyncServerProperties;
import com.rebenew.watchParty.syncserver.core.PlaybackClock;
import com.rebenew.watchParty.syncserver.core.RoomBroadcaster;
import com.rebenew.watchParty.syncserver.core.RoomRegistry;
import com.rebenew.watchParty.syncserver.exception.InvalidArgumentException;
import com.rebenew.watchParty.syncserver.exception.ProtocolException;
import com.rebenew.watchParty.syncserver.model.ConnectionSession;
import com.rebenew.watchParty.syncserver.model.MemberRole;
import com.rebenew.watchParty.syncserver.model.PlaybackState;
import com.rebenew.watchParty.syncserver.model.RoomSession;
import com.rebenew.watchParty.syncserver.model.ServerMessage;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;

/**
 * Join, asignación de host y salida. Cada mutación se hace con el lock de la sala tomado,
 * junto con los mensajes que genera.
 */
@Service
public class MembershipService {
    private static final Logger logger = LoggerFactory.getLogger(MembershipService.class);

    private final RoomRegistry roomRegistry;
    private final RoomBroadcaster broadcaster;
    private final PlaybackClock clock;
    private final SyncServerProperties properties;

    public MembershipService(RoomRegistry roomRegistry, RoomBroadcaster broadcaster, PlaybackClock clock,
                             SyncServerProperties properties) {
        this.roomRegistry = roomRegistry;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.properties = properties;
    }

    // ==================== JOIN ====================

    public void join(ConnectionSession connection, SyncMsg msg) {
        String roomId = trimToNull(msg.getRoom());
        if (roomId == null) {
            throw new ProtocolException("join requires a room id", CloseStatus.POLICY_VIOLATION);
        }

        if (connection.isJoined()) {
            if (!roomId.equals(connection.getRoomId())) {
                throw new InvalidArgumentException("Already joined room " + connection.getRoomId());
            }
            rejoin(connection, msg.wantsHost());
            return;
        }

        String name = normalizeName(msg.getName());
        String mediaId = trimToNull(msg.getMediaId());
        boolean wantHost = msg.wantsHost();

        roomRegistry.withJoinableRoom(roomId, room -> {
            long now = clock.currentTimeMillis();
            room.addMember(connection.getId(), name);
            room.touch(now);

            boolean host = wantHost && room.claimHost(connection.getId());
            connection.joined(roomId, name, host ? MemberRole.HOST : MemberRole.MEMBER);

            // La desconexión marca closed antes de leer roomId; aquí se hace al revés.
            if (connection.isClosed()) {
                room.removeMember(connection.getId());
                connection.left();
                roomRegistry.removeIfEmpty(room);
                logger.info("🔌 Conexión {} cerrada durante el join a la sala {}", connection.getId(), roomId);
                return null;
            }

            if (room.seedMedia(mediaId)) {
                logger.info("🎞️ Media inicial de la sala {}: {} (aportada por {})", roomId, mediaId, connection.getId());
            }

            sendWelcome(connection, room, now);
            broadcaster.broadcast(room,
                    ServerMessage.memberJoined(connection.getId(), name, room.getHostSessionId()),
                    connection.getId());

            if (host) {
                logger.info("👑 {} ({}) es host de la sala {}", name, connection.getId(), roomId);
            } else {
                logger.info("👤 {} ({}) unido a la sala {}{}", name, connection.getId(), roomId,
                        wantHost ? " (ya había host, entra como miembro)" : "");
            }
            return null;
        });
    }

    // Un miembro que vuelve a enviar join: resync, y reclamo de host si la sala no tiene
    private void rejoin(ConnectionSession connection, boolean wantHost) {
        RoomSession room = roomRegistry.find(connection.getRoomId())
                .orElseThrow(() -> new ProtocolException("Room " + connection.getRoomId() + " no longer exists"));

        synchronized (room) {
            if (room.isTerminated() || !room.hasMember(connection.getId())) {
                throw new ProtocolException("Session is not a member of room " + room.getRoomId());
            }
            long now = clock.currentTimeMillis();
            room.touch(now);

            boolean claimed = wantHost && !room.hasHost() && room.claimHost(connection.getId());
            if (claimed) {
                connection.setRole(MemberRole.HOST);
                logger.info("👑 {} ({}) reclama el host de la sala {}",
                        connection.getName(), connection.getId(), room.getRoomId());
                broadcaster.broadcast(room, ServerMessage.state(room.snapshot(now)), connection.getId());
            }
            sendWelcome(connection, room, now);
        }
    }

    // ==================== LEAVE ====================

    /**
     * Saca la conexión de su sala. El estado de reproducción no se toca aunque quien sale
     * sea el host.
     */
    public void leave(ConnectionSession connection) {
        String roomId = connection.getRoomId();
        if (roomId == null)
            return;

        RoomSession room = roomRegistry.find(roomId).orElse(null);
        if (room == null) {
            connection.left();
            return;
        }

        synchronized (room) {
            boolean wasHost = room.isHost(connection.getId());
            String name = room.removeMember(connection.getId());
            connection.left();
            if (name == null)
                return;

            room.touch(clock.currentTimeMillis());
            if (roomRegistry.removeIfEmpty(room))
                return;

            if (wasHost) {
                logger.warn("👑 Host {} ({}) salió de la sala {}; reproducción congelada hasta nuevo host",
                        name, connection.getId(), roomId);
            } else {
                logger.info("👤 {} ({}) salió de la sala {}", name, connection.getId(), roomId);
            }
            broadcaster.broadcast(room,
                    ServerMessage.memberLeft(connection.getId(), name, room.getHostSessionId()),
                    connection.getId());
        }
    }

    // ==================== UTILIDADES ====================

    private void sendWelcome(ConnectionSession connection, RoomSession room, long now) {
        PlaybackState snapshot = room.snapshot(now);
        broadcaster.send(connection, ServerMessage.welcome(connection.getId(), room.getRoomId(), snapshot.getHostId()));
        broadcaster.send(connection, ServerMessage.state(snapshot));
    }

    String normalizeName(String raw) {
        String name = trimToNull(raw);
        if (name == null)
            return properties.getDefaultName();
        int max = properties.getMaxNameLength();
        return name.length() > max ? name.substring(0, max) : name;
    }

    private static String trimToNull(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
