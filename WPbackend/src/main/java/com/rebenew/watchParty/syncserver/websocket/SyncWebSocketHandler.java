package com.rebenew.watchParty.syncserver.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.watchParty.syncserver.core.ConnectionRegistry;
import com.rebenew.watchParty.syncserver.core.PlaybackClock;
import com.rebenew.watchParty.syncserver.core.RoomBroadcaster;
import com.rebenew.watchParty.syncserver.exception.ProtocolException;
import com.rebenew.watchParty.syncserver.exception.SyncException;
import com.rebenew.watchParty.syncserver.model.ConnectionSession;
import com.rebenew.watchParty.syncserver.model.ServerMessage;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import com.rebenew.watchParty.syncserver.service.MembershipService;
import com.rebenew.watchParty.syncserver.service.PlaybackService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
public class SyncWebSocketHandler extends TextWebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(SyncWebSocketHandler.class);

    private final ConnectionRegistry connections;
    private final MembershipService membershipService;
    private final PlaybackService playbackService;
    private final RoomBroadcaster broadcaster;
    private final PlaybackClock clock;
    private final ObjectMapper objectMapper;

    public SyncWebSocketHandler(ConnectionRegistry connections, MembershipService membershipService,
                                PlaybackService playbackService, RoomBroadcaster broadcaster,
                                PlaybackClock clock, ObjectMapper objectMapper) {
        this.connections = connections;
        this.membershipService = membershipService;
        this.playbackService = playbackService;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    // ==================== CICLO DE VIDA WEBSOCKET ====================

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        ConnectionSession connection = connections.register(session);
        logger.info("🔄 Nueva conexión WebSocket: {} -> cliente {}", session.getId(), connection.getId());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        ConnectionSession connection = connections.find(session);
        if (connection == null) {
            logger.warn("❌ Mensaje de un socket no registrado: {}", session.getId());
            return;
        }

        try {
            SyncMsg msg = parse(message.getPayload());
            processMessage(connection, msg);
        } catch (ProtocolException e) {
            logger.warn("❌ Error de protocolo de {}: {}", connection.getId(), e.getMessage());
            reject(connection, e);
            connection.close(e.getCloseStatus());
        } catch (SyncException e) {
            logger.warn("⚠️ Comando rechazado de {}: {} ({})", connection.getId(), e.getMessage(), e.getCode());
            reject(connection, e);
        } catch (RuntimeException e) {
            logger.error("💥 Error procesando mensaje de {}: {}", connection.getId(), e.getMessage(), e);
            broadcaster.send(connection, ServerMessage.error("protocol_error", "Internal error"));
            connection.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        ConnectionSession connection = connections.unregister(session);
        if (connection == null) {
            logger.info("🔌 Conexión cerrada: {}", session.getId());
            return;
        }
        connection.markClosed();
        String roomId = connection.getRoomId();
        membershipService.leave(connection);
        logger.info("🔌 Conexión cerrada: {} (cliente {}, sala {}, status {}, duración {}ms)",
                session.getId(), connection.getId(), roomId, status.getCode(),
                clock.currentTimeMillis() - connection.getConnectedAtMs());
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        logger.error("🚨 Error de transporte WebSocket: {} - {}", session.getId(), exception.getMessage());
    }

    // ==================== PROCESAMIENTO PRINCIPAL ====================

    private SyncMsg parse(String payload) {
        try {
            SyncMsg msg = objectMapper.readValue(payload, SyncMsg.class);
            if (msg == null || msg.getType() == null) {
                throw new ProtocolException("Message has no type");
            }
            return msg;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed message: " + e.getOriginalMessage());
        }
    }

    private void processMessage(ConnectionSession connection, SyncMsg msg) {
        logger.debug("📨 {} de {}", msg, connection.getId());

        // El primer mensaje debe ser join
        if (!connection.isJoined() && !msg.isJoin()) {
            throw new ProtocolException("Expected 'join' before '" + msg.getType() + "'");
        }

        switch (msg.getType()) {
            case SyncMsg.JOIN:
                membershipService.join(connection, msg);
                break;
            case SyncMsg.SET_MEDIA:
                playbackService.setMedia(connection, msg.getMediaId());
                break;
            case SyncMsg.PLAY:
                playbackService.play(connection);
                break;
            case SyncMsg.PAUSE:
                playbackService.pause(connection);
                break;
            case SyncMsg.SEEK:
                playbackService.seek(connection, msg.getPosition(), msg.getPlaying());
                break;
            case SyncMsg.PING:
                broadcaster.send(connection, ServerMessage.pong(msg.getT(), clock.currentTimeMillis()));
                break;
            case SyncMsg.LEAVE:
                membershipService.leave(connection);
                connection.close(CloseStatus.NORMAL);
                break;
            default:
                throw new ProtocolException("Unknown message type: " + msg.getType());
        }
    }

    private void reject(ConnectionSession connection, SyncException e) {
        broadcaster.send(connection, ServerMessage.error(e.getCode(), e.getMessage()));
    }
}
