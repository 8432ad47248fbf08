package com.rebenew.watchParty.syncserver.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.watchParty.syncserver.model.ConnectionSession;
import com.rebenew.watchParty.syncserver.model.RoomSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Fan-out de mensajes a los miembros de una sala.
 *
 * <p>Si falla el envío a un destinatario se registra y se sigue con el resto; el error
 * nunca llega a quien envió el comando.
 */
@Component
public class RoomBroadcaster {
    private static final Logger logger = LoggerFactory.getLogger(RoomBroadcaster.class);

    private final ConnectionRegistry connections;
    private final ObjectMapper objectMapper;

    public RoomBroadcaster(ConnectionRegistry connections, ObjectMapper objectMapper) {
        this.connections = connections;
        this.objectMapper = objectMapper;
    }

    /**
     * Envía {@code payload} a todos los miembros de {@code room} menos {@code excludeSessionId}.
     * Hay que llamarlo con el lock de la sala tomado para que el orden coincida con el de las mutaciones.
     *
     * @return número de miembros a los que se entregó
     */
    public int broadcast(RoomSession room, Object payload, String excludeSessionId) {
        if (room == null)
            return 0;

        String json = serialize(payload);
        if (json == null)
            return 0;

        int delivered = 0;
        for (String memberId : room.getMemberIds()) {
            if (memberId.equals(excludeSessionId))
                continue;

            ConnectionSession target = connections.findById(memberId);
            if (target == null) {
                logger.warn("⚠️ Miembro {} de la sala {} sin conexión registrada", memberId, room.getRoomId());
                continue;
            }
            if (safeSend(target, json))
                delivered++;
        }
        logger.debug("📢 Broadcast en sala {}: {} entregas (excluido: {})",
                room.getRoomId(), delivered, excludeSessionId);
        return delivered;
    }

    // Envío directo a una sola sesión (snapshot de join, errores, pong)
    public boolean send(ConnectionSession target, Object payload) {
        if (target == null)
            return false;
        String json = serialize(payload);
        return json != null && safeSend(target, json);
    }

    private boolean safeSend(ConnectionSession target, String json) {
        if (!target.isOpen()) {
            logger.warn("⚠️ Sesión {} cerrada, mensaje descartado", target.getId());
            return false;
        }
        try {
            target.send(json);
            return true;
        } catch (IOException | IllegalStateException e) {
            logger.warn("⚠️ Error enviando mensaje WebSocket a sesión {}: {}", target.getId(), e.getMessage());
            return false;
        }
    }

    private String serialize(Object payload) {
        try {
            return payload instanceof String ? (String) payload : objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            logger.error("❌ Error serializando mensaje: {}", e.getMessage(), e);
            return null;
        }
    }
}
