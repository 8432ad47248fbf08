package com.rebenew.watchParty.syncserver.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Una conexión de cliente. Host y miembro son la misma clase; solo cambia {@link #getRole()}.
 *
 * <p>Los envíos se serializan sobre esta instancia porque {@link WebSocketSession} no
 * admite escrituras concurrentes.
 */
public class ConnectionSession {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionSession.class);

    private final String id;
    private final WebSocketSession socket;
    private final long connectedAtMs;

    private volatile String name;
    private volatile String roomId;
    private volatile MemberRole role = MemberRole.MEMBER;
    private volatile boolean closed;

    public ConnectionSession(String id, WebSocketSession socket, long connectedAtMs) {
        this.id = id;
        this.socket = socket;
        this.connectedAtMs = connectedAtMs;
    }

    public void send(String json) throws IOException {
        synchronized (this) {
            socket.sendMessage(new TextMessage(json));
        }
    }

    public boolean isOpen() {
        return !closed && socket.isOpen();
    }

    /**
     * Marca el transporte como cerrado. Se hace antes de limpiar la membresía para que un
     * join concurrente con la desconexión lo vea (ver MembershipService#join).
     */
    public void markClosed() {
        this.closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public void close(CloseStatus status) {
        if (!socket.isOpen()) {
            return;
        }
        try {
            socket.close(status);
        } catch (IOException e) {
            logger.debug("Error cerrando sesión {}: {}", id, e.getMessage());
        }
    }

    /**
     * Se llama con el lock de la sala tomado, una vez aplicado el join.
     */
    public void joined(String roomId, String name, MemberRole role) {
        this.roomId = roomId;
        this.name = name;
        this.role = role;
    }

    public void left() {
        this.roomId = null;
        this.role = MemberRole.MEMBER;
    }

    public boolean isJoined() {
        return roomId != null;
    }

    public boolean isHost() {
        return role == MemberRole.HOST;
    }

    public String getId() {
        return id;
    }

    public long getConnectedAtMs() {
        return connectedAtMs;
    }

    public String getName() {
        return name;
    }

    public String getRoomId() {
        return roomId;
    }

    public MemberRole getRole() {
        return role;
    }

    public void setRole(MemberRole role) {
        this.role = role;
    }

    @Override
    public String toString() {
        return "ConnectionSession{id='" + id + "', name='" + name + "', roomId='" + roomId + "', role=" + role + '}';
    }
}
