package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.model.ConnectionSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Conexiones vivas. Las salas solo guardan ids; aquí se resuelven a la sesión real.
 */
@Component
public class ConnectionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private static final int CLIENT_ID_LENGTH = 10;

    private final ConcurrentMap<String, ConnectionSession> bySocketId = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ConnectionSession> byClientId = new ConcurrentHashMap<>();
    private final PlaybackClock clock;

    public ConnectionRegistry(PlaybackClock clock) {
        this.clock = clock;
    }

    public ConnectionSession register(WebSocketSession socket) {
        ConnectionSession connection;
        do {
            connection = new ConnectionSession(newClientId(), socket, clock.currentTimeMillis());
        } while (byClientId.putIfAbsent(connection.getId(), connection) != null);

        bySocketId.put(socket.getId(), connection);
        logger.debug("Conexión registrada: socket {} -> cliente {}", socket.getId(), connection.getId());
        return connection;
    }

    public ConnectionSession find(WebSocketSession socket) {
        return bySocketId.get(socket.getId());
    }

    public ConnectionSession findById(String clientId) {
        return byClientId.get(clientId);
    }

    public ConnectionSession unregister(WebSocketSession socket) {
        ConnectionSession connection = bySocketId.remove(socket.getId());
        if (connection != null) {
            byClientId.remove(connection.getId(), connection);
        }
        return connection;
    }

    public int size() {
        return byClientId.size();
    }

    private static String newClientId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, CLIENT_ID_LENGTH);
    }
}
