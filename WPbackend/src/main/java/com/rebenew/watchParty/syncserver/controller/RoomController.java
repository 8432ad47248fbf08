package com.rebenew.watchParty.syncserver.controller;

import com.rebenew.watchParty.syncserver.core.ConnectionRegistry;
import com.rebenew.watchParty.syncserver.core.PlaybackClock;
import com.rebenew.watchParty.syncserver.core.RoomRegistry;
import com.rebenew.watchParty.syncserver.model.RoomResponse;
import com.rebenew.watchParty.syncserver.model.RoomSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Endpoints auxiliares de salas. La sincronización en sí va por WebSocket.
 *
 * Flujo principal:
 * 1. Alguien crea sala → 2. Comparte roomId → 3. Clientes se unen vía WebSocket con "join"
 */
@RestController
@RequestMapping("/rooms")
public class RoomController {
    private static final Logger logger = LoggerFactory.getLogger(RoomController.class);

    private final RoomRegistry roomRegistry;
    private final ConnectionRegistry connections;
    private final PlaybackClock clock;

    public RoomController(RoomRegistry roomRegistry, ConnectionRegistry connections, PlaybackClock clock) {
        this.roomRegistry = roomRegistry;
        this.connections = connections;
        this.clock = clock;
    }

    /**
     * Crea una sala vacía y devuelve su id
     *
     * @return {"room_id": "a1b2c3d4"}
     */
    @PostMapping("/create")
    public ResponseEntity<Map<String, String>> create() {
        RoomSession room = roomRegistry.create();
        logger.info("✅ Sala creada exitosamente: {}", room.getRoomId());
        return ResponseEntity.ok(Map.of("room_id", room.getRoomId()));
    }

    /**
     * Estado actual de una sala, con la posición ya compensada
     */
    @GetMapping("/{roomId}")
    public ResponseEntity<RoomResponse> getRoom(@PathVariable String roomId) {
        logger.debug("🔍 Consultando información de sala: {}", roomId);
        RoomSession room = roomRegistry.require(roomId);
        return ResponseEntity.ok(room.toRoomResponse(clock.currentTimeMillis()));
    }

    /**
     * Endpoint para obtener estadísticas del servicio (debug/admin)
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getServiceStats() {
        Map<String, Object> stats = roomRegistry.getServiceStats();
        stats.put("totalConnections", connections.size());
        return ResponseEntity.ok(stats);
    }
}
