package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.config.SyncServerProperties;
import com.rebenew.watchParty.syncserver.exception.RoomNotFoundException;
import com.rebenew.watchParty.syncserver.model.RoomSession;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

// Tabla de salas en memoria: se crean bajo demanda y se eliminan al quedar vacías.

@Service
public class RoomRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

    private final ConcurrentHashMap<String, RoomSession> rooms = new ConcurrentHashMap<>();

    private final PlaybackClock clock;
    private final SyncServerProperties properties;
    private final ScheduledExecutorService scheduler;

    public RoomRegistry(PlaybackClock clock, SyncServerProperties properties, ScheduledExecutorService scheduler) {
        this.clock = clock;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    @PostConstruct
    public void startReaper() {
        long intervalMs = properties.getSweepInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::reclaimIdleRooms, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.info("🧹 Recolector de salas vacías iniciado (cada {}ms, ttl {})",
                intervalMs, properties.getEmptyRoomTtl());
    }

    // ====================
    // CREACIÓN / BÚSQUEDA
    // ====================

    public RoomSession getOrCreate(String roomId) {
        validateRoomId(roomId);
        return rooms.computeIfAbsent(roomId, id -> {
            logger.info("🎬 Sala creada: {}", id);
            return new RoomSession(id, clock.currentTimeMillis());
        });
    }

    /**
     * Registra una sala vacía con un id nuevo.
     */
    public RoomSession create() {
        while (true) {
            String roomId = UUID.randomUUID().toString().replace("-", "").substring(0, properties.getRoomIdLength());
            RoomSession room = new RoomSession(roomId, clock.currentTimeMillis());
            if (rooms.putIfAbsent(roomId, room) == null) {
                logger.info("🎬 Sala creada vía REST: {}", roomId);
                return room;
            }
        }
    }

    public Optional<RoomSession> find(String roomId) {
        return roomId == null ? Optional.empty() : Optional.ofNullable(rooms.get(roomId));
    }

    public RoomSession require(String roomId) {
        return find(roomId).orElseThrow(() -> new RoomNotFoundException(roomId));
    }

    public List<RoomSession> rooms() {
        return new ArrayList<>(rooms.values());
    }

    public int size() {
        return rooms.size();
    }

    // ====================
    // EXCLUSIÓN POR SALA
    // ====================

    /**
     * Ejecuta {@code action} sobre la sala con su lock tomado. Si la sala se elimina entre la
     * búsqueda y el lock, se vuelve a buscar: la acción nunca corre sobre una sala muerta.
     */
    public <T> T withJoinableRoom(String roomId, Function<RoomSession, T> action) {
        while (true) {
            RoomSession room = getOrCreate(roomId);
            synchronized (room) {
                if (room.isTerminated())
                    continue;
                return action.apply(room);
            }
        }
    }

    /**
     * Elimina la sala si ya no queda nadie. El llamador debe tener el lock de la sala.
     *
     * @return true si se eliminó
     */
    public boolean removeIfEmpty(RoomSession room) {
        if (room.isTerminated() || !room.isEmpty())
            return false;
        room.terminate();
        rooms.remove(room.getRoomId(), room);
        logger.info("🗑️ Sala eliminada (sin miembros): {} (vivió {}ms)", room.getRoomId(),
                clock.currentTimeMillis() - room.getCreatedAtMs());
        return true;
    }

    // ====================
    // MANTENIMIENTO
    // ====================

    public void reclaimIdleRooms() {
        try {
            int removed = reclaimIdleRooms(clock.currentTimeMillis());
            if (removed > 0)
                logger.info("🧹 Limpieza completada: {} salas eliminadas", removed);
        } catch (RuntimeException e) {
            logger.error("💥 Error durante la limpieza de salas: {}", e.getMessage(), e);
        }
    }

    // Salas creadas por REST a las que nunca se unió nadie
    int reclaimIdleRooms(long nowMs) {
        long ttlMs = properties.getEmptyRoomTtl().toMillis();
        int removed = 0;
        for (RoomSession room : rooms.values()) {
            synchronized (room) {
                if (room.isEmpty() && nowMs - room.getLastActivityAtMs() > ttlMs && removeIfEmpty(room))
                    removed++;
            }
        }
        return removed;
    }

    // Obtiene estadisticas del servicio
    public Map<String, Object> getServiceStats() {
        List<RoomSession> snapshot = rooms();
        Map<String, Object> stats = new HashMap<>();
        stats.put("totalRooms", snapshot.size());
        stats.put("totalMembers", snapshot.stream().mapToInt(RoomSession::getMemberCount).sum());
        stats.put("playingRooms", snapshot.stream().filter(RoomSession::isPlaying).count());
        stats.put("hostlessRooms", snapshot.stream().filter(r -> !r.hasHost()).count());
        stats.put("timestamp", clock.currentTimeMillis());
        return stats;
    }

    // ==================== VALIDACIONES ====================

    private void validateRoomId(String roomId) {
        if (roomId == null || roomId.trim().isEmpty()) {
            throw new IllegalArgumentException("roomId no puede ser nulo o vacío");
        }
    }
}
