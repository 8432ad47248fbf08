package com.rebenew.watchParty.syncserver.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Estado autoritativo de una sala: media actual, reproducción y miembros.
 *
 * <p>Todo acceso de escritura debe hacerse dentro de {@code synchronized (room)}; los
 * servicios toman ese lock para que la mutación y su broadcast ocurran en el mismo
 * orden para todos los miembros.
 *
 * <p>La posición guardada nunca es "en vivo": se interpreta siempre junto a
 * {@code updatedAtMs} y {@code playing} (ver {@link #effectivePosition(long)}).
 */
public class RoomSession {
    // IDENTIFICACIÓN
    private final String roomId;
    private final long createdAtMs;
    private volatile long lastActivityAtMs;
    private volatile RoomState state = RoomState.CREATED;

    // PLAYBACK
    private String mediaId;
    private double position;
    private boolean playing;
    private long updatedAtMs;

    // MIEMBROS (solo ids, las conexiones viven en ConnectionRegistry)
    private String hostSessionId;
    private final Map<String, String> members = new LinkedHashMap<>();

    public RoomSession(String roomId, long nowMs) {
        this.roomId = roomId;
        this.createdAtMs = nowMs;
        this.lastActivityAtMs = nowMs;
        this.updatedAtMs = nowMs;
    }

    // ========== DRIFT ==========

    /**
     * Posición real que ha alcanzado el media en {@code nowMs}, en segundos.
     */
    public synchronized double effectivePosition(long nowMs) {
        if (!playing) {
            return position;
        }
        long elapsedMs = Math.max(0L, nowMs - updatedAtMs);
        return position + elapsedMs / 1000.0;
    }

    // ========== MIEMBROS ==========

    public synchronized boolean addMember(String sessionId, String name) {
        return members.putIfAbsent(sessionId, name) == null;
    }

    /**
     * Quita un miembro y deja la sala sin host si era él.
     *
     * @return nombre del miembro eliminado, o {@code null} si no pertenecía a la sala
     */
    public synchronized String removeMember(String sessionId) {
        String name = members.remove(sessionId);
        if (name != null && sessionId.equals(hostSessionId)) {
            hostSessionId = null;
            state = RoomState.HOST_DISCONNECTED;
        }
        return name;
    }

    public synchronized boolean hasMember(String sessionId) {
        return members.containsKey(sessionId);
    }

    public synchronized boolean isEmpty() {
        return members.isEmpty();
    }

    public synchronized int getMemberCount() {
        return members.size();
    }

    public synchronized List<String> getMemberIds() {
        return new ArrayList<>(members.keySet());
    }

    public synchronized List<RoomMember> getMembers() {
        List<RoomMember> list = new ArrayList<>(members.size());
        members.forEach((id, name) -> list.add(new RoomMember(id, name)));
        return list;
    }

    // ========== HOST ==========

    /**
     * Da el rol de host a un miembro si nadie lo tiene.
     *
     * @return true si {@code sessionId} es el host tras la llamada
     */
    public synchronized boolean claimHost(String sessionId) {
        if (!members.containsKey(sessionId)) {
            return false;
        }
        if (hostSessionId == null) {
            hostSessionId = sessionId;
            state = RoomState.HOSTED;
        }
        return sessionId.equals(hostSessionId);
    }

    public synchronized boolean isHost(String sessionId) {
        return sessionId != null && sessionId.equals(hostSessionId);
    }

    public synchronized boolean hasHost() {
        return hostSessionId != null;
    }

    // ========== PLAYBACK ==========

    /**
     * Fija el media inicial de una sala que aún no tiene.
     *
     * @return true si se aceptó el media
     */
    public synchronized boolean seedMedia(String candidate) {
        if (mediaId != null || candidate == null) {
            return false;
        }
        mediaId = candidate;
        return true;
    }

    public synchronized void setMedia(String newMediaId, long nowMs) {
        this.mediaId = newMediaId;
        this.position = 0.0;
        this.playing = false;
        this.updatedAtMs = nowMs;
        touch(nowMs);
    }

    // Re-anclar aunque ya esté reproduciendo: la posición efectiva no cambia
    public synchronized void play(long nowMs) {
        this.position = effectivePosition(nowMs);
        this.updatedAtMs = nowMs;
        this.playing = true;
        touch(nowMs);
    }

    public synchronized void pause(long nowMs) {
        this.position = effectivePosition(nowMs);
        this.updatedAtMs = nowMs;
        this.playing = false;
        touch(nowMs);
    }

    public synchronized void seek(double newPosition, Boolean playingOverride, long nowMs) {
        this.position = newPosition;
        this.updatedAtMs = nowMs;
        if (playingOverride != null) {
            this.playing = playingOverride;
        }
        touch(nowMs);
    }

    public synchronized PlaybackState snapshot(long nowMs) {
        return PlaybackState.fromRoomSession(this, nowMs);
    }

    // ========== CICLO DE VIDA ==========

    public void touch(long nowMs) {
        if (nowMs > lastActivityAtMs) {
            lastActivityAtMs = nowMs;
        }
    }

    public synchronized void terminate() {
        this.state = RoomState.TERMINATED;
    }

    public boolean isTerminated() {
        return state == RoomState.TERMINATED;
    }

    // ========== GETTERS ==========

    public String getRoomId() {
        return roomId;
    }

    public long getCreatedAtMs() {
        return createdAtMs;
    }

    public long getLastActivityAtMs() {
        return lastActivityAtMs;
    }

    public RoomState getState() {
        return state;
    }

    public synchronized String getMediaId() {
        return mediaId;
    }

    public synchronized double getPosition() {
        return position;
    }

    public synchronized boolean isPlaying() {
        return playing;
    }

    public synchronized long getUpdatedAtMs() {
        return updatedAtMs;
    }

    public synchronized String getHostSessionId() {
        return hostSessionId;
    }

    public synchronized RoomResponse toRoomResponse(long nowMs) {
        PlaybackState snapshot = snapshot(nowMs);
        return new RoomResponse(roomId, state, snapshot);
    }

    @Override
    public String toString() {
        return "RoomSession{" +
                "roomId='" + roomId + '\'' +
                ", state=" + state +
                ", mediaId='" + mediaId + '\'' +
                ", playing=" + playing +
                ", hostSessionId='" + hostSessionId + '\'' +
                ", members=" + members.size() +
                '}';
    }
}
