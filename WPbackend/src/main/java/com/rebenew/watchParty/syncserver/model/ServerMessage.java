package com.rebenew.watchParty.syncserver.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mensajes salientes (servidor -> cliente).
 * Se construyen como mapas para poder enviar valores null explícitos (p. ej. host_id).
 */
public final class ServerMessage {

    public static final String WELCOME = "welcome";
    public static final String STATE = "state";
    public static final String PLAY = "play";
    public static final String PAUSE = "pause";
    public static final String SEEK = "seek";
    public static final String MEMBER_JOINED = "member_joined";
    public static final String MEMBER_LEFT = "member_left";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    private ServerMessage() {
    }

    // ==================== CONSTRUCTORES ESTÁTICOS ====================

    public static Map<String, Object> welcome(String clientId, String roomId, String hostId) {
        Map<String, Object> msg = typed(WELCOME);
        msg.put("client_id", clientId);
        msg.put("room", roomId);
        msg.put("host_id", hostId);
        return msg;
    }

    public static Map<String, Object> state(PlaybackState snapshot) {
        Map<String, Object> msg = typed(STATE);
        msg.put("media_id", snapshot.getMediaId());
        msg.put("position", snapshot.getPosition());
        msg.put("playing", snapshot.isPlaying());
        msg.put("host_id", snapshot.getHostId());
        msg.put("members", snapshot.getMembers());
        msg.put("server_ts", snapshot.getServerTs());
        return msg;
    }

    public static Map<String, Object> play(double position, long timestamp) {
        Map<String, Object> msg = typed(PLAY);
        msg.put("position", position);
        msg.put("timestamp", timestamp);
        return msg;
    }

    public static Map<String, Object> pause(double position) {
        Map<String, Object> msg = typed(PAUSE);
        msg.put("position", position);
        return msg;
    }

    public static Map<String, Object> seek(double position, boolean playing) {
        Map<String, Object> msg = typed(SEEK);
        msg.put("position", position);
        msg.put("playing", playing);
        return msg;
    }

    public static Map<String, Object> memberJoined(String clientId, String name, String hostId) {
        return membership(MEMBER_JOINED, clientId, name, hostId);
    }

    public static Map<String, Object> memberLeft(String clientId, String name, String hostId) {
        return membership(MEMBER_LEFT, clientId, name, hostId);
    }

    public static Map<String, Object> pong(Object clientToken, long serverTs) {
        Map<String, Object> msg = typed(PONG);
        msg.put("t", clientToken);
        msg.put("server_ts", serverTs);
        return msg;
    }

    public static Map<String, Object> error(String code, String message) {
        Map<String, Object> msg = typed(ERROR);
        msg.put("code", code);
        msg.put("message", message);
        return msg;
    }

    private static Map<String, Object> membership(String type, String clientId, String name, String hostId) {
        Map<String, Object> msg = typed(type);
        msg.put("client_id", clientId);
        msg.put("name", name);
        msg.put("host_id", hostId);
        return msg;
    }

    private static Map<String, Object> typed(String type) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", type);
        return msg;
    }
}
