package com.rebenew.watchParty.syncserver.model;

import java.util.List;

/**
 * Snapshot inmutable del estado de una sala en un instante dado.
 * La posición ya viene compensada por el tiempo transcurrido (drift).
 */
public class PlaybackState {
    private final String mediaId;
    private final double position;
    private final boolean playing;
    private final String hostId;
    private final List<RoomMember> members;
    private final long serverTs;

    public PlaybackState(String mediaId, double position, boolean playing, String hostId,
                         List<RoomMember> members, long serverTs) {
        this.mediaId = mediaId;
        this.position = position;
        this.playing = playing;
        this.hostId = hostId;
        this.members = List.copyOf(members);
        this.serverTs = serverTs;
    }

    // Metodo de fabricación desde RoomSession; el llamador debe tener el lock de la sala
    public static PlaybackState fromRoomSession(RoomSession room, long nowMs) {
        return new PlaybackState(
                room.getMediaId(),
                room.effectivePosition(nowMs),
                room.isPlaying(),
                room.getHostSessionId(),
                room.getMembers(),
                nowMs
        );
    }

    // Getters (sin setters para inmutabilidad)
    public String getMediaId() { return mediaId; }
    public double getPosition() { return position; }
    public boolean isPlaying() { return playing; }
    public String getHostId() { return hostId; }
    public List<RoomMember> getMembers() { return members; }
    public long getServerTs() { return serverTs; }
}
