package com.rebenew.watchParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.List;

/**
 * DTO para respuestas API - solo datos necesarios para el frontend
 */

@Getter
public class RoomResponse {
    @JsonProperty("room_id")
    private final String roomId;
    private final RoomState state;
    @JsonProperty("media_id")
    private final String mediaId;
    private final double position;
    private final boolean playing;
    @JsonProperty("host_id")
    private final String hostId;
    private final List<RoomMember> members;
    @JsonProperty("server_ts")
    private final long serverTs;

    public RoomResponse(String roomId, RoomState state, PlaybackState playback) {
        this.roomId = roomId;
        this.state = state;
        this.mediaId = playback.getMediaId();
        this.position = playback.getPosition();
        this.playing = playback.isPlaying();
        this.hostId = playback.getHostId();
        this.members = playback.getMembers();
        this.serverTs = playback.getServerTs();
    }
}
