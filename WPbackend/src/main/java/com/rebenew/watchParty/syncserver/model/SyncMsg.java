package com.rebenew.watchParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.Setter;

/**
 * Mensaje WebSocket entrante (cliente -> servidor).
 * Un solo formato plano para todos los comandos; cada tipo usa solo sus campos.
 */

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncMsg {
    public static final String JOIN = "join";
    public static final String LEAVE = "leave";
    public static final String SET_MEDIA = "set_media";
    public static final String PLAY = "play";
    public static final String PAUSE = "pause";
    public static final String SEEK = "seek";
    public static final String PING = "ping";

    private String type;

    // join
    private String room;
    private String name;
    @JsonProperty("want_host")
    private Boolean wantHost;

    // join / set_media
    @JsonProperty("media_id")
    private String mediaId;

    // seek ("to" es el nombre usado por clientes antiguos).
    // Se guardan sin convertir: un valor con tipo incorrecto es invalid_argument, no un mensaje mal formado.
    @JsonAlias("to")
    private JsonNode position;
    private JsonNode playing;

    // ping: token opaco que se devuelve tal cual
    private Object t;

    // Constructor público vacío para Jackson
    public SyncMsg() {
    }

    public SyncMsg(String type) {
        this.type = type;
    }

    public boolean isJoin() {
        return JOIN.equals(type);
    }

    public boolean wantsHost() {
        return Boolean.TRUE.equals(wantHost);
    }

    @Override
    public String toString() {
        return String.format("SyncMsg{type='%s', room='%s', name='%s', wantHost=%s, mediaId='%s', position=%s}",
                type, room, name, wantHost, mediaId, position);
    }
}
