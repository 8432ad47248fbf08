package com.rebenew.watchParty.syncserver.model;

//Estados posibles de una sala de visionado sincronizado.

public enum RoomState {
    CREATED,           // Sala creada, todavía sin host
    HOSTED,            // Hay un host que controla la reproducción
    HOST_DISCONNECTED, // El host se fue - la reproducción sigue congelada en su último estado
    TERMINATED         // Sala eliminada del registro
}
