package com.rebenew.watchParty.syncserver.model;

/**
 * Entrada de la lista de miembros que viaja en el snapshot de la sala.
 */
public record RoomMember(String id, String name) {
}
