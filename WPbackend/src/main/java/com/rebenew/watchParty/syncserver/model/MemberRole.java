package com.rebenew.watchParty.syncserver.model;

/**
 * Rol de una conexión dentro de su sala. Solo el {@link #HOST} puede cambiar la reproducción.
 */
public enum MemberRole {
    MEMBER,
    HOST
}
