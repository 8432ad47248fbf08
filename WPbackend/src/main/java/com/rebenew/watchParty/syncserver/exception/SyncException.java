package com.rebenew.watchParty.syncserver.exception;

/**
 * Base de los fallos que se notifican al cliente como mensaje {@code error}.
 * El código es el valor estable que viaja en el protocolo.
 */
public abstract class SyncException extends RuntimeException {

    private final String code;

    protected SyncException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
