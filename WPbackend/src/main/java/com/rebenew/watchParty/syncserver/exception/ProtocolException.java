package com.rebenew.watchParty.syncserver.exception;

import org.springframework.web.socket.CloseStatus;

/**
 * Mensaje mal formado o fuera de secuencia. Se informa al cliente y se cierra la conexión.
 */
public class ProtocolException extends SyncException {

    private final CloseStatus closeStatus;

    public ProtocolException(String message) {
        this(message, CloseStatus.PROTOCOL_ERROR);
    }

    public ProtocolException(String message, CloseStatus closeStatus) {
        super("protocol_error", message);
        this.closeStatus = closeStatus;
    }

    public CloseStatus getCloseStatus() {
        return closeStatus;
    }
}
