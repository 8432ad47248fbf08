package com.rebenew.watchParty.syncserver.exception;

public class InvalidArgumentException extends SyncException {

    public InvalidArgumentException(String message) {
        super("invalid_argument", message);
    }
}
