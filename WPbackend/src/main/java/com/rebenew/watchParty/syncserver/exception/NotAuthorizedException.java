package com.rebenew.watchParty.syncserver.exception;

public class NotAuthorizedException extends SyncException {

    public NotAuthorizedException(String command) {
        super("not_authorized", "Only the host can send '" + command + "'");
    }
}
