package com.nicolaswinsten.lootsync.error;

/** An object or player addressed by id does not exist. */
public class NotFoundException extends WorldStateException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException object(String objectId) {
        return new NotFoundException("Object not found: " + objectId);
    }

    public static NotFoundException player(String deviceUuid) {
        return new NotFoundException("Player not found: " + deviceUuid);
    }
}
