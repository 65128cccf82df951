package com.nicolaswinsten.lootsync.error;

/** A create collided with an existing record. Never resolved by overwriting. */
public class ConflictException extends WorldStateException {

    public ConflictException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
    }
}
