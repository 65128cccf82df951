package com.nicolaswinsten.lootsync.error;

/**
 * Base class for every failure a world-state operation reports back to its caller.
 * The {@link ErrorKind} decides how the failure is rendered, not the subclass.
 */
public abstract class WorldStateException extends RuntimeException {

    private final ErrorKind kind;

    protected WorldStateException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WorldStateException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
