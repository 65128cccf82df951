package com.nicolaswinsten.lootsync.presence;

/** Closes transport sessions on the server's initiative. */
public interface SessionTerminator {

    /**
     * Closes the transport connection behind {@code sessionId}.
     *
     * @return {@code false} if no open connection had that id or closing it failed
     */
    boolean terminate(String sessionId);
}
