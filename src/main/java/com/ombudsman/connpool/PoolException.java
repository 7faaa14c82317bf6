package com.ombudsman.connpool;

/**
 * Base class of every failure a pool reports to its callers. Thrown as-is when a thread is
 * interrupted while waiting for a connection.
 */
public class PoolException extends Exception {

    private static final long serialVersionUID = 4153460392937916574L;

    public PoolException(String message) {
        super(message);
    }

    public PoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
