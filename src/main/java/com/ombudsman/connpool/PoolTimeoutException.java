package com.ombudsman.connpool;

/**
 * No connection became available before the acquire deadline. The operation may be retried.
 * When the pool recently failed to open a connection, that failure is attached as the cause.
 */
public class PoolTimeoutException extends PoolException {

    private static final long serialVersionUID = -2815383123785623309L;

    public PoolTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
