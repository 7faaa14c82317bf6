package com.ombudsman.connpool;

/**
 * The connection factory failed to open a connection.
 */
public class ResourceCreationException extends PoolException {

    private static final long serialVersionUID = 7036129816285123401L;

    public ResourceCreationException(String message) {
        super(message);
    }

    public ResourceCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
