package com.ombudsman.connpool;

public class PoolClosedException extends PoolException {

    private static final long serialVersionUID = -5609210541209437720L;

    public PoolClosedException(String message) {
        super(message);
    }
}
