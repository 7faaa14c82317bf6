package com.ombudsman.connpool;

/**
 * Creates new raw connections for a pool. Called repeatedly and possibly from several threads at once.
 *
 * @param <C> the raw connection type
 */
@FunctionalInterface
public interface ConnectionFactory<C extends RawConnection> {

    /**
     * Open a new connection.
     *
     * @return a new, open connection; never null
     * @throws Exception if the connection could not be opened
     */
    C create() throws Exception;
}
