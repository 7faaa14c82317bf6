package com.ombudsman.connpool;

/**
 * An opaque, long-lived handle to an external resource that a {@link com.ombudsman.connpool.pool.ConnectionPool}
 * can hold on behalf of its callers.
 * <p>
 * Implementations own exactly one underlying connection. The pool never inspects the handle beyond
 * the two operations below.
 */
public interface RawConnection extends AutoCloseable {

    /**
     * Cheap liveness check performed every time an idle connection is handed out.
     *
     * @return true if the connection can still be used
     * @throws Exception if the check itself failed, which the pool treats like an unhealthy result
     */
    boolean healthProbe() throws Exception;

    /**
     * Close the underlying connection. Must be idempotent and must not throw checked exceptions.
     */
    @Override
    void close();
}
