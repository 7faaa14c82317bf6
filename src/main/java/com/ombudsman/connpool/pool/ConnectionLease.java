package com.ombudsman.connpool.pool;

import com.ombudsman.connpool.RawConnection;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A borrowed connection that goes back to its pool when the lease is closed.
 *
 * <pre>{@code
 * try (ConnectionLease<JdbcConnection> lease = pool.lease()) {
 *     lease.get().unwrap().createStatement() ...
 * }
 * }</pre>
 *
 * @param <C> the raw connection type
 */
public final class ConnectionLease<C extends RawConnection> implements AutoCloseable {

    private final ConnectionPool<C> pool;
    private final C connection;
    private final AtomicBoolean released = new AtomicBoolean();

    ConnectionLease(@NotNull ConnectionPool<C> pool, @NotNull C connection) {
        this.pool = pool;
        this.connection = connection;
    }

    /**
     * @return the borrowed connection
     * @throws IllegalStateException if the lease has been closed
     */
    public C get() {
        if (released.get()) {
            throw new IllegalStateException("Connection lease has already been released");
        }
        return connection;
    }

    /**
     * Have the connection closed instead of reused when the lease is closed.
     */
    public void evict() {
        pool.evictConnection(connection);
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(connection);
        }
    }
}
