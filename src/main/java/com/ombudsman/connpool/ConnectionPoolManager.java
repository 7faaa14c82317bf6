package com.ombudsman.connpool;

import com.ombudsman.connpool.pool.ConnectionPool;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of named connection pools. Each pool is created lazily on first use and exactly once,
 * however many threads ask for it at the same time.
 * <p>
 * Create one manager at start-up, hand it to whoever needs pools, and {@link #close()} it on shutdown.
 */
@Slf4j
public class ConnectionPoolManager implements AutoCloseable {

    private final ConcurrentMap<String, PoolHolder> pools = new ConcurrentHashMap<>();
    private final PoolConfig defaults;

    public ConnectionPoolManager() {
        this(new PoolConfig());
    }

    /**
     * @param defaults settings used for pools created without an explicit configuration
     */
    public ConnectionPoolManager(@NotNull PoolConfig defaults) {
        this.defaults = defaults;
    }

    public <C extends RawConnection> ConnectionPool<C> getOrCreatePool(@NotNull String name,
                                                                       @NotNull ConnectionFactory<C> factory) {
        return getOrCreatePool(name, factory, defaults);
    }

    /**
     * Return the pool registered under {@code name}, creating it from {@code factory} and a copy of
     * {@code config} if there is none. When the pool already exists, the factory and configuration
     * arguments are ignored.
     *
     * @param name    the pool name, also used as the pool's {@code poolName}
     * @param factory the connection factory for a new pool
     * @param config  the settings for a new pool; it is copied, never sealed
     * @param <C>     the raw connection type
     * @return the pool registered under {@code name}
     */
    @SuppressWarnings("unchecked")
    public <C extends RawConnection> ConnectionPool<C> getOrCreatePool(@NotNull String name,
                                                                       @NotNull ConnectionFactory<C> factory,
                                                                       @NotNull PoolConfig config) {
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("Pool name cannot be empty");
        }

        while (true) {
            PoolHolder holder = pools.computeIfAbsent(name, PoolHolder::new);

            try {
                return (ConnectionPool<C>) holder.getOrCreate(factory, config);
            } catch (IllegalStateException ex) {
                if (holder.isClosed()) {
                    // closed concurrently, retry with a fresh holder
                    pools.remove(name, holder);
                    continue;
                }
                pools.remove(name, holder);
                throw ex;
            } catch (RuntimeException ex) {
                pools.remove(name, holder);
                throw ex;
            }
        }
    }

    @SuppressWarnings("unchecked")
    public <C extends RawConnection> Optional<ConnectionPool<C>> getPool(@NotNull String name) {
        PoolHolder holder = pools.get(name);
        return holder == null ? Optional.empty() : Optional.ofNullable((ConnectionPool<C>) holder.pool);
    }

    public @NotNull Set<String> getPoolNames() {
        return Collections.unmodifiableSet(new TreeSet<>(pools.keySet()));
    }

    /**
     * @return a snapshot of every pool's statistics, ordered by pool name
     */
    public @NotNull Map<String, PoolStats> getAllStats() {
        Map<String, PoolStats> stats = new TreeMap<>();

        pools.forEach((name, holder) -> {
            ConnectionPool<?> pool = holder.pool;

            if (pool != null) {
                stats.put(name, pool.getStats());
            }
        });
        return stats;
    }

    public @NotNull PoolHealthReport getHealth() {
        return PoolHealthReport.from(getAllStats());
    }

    public @NotNull AggregatePoolMetrics getAggregateMetrics() {
        return AggregatePoolMetrics.from(getAllStats());
    }

    /**
     * Close one pool and forget it. A later {@link #getOrCreatePool} with the same name creates a new pool.
     *
     * @param name the pool name
     * @return true if a pool was registered under that name
     */
    public boolean closePool(@NotNull String name) {
        PoolHolder holder = pools.remove(name);

        if (holder == null) {
            return false;
        }

        holder.close();
        return true;
    }

    /**
     * Close every pool and empty the registry.
     */
    public void closeAllPools() {
        List<String> names = new ArrayList<>(pools.keySet());
        log.info("Closing {} connection pools", names.size());

        for (String name : names) {
            PoolHolder holder = pools.remove(name);

            if (holder != null) {
                try {
                    holder.close();
                } catch (RuntimeException ex) {
                    log.error("Failed to close pool {}", name, ex);
                }
            }
        }
    }

    @Override
    public void close() {
        closeAllPools();
    }

    /**
     * Creates its pool at most once.
     */
    private static final class PoolHolder {

        private final String name;
        private volatile ConnectionPool<?> pool;
        private boolean closed;

        PoolHolder(String name) {
            this.name = name;
        }

        ConnectionPool<?> getOrCreate(ConnectionFactory<? extends RawConnection> factory, PoolConfig config) {
            ConnectionPool<?> existing = pool;

            if (existing != null) {
                return existing;
            }

            synchronized (this) {
                if (closed) {
                    throw new IllegalStateException("Pool " + name + " has been closed");
                }

                if (pool == null) {
                    PoolConfig poolConfig = new PoolConfig();
                    config.copyStateTo(poolConfig);
                    poolConfig.setPoolName(name);
                    pool = newPool(poolConfig, factory);
                    log.info("Created connection pool {}", name);
                }
                return pool;
            }
        }

        private static <C extends RawConnection> ConnectionPool<C> newPool(PoolConfig config,
                                                                           ConnectionFactory<C> factory) {
            return new ConnectionPool<>(config, factory);
        }

        synchronized boolean isClosed() {
            return closed;
        }

        synchronized void close() {
            closed = true;

            if (pool != null) {
                pool.closeAll();
            }
        }
    }
}
