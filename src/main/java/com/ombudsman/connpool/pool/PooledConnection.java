/*
 * Copyright (C) 2013, 2014 Brett Wooldridge
 *
 * Modifications made by Foulest (https://github.com/Foulest)
 * for the HikariCP fork (https://github.com/Foulest/HikariCP).
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.ombudsman.connpool.pool;

import com.ombudsman.connpool.RawConnection;
import com.ombudsman.connpool.util.ClockSource;
import lombok.AccessLevel;
import lombok.Getter;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.TimeUnit;

/**
 * Entry used by the {@link ConnectionPool} to track one raw connection. Mutable fields are only
 * written while the owning pool's lock is held.
 *
 * @param <C> the raw connection type
 */
@Getter(AccessLevel.PACKAGE)
final class PooledConnection<C extends RawConnection> {

    enum State {
        IDLE,
        BORROWED,
        CLOSED
    }

    private final C connection;
    private final String poolName;
    private final long createdAt;

    long lastUsedAt;
    long lastBorrowed;
    long useCount;
    boolean markedEvicted;
    State state;

    PooledConnection(@NotNull C connection, String poolName) {
        this.connection = connection;
        this.poolName = poolName;
        createdAt = ClockSource.currentTime();
        lastUsedAt = createdAt;
        state = State.IDLE;
    }

    /**
     * Record a borrow.
     */
    void markUsed() {
        long now = ClockSource.currentTime();
        lastUsedAt = now;
        lastBorrowed = now;
        useCount++;
    }

    /**
     * @param maxAgeMs the maximum time since last use, in milliseconds
     * @return true if more than {@code maxAgeMs} has passed since the connection was last used
     */
    boolean isStale(long maxAgeMs) {
        return ClockSource.elapsedNanos(lastUsedAt) > TimeUnit.MILLISECONDS.toNanos(maxAgeMs);
    }

    /**
     * @return seconds since the connection was opened, with sub-second precision
     */
    double ageSeconds() {
        return ClockSource.elapsedNanos(createdAt) / 1_000_000_000.0;
    }

    long getAgeMillis() {
        return ClockSource.elapsedMillis(createdAt);
    }

    /**
     * Returns millis since lastBorrowed
     */
    long getMillisSinceBorrowed() {
        return ClockSource.elapsedMillis(lastBorrowed);
    }

    @Override
    public @NotNull String toString() {
        return connection + ", used " + useCount + " times, accessed "
                + ClockSource.elapsedDisplayString(lastUsedAt, ClockSource.currentTime()) + " ago, " + state;
    }
}
