package com.koni.tracking.infrastructure.persistence.pool;

import com.koni.tracking.domain.store.DataStoreSession;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A connection on loan from the {@link ConnectionPool}.
 * 
 * Closing the lease returns the connection to the pool exactly once, so a
 * try-with-resources block releases it on every return path.
 */
public class ConnectionLease implements AutoCloseable {

    private final ConnectionPool pool;
    private final PooledConnection connection;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ConnectionLease(ConnectionPool pool, PooledConnection connection) {
        this.pool = pool;
        this.connection = connection;
    }

    public int getSerialId() {
        return connection.getSerialId();
    }

    /**
     * @return the borrowed session, usable only by the holder of this lease
     * @throws IllegalStateException if the lease was already closed
     */
    public DataStoreSession session() {
        if (released.get()) {
            throw new IllegalStateException("Connection " + connection.getSerialId() + " was already returned");
        }
        return connection.getSession();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(connection.getSerialId());
        }
    }
}
