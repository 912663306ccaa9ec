package com.koni.tracking.infrastructure.persistence.pool;

import com.koni.tracking.domain.exception.ConnectionPoolExhaustedException;
import com.koni.tracking.domain.exception.SessionOpenException;
import com.koni.tracking.domain.store.DataStoreSession;
import com.koni.tracking.domain.store.DataStoreSessionFactory;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-size pool of data store sessions shared by ingestion workers and the periodic analytics.
 * 
 * All sessions are opened when the pool is created and closed only by {@link #destroy()}.
 * A free connection is looked up under the pool lock; when none is free the lock is released
 * and the acquisition is retried by the configured {@link Retry}, so a caller waits a bounded
 * time and then gets a {@link ConnectionPoolExhaustedException}.
 */
@Slf4j
public class ConnectionPool {

    private final int capacity;
    private final Map<Integer, PooledConnection> connections;
    private final Retry acquisitionRetry;
    private final ReentrantLock lock = new ReentrantLock();
    private boolean destroyed;

    private ConnectionPool(Map<Integer, PooledConnection> connections, Retry acquisitionRetry) {
        this.capacity = connections.size();
        this.connections = Collections.unmodifiableMap(connections);
        this.acquisitionRetry = acquisitionRetry;
    }

    /**
     * Opens {@code capacity} sessions eagerly.
     * 
     * @param sessionFactory opens one session per serial id
     * @param capacity the number of sessions, fixed for the pool lifetime
     * @param acquisitionRetry bounds how long {@link #acquire()} keeps trying
     * @return the ready pool
     * @throws SessionOpenException if any session fails to open; sessions opened so far are closed
     */
    public static ConnectionPool create(DataStoreSessionFactory sessionFactory, int capacity, Retry acquisitionRetry) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Pool capacity must be positive: " + capacity);
        }

        Map<Integer, PooledConnection> opened = new LinkedHashMap<>();
        for (int serialId = 0; serialId < capacity; serialId++) {
            try {
                opened.put(serialId, new PooledConnection(serialId, sessionFactory.open(serialId)));
            } catch (RuntimeException e) {
                log.error("Failed to open session {} of {}, closing {} opened sessions",
                        serialId, capacity, opened.size(), e);
                opened.values().forEach(ConnectionPool::closeSession);
                throw e instanceof SessionOpenException
                        ? (SessionOpenException) e
                        : new SessionOpenException("Failed to open session " + serialId, e);
            }
        }

        log.info("Connection pool created: capacity={}", capacity);
        return new ConnectionPool(opened, acquisitionRetry);
    }

    /**
     * Borrows a free connection, retrying while every connection is on loan.
     * 
     * @return the lease; close it to give the connection back
     * @throws ConnectionPoolExhaustedException if no connection became free within the retry budget
     */
    public ConnectionLease acquire() {
        try {
            return acquisitionRetry.executeSupplier(this::tryAcquire);
        } catch (ConnectionPoolExhaustedException e) {
            log.warn("Connection pool exhausted after {} attempts: capacity={}",
                    acquisitionRetry.getRetryConfig().getMaxAttempts(), capacity);
            throw e;
        }
    }

    /**
     * Returns a borrowed connection.
     * 
     * @param serialId the id of the borrowed connection
     * @throws IllegalArgumentException if no connection has this id
     * @throws IllegalStateException if the connection is not on loan
     */
    public void release(int serialId) {
        lock.lock();
        try {
            PooledConnection connection = connections.get(serialId);
            if (connection == null) {
                throw new IllegalArgumentException("Unknown connection id: " + serialId);
            }
            if (!connection.isInUse()) {
                throw new IllegalStateException("Connection " + serialId + " is not on loan");
            }
            connection.markFree();
            log.debug("Connection {} released", serialId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes every session. The pool is unusable afterwards.
     * 
     * @throws IllegalStateException if any connection is still on loan
     */
    public void destroy() {
        lock.lock();
        try {
            if (destroyed) {
                return;
            }
            long onLoan = countInUse();
            if (onLoan > 0) {
                throw new IllegalStateException("Cannot destroy pool while " + onLoan + " connections are on loan");
            }
            connections.values().forEach(ConnectionPool::closeSession);
            destroyed = true;
            log.info("Connection pool destroyed: capacity={}", capacity);
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public int getInUse() {
        lock.lock();
        try {
            return (int) countInUse();
        } finally {
            lock.unlock();
        }
    }

    private ConnectionLease tryAcquire() {
        lock.lock();
        try {
            if (destroyed) {
                throw new IllegalStateException("Connection pool has been destroyed");
            }
            for (PooledConnection connection : connections.values()) {
                if (!connection.isInUse()) {
                    connection.markInUse();
                    log.debug("Connection {} acquired", connection.getSerialId());
                    return new ConnectionLease(this, connection);
                }
            }
        } finally {
            lock.unlock();
        }
        throw new ConnectionPoolExhaustedException("All " + capacity + " connections are on loan");
    }

    private long countInUse() {
        return connections.values().stream().filter(PooledConnection::isInUse).count();
    }

    private static void closeSession(PooledConnection connection) {
        DataStoreSession session = connection.getSession();
        try {
            session.close();
        } catch (RuntimeException e) {
            log.error("Failed to close session {}", connection.getSerialId(), e);
        }
    }
}
