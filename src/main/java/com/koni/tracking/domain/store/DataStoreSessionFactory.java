package com.koni.tracking.domain.store;

/**
 * Opens new data store sessions for the connection pool.
 */
@FunctionalInterface
public interface DataStoreSessionFactory {

    /**
     * Opens a session.
     *
     * @param serialId the pool slot the session will occupy
     * @return an open session
     * @throws com.koni.tracking.domain.exception.SessionOpenException if the session cannot be opened
     */
    DataStoreSession open(int serialId);
}
