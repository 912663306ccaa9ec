package com.koni.tracking.infrastructure.persistence.pool;

import com.koni.tracking.domain.store.DataStoreSession;
import lombok.Getter;
import lombok.ToString;

/**
 * One session owned by the {@link ConnectionPool}.
 * The in-use flag is only read and written while the pool lock is held.
 */
@Getter
@ToString(exclude = "session")
class PooledConnection {

    private final int serialId;
    private final DataStoreSession session;
    private boolean inUse;

    PooledConnection(int serialId, DataStoreSession session) {
        this.serialId = serialId;
        this.session = session;
    }

    void markInUse() {
        this.inUse = true;
    }

    void markFree() {
        this.inUse = false;
    }
}
