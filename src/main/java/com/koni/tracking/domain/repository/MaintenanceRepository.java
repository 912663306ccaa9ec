package com.koni.tracking.domain.repository;

import com.koni.tracking.domain.store.DataStoreSession;

/**
 * Repository interface for storage housekeeping.
 */
public interface MaintenanceRepository {
    
    /**
     * Reclaims storage of one table.
     */
    void vacuum(DataStoreSession session, String table);
}
