package com.koni.tracking.domain.repository;

import com.koni.tracking.domain.model.MonitorType;
import com.koni.tracking.domain.model.ViolationEvent;
import com.koni.tracking.domain.store.DataStoreSession;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for violation events (the notification table).
 */
public interface ViolationEventRepository {
    
    /**
     * Finds events of one monitor type whose violation timestamp is after {@code since},
     * processed or not.
     */
    List<ViolationEvent> findByMonitorTypeSince(DataStoreSession session, MonitorType monitorType, Instant since);
    
    /**
     * Persists a new, unprocessed event.
     */
    void save(DataStoreSession session, ViolationEvent event);
    
    /**
     * Retrieves every unprocessed event ordered by id ascending.
     */
    List<ViolationEvent> findUnprocessed(DataStoreSession session);
    
    /**
     * Marks an event processed if it is not yet.
     * 
     * @return true if this call flipped the flag, false if the event was already processed
     */
    boolean markProcessed(DataStoreSession session, long id);
    
    /**
     * Deletes events whose violation timestamp is before the cutoff.
     * 
     * @return the number of deleted rows
     */
    int deleteOlderThan(DataStoreSession session, Instant cutoff);
}
