package com.koni.tracking.domain.repository;

import com.koni.tracking.domain.model.BeaconAggregate;
import com.koni.tracking.domain.model.RssiReading;
import com.koni.tracking.domain.store.DataStoreSession;

import java.io.Reader;
import java.time.Instant;
import java.util.List;

/**
 * Repository interface for raw proximity samples.
 * This interface is part of the domain layer and defines the contract
 * for tracking data access without coupling to a specific relational engine.
 * 
 * Every operation runs on the session of a connection the caller has borrowed
 * from the pool, so multi-statement sequences can share one connection.
 */
public interface TrackingSampleRepository {
    
    /**
     * Bulk-loads staged sample records.
     * 
     * @param session the borrowed session
     * @param records CSV records in staging order
     * @return the number of rows loaded
     */
    long bulkLoad(DataStoreSession session, Reader records);
    
    /**
     * Aggregates samples per (tag, beacon) over a window.
     * A sample qualifies if its final timestamp is at or after {@code windowStart} and,
     * after correcting by the sample's recorded clock offset, at or after {@code skewCutoff}.
     * 
     * @param session the borrowed session
     * @param windowStart start of the window
     * @param skewCutoff cutoff the offset-corrected final timestamp must reach
     * @return one aggregate per (tag, beacon) pair, empty if no sample qualifies
     */
    List<BeaconAggregate> aggregateByTagAndBeacon(DataStoreSession session, Instant windowStart, Instant skewCutoff);
    
    /**
     * Retrieves the RSSI series one beacon reported for one tag.
     * 
     * @param session the borrowed session
     * @param mac the tag mac address
     * @param uuid the beacon uuid
     * @param since oldest final timestamp to include, exclusive
     * @return readings ordered by timestamp ascending
     */
    List<RssiReading> findRssiReadings(DataStoreSession session, String mac, String uuid, Instant since);
    
    /**
     * Deletes samples whose final timestamp is before the cutoff.
     * 
     * @return the number of deleted rows
     */
    int deleteOlderThan(DataStoreSession session, Instant cutoff);
}
