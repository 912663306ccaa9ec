package com.koni.tracking.domain.repository;

import com.koni.tracking.domain.model.BeaconCoordinates;
import com.koni.tracking.domain.model.BeaconRecord;
import com.koni.tracking.domain.model.GatewayRecord;
import com.koni.tracking.domain.store.DataStoreSession;

import java.util.Map;

/**
 * Repository interface for gateway and beacon identity rows.
 * Rows are inserted on first sight and updated in place afterwards; no history is kept.
 * The registration timestamp is written on insert only, the last-report timestamp always.
 */
public interface DeviceRepository {
    
    /**
     * Inserts or updates a gateway with the given health status.
     */
    void upsertGateway(DataStoreSession session, GatewayRecord gateway);
    
    /**
     * Inserts or updates a beacon registration: address, gateway, health and coordinates.
     */
    void upsertBeacon(DataStoreSession session, BeaconRecord beacon);
    
    /**
     * Inserts or updates a beacon health heartbeat: health and gateway only.
     */
    void upsertBeaconHealth(DataStoreSession session, BeaconRecord beacon);
    
    /**
     * Retrieves the coordinates of every registered beacon, keyed by uuid.
     */
    Map<String, BeaconCoordinates> findBeaconCoordinates(DataStoreSession session);
}
