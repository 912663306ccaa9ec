package com.koni.tracking.domain.repository;

import com.koni.tracking.domain.model.GeoFenceMonitoredObject;
import com.koni.tracking.domain.model.GeoFenceSetting;
import com.koni.tracking.domain.store.DataStoreSession;

import java.util.List;

/**
 * Repository interface for geofence configuration read by the geofence evaluator.
 */
public interface GeoFenceRepository {
    
    /**
     * Retrieves the geofence settings whose policy is currently active.
     */
    List<GeoFenceSetting> findActiveSettings(DataStoreSession session);
    
    /**
     * Retrieves the objects monitored for geofencing, ordered by area.
     */
    List<GeoFenceMonitoredObject> findMonitoredObjects(DataStoreSession session);
}
