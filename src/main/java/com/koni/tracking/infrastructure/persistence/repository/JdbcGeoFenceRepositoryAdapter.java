package com.koni.tracking.infrastructure.persistence.repository;

import com.koni.tracking.domain.model.GeoFenceMonitoredObject;
import com.koni.tracking.domain.model.GeoFenceSetting;
import com.koni.tracking.domain.model.MonitorType;
import com.koni.tracking.domain.repository.GeoFenceRepository;
import com.koni.tracking.domain.store.DataStoreSession;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class JdbcGeoFenceRepositoryAdapter implements GeoFenceRepository {

    private static final String FIND_ACTIVE_SETTINGS =
            "SELECT area_id, id, name, perimeters, fences FROM geo_fence_config "
                    + "WHERE is_active = 1 ORDER BY area_id ASC, id ASC";

    private static final String FIND_MONITORED_OBJECTS =
            "SELECT area_id, mac_address FROM object_table WHERE monitor_type & ? = ? ORDER BY area_id ASC";

    @Override
    public List<GeoFenceSetting> findActiveSettings(DataStoreSession session) {
        return session.query(FIND_ACTIVE_SETTINGS, (row, rowNum) -> new GeoFenceSetting(
                row.getInt("area_id"),
                row.getLong("id"),
                row.getString("name"),
                row.getString("perimeters"),
                row.getString("fences")));
    }

    @Override
    public List<GeoFenceMonitoredObject> findMonitoredObjects(DataStoreSession session) {
        int geoFence = MonitorType.GEO_FENCE.getCode();
        return session.query(FIND_MONITORED_OBJECTS,
                (row, rowNum) -> new GeoFenceMonitoredObject(row.getInt("area_id"), row.getString("mac_address")),
                geoFence, geoFence);
    }
}
