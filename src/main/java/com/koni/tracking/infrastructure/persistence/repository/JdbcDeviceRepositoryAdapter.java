package com.koni.tracking.infrastructure.persistence.repository;

import com.koni.tracking.domain.model.BeaconCoordinates;
import com.koni.tracking.domain.model.BeaconRecord;
import com.koni.tracking.domain.model.GatewayRecord;
import com.koni.tracking.domain.model.HealthStatus;
import com.koni.tracking.domain.repository.DeviceRepository;
import com.koni.tracking.domain.store.DataStoreSession;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC adapter for {@link DeviceRepository} over {@code gateway_table} and {@code lbeacon_table}.
 * Registration time is written on insert only; the last report time on every upsert.
 * An identity first seen through a health report is created as {@link HealthStatus#NORMAL};
 * the reported status only applies to rows that already exist.
 */
@Component
public class JdbcDeviceRepositoryAdapter implements DeviceRepository {

    private static final String UPSERT_GATEWAY =
            "INSERT INTO gateway_table (ip_address, health_status, registered_timestamp, last_report_timestamp) "
                    + "VALUES (?, ?, NOW(), NOW()) "
                    + "ON CONFLICT (ip_address) DO UPDATE SET "
                    + "health_status = ?, "
                    + "last_report_timestamp = NOW()";

    private static final String UPSERT_BEACON =
            "INSERT INTO lbeacon_table (uuid, ip_address, health_status, gateway_ip_address, "
                    + "registered_timestamp, last_report_timestamp, coordinate_x, coordinate_y) "
                    + "VALUES (?, ?, ?, ?, ?, NOW(), ?, ?) "
                    + "ON CONFLICT (uuid) DO UPDATE SET "
                    + "ip_address = EXCLUDED.ip_address, "
                    + "health_status = EXCLUDED.health_status, "
                    + "gateway_ip_address = EXCLUDED.gateway_ip_address, "
                    + "last_report_timestamp = NOW(), "
                    + "coordinate_x = EXCLUDED.coordinate_x, "
                    + "coordinate_y = EXCLUDED.coordinate_y";

    private static final String UPSERT_BEACON_HEALTH =
            "INSERT INTO lbeacon_table (uuid, ip_address, health_status, gateway_ip_address, "
                    + "registered_timestamp, last_report_timestamp, coordinate_x, coordinate_y) "
                    + "VALUES (?, ?, ?, ?, ?, NOW(), ?, ?) "
                    + "ON CONFLICT (uuid) DO UPDATE SET "
                    + "health_status = ?, "
                    + "gateway_ip_address = EXCLUDED.gateway_ip_address, "
                    + "last_report_timestamp = NOW()";

    private static final String FIND_BEACON_COORDINATES =
            "SELECT uuid, coordinate_x, coordinate_y FROM lbeacon_table "
                    + "WHERE coordinate_x IS NOT NULL AND coordinate_y IS NOT NULL";

    @Override
    public void upsertGateway(DataStoreSession session, GatewayRecord gateway) {
        session.execute(UPSERT_GATEWAY, gateway.getIpAddress(), HealthStatus.NORMAL, gateway.getHealthStatus());
    }

    @Override
    public void upsertBeacon(DataStoreSession session, BeaconRecord beacon) {
        session.execute(UPSERT_BEACON, beaconValues(beacon, beacon.getHealthStatus()));
    }

    @Override
    public void upsertBeaconHealth(DataStoreSession session, BeaconRecord beacon) {
        Object[] insertValues = beaconValues(beacon, HealthStatus.NORMAL);
        Object[] values = Arrays.copyOf(insertValues, insertValues.length + 1);
        values[insertValues.length] = beacon.getHealthStatus();
        session.execute(UPSERT_BEACON_HEALTH, values);
    }

    @Override
    public Map<String, BeaconCoordinates> findBeaconCoordinates(DataStoreSession session) {
        List<Map.Entry<String, BeaconCoordinates>> rows = session.query(FIND_BEACON_COORDINATES,
                (row, rowNum) -> Map.entry(
                        row.getString("uuid"),
                        new BeaconCoordinates(row.getInt("coordinate_x"), row.getInt("coordinate_y"))));

        Map<String, BeaconCoordinates> coordinates = new LinkedHashMap<>();
        rows.forEach(entry -> coordinates.put(entry.getKey(), entry.getValue()));
        return coordinates;
    }

    private static Object[] beaconValues(BeaconRecord beacon, int insertedStatus) {
        return new Object[]{
                beacon.getUuid(),
                beacon.getIpAddress(),
                insertedStatus,
                beacon.getGatewayIpAddress(),
                beacon.getRegisteredAt(),
                beacon.getCoordinates().getX(),
                beacon.getCoordinates().getY()
        };
    }
}
