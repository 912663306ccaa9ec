package com.koni.tracking.infrastructure.persistence.repository;

import com.koni.tracking.domain.model.BeaconAggregate;
import com.koni.tracking.domain.model.RssiReading;
import com.koni.tracking.domain.repository.TrackingSampleRepository;
import com.koni.tracking.domain.store.DataStoreSession;
import com.koni.tracking.infrastructure.persistence.jdbc.ResultSetValues;
import org.springframework.stereotype.Component;

import java.io.Reader;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * JDBC adapter for {@link TrackingSampleRepository} over {@code tracking_table}.
 */
@Component
public class JdbcTrackingSampleRepositoryAdapter implements TrackingSampleRepository {

    /**
     * Column order of the staged CSV records.
     */
    public static final List<String> STAGING_COLUMNS = List.of(
            "object_mac_address",
            "lbeacon_uuid",
            "rssi",
            "panic_button",
            "battery_voltage",
            "initial_timestamp",
            "final_timestamp",
            "server_time_offset"
    );

    private static final String AGGREGATE_BY_TAG_AND_BEACON =
            "SELECT object_mac_address, lbeacon_uuid, "
                    + "AVG(rssi) AS average_rssi, "
                    + "MIN(battery_voltage) AS min_battery_voltage, "
                    + "MIN(initial_timestamp) AS earliest_initial, "
                    + "MAX(final_timestamp) AS latest_final "
                    + "FROM tracking_table "
                    + "WHERE final_timestamp >= ? "
                    + "AND final_timestamp >= ? - make_interval(secs => server_time_offset) "
                    + "GROUP BY object_mac_address, lbeacon_uuid";

    private static final String FIND_RSSI_READINGS =
            "SELECT final_timestamp, rssi FROM tracking_table "
                    + "WHERE object_mac_address = ? AND lbeacon_uuid = ? AND final_timestamp > ? "
                    + "ORDER BY final_timestamp ASC";

    private static final String DELETE_OLDER_THAN =
            "DELETE FROM tracking_table WHERE final_timestamp < ?";

    @Override
    public long bulkLoad(DataStoreSession session, Reader records) {
        return session.bulkLoad("tracking_table", STAGING_COLUMNS, records);
    }

    @Override
    public List<BeaconAggregate> aggregateByTagAndBeacon(DataStoreSession session, Instant windowStart, Instant skewCutoff) {
        return session.query(AGGREGATE_BY_TAG_AND_BEACON, this::toAggregate, windowStart, skewCutoff);
    }

    @Override
    public List<RssiReading> findRssiReadings(DataStoreSession session, String mac, String uuid, Instant since) {
        return session.query(FIND_RSSI_READINGS,
                (row, rowNum) -> new RssiReading(ResultSetValues.instant(row, "final_timestamp"), row.getInt("rssi")),
                mac, uuid, since);
    }

    @Override
    public int deleteOlderThan(DataStoreSession session, Instant cutoff) {
        return session.execute(DELETE_OLDER_THAN, cutoff);
    }

    private BeaconAggregate toAggregate(ResultSet row, int rowNum) throws SQLException {
        return new BeaconAggregate(
                row.getString("object_mac_address"),
                row.getString("lbeacon_uuid"),
                row.getDouble("average_rssi"),
                row.getBigDecimal("min_battery_voltage"),
                ResultSetValues.instant(row, "earliest_initial"),
                ResultSetValues.instant(row, "latest_final")
        );
    }
}
