package com.koni.tracking.infrastructure.persistence.repository;

import com.koni.tracking.domain.model.AnchorUpdate;
import com.koni.tracking.domain.model.MonitorType;
import com.koni.tracking.domain.model.MonitoredTag;
import com.koni.tracking.domain.model.MovingTagUpdate;
import com.koni.tracking.domain.model.StableTagUpdate;
import com.koni.tracking.domain.model.TagPlacement;
import com.koni.tracking.domain.model.TagSummary;
import com.koni.tracking.domain.model.ViolationCandidate;
import com.koni.tracking.domain.repository.TagSummaryRepository;
import com.koni.tracking.domain.store.DataStoreSession;
import com.koni.tracking.infrastructure.persistence.jdbc.ResultSetValues;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC adapter for {@link TagSummaryRepository} over {@code object_summary_table}.
 */
@Component
public class JdbcTagSummaryRepositoryAdapter implements TagSummaryRepository {

    private static final Map<MonitorType, String> VIOLATION_COLUMNS = new EnumMap<>(Map.of(
            MonitorType.GEO_FENCE, "geofence_violation_timestamp",
            MonitorType.PANIC, "panic_violation_timestamp",
            MonitorType.MOVEMENT, "movement_violation_timestamp",
            MonitorType.LOCATION, "location_violation_timestamp"
    ));

    private static final String FIND_ALL =
            "SELECT mac_address, uuid, rssi, first_seen_timestamp, last_seen_timestamp, battery_voltage, "
                    + "base_x, base_y, is_location_updated, geofence_violation_timestamp, "
                    + "panic_violation_timestamp, movement_violation_timestamp, location_violation_timestamp "
                    + "FROM object_summary_table ORDER BY mac_address ASC";

    private static final String RESET_LOCATION_UPDATED =
            "UPDATE object_summary_table SET is_location_updated = 0";

    private static final String APPLY_STABLE =
            "UPDATE object_summary_table "
                    + "SET rssi = ?, last_seen_timestamp = ?, battery_voltage = ?, is_location_updated = 1 "
                    + "WHERE mac_address = ?";

    private static final String APPLY_MOVING =
            "UPDATE object_summary_table "
                    + "SET uuid = ?, rssi = ?, battery_voltage = ?, first_seen_timestamp = ?, "
                    + "last_seen_timestamp = ?, is_location_updated = 1 "
                    + "WHERE mac_address = ?";

    private static final String APPLY_ANCHOR =
            "UPDATE object_summary_table SET base_x = ?, base_y = ? WHERE mac_address = ?";

    private static final String STAMP_PANIC_IF_MONITORED =
            "UPDATE object_summary_table SET panic_violation_timestamp = ? "
                    + "FROM object_table "
                    + "WHERE object_summary_table.mac_address = object_table.mac_address "
                    + "AND object_summary_table.mac_address = ? "
                    + "AND object_table.monitor_type & ? = ?";

    private static final String FIND_UNDER_ACTIVE_ROOM_POLICY =
            "SELECT DISTINCT s.mac_address, s.uuid, o.room AS assigned_room, b.room AS current_room, "
                    + "b.danger_area, s.first_seen_timestamp, s.last_seen_timestamp, 0 AS stay_duration "
                    + "FROM object_summary_table s "
                    + "INNER JOIN object_table o ON s.mac_address = o.mac_address "
                    + "INNER JOIN lbeacon_table b ON s.uuid = b.uuid "
                    + "INNER JOIN location_not_stay_room_config c ON o.area_id = c.area_id "
                    + "WHERE c.is_active = 1 AND o.monitor_type & ? = ?";

    private static final String FIND_UNDER_ACTIVE_DANGER_POLICY =
            "SELECT s.mac_address, s.uuid, o.room AS assigned_room, b.room AS current_room, "
                    + "b.danger_area, s.first_seen_timestamp, s.last_seen_timestamp, c.stay_duration "
                    + "FROM object_summary_table s "
                    + "INNER JOIN object_table o ON s.mac_address = o.mac_address "
                    + "INNER JOIN lbeacon_table b ON s.uuid = b.uuid "
                    + "INNER JOIN location_long_stay_in_danger_config c ON o.area_id = c.area_id "
                    + "WHERE c.is_active = 1 AND o.monitor_type & ? = ?";

    private static final String FIND_UNDER_ACTIVE_MOVEMENT_POLICY =
            "SELECT DISTINCT s.mac_address, s.uuid "
                    + "FROM object_summary_table s "
                    + "INNER JOIN object_table o ON s.mac_address = o.mac_address "
                    + "INNER JOIN movement_config c ON o.area_id = c.area_id "
                    + "WHERE c.is_active = 1 AND o.monitor_type & ? = ? "
                    + "ORDER BY s.mac_address ASC";

    @Override
    public List<TagSummary> findAll(DataStoreSession session) {
        return session.query(FIND_ALL, this::toDomain);
    }

    @Override
    public int resetLocationUpdated(DataStoreSession session) {
        return session.execute(RESET_LOCATION_UPDATED);
    }

    @Override
    public void applyStable(DataStoreSession session, StableTagUpdate update) {
        session.execute(APPLY_STABLE,
                update.getRssi(), update.getLastSeen(), update.getBatteryVoltage(), update.getMac());
    }

    @Override
    public void applyMoving(DataStoreSession session, MovingTagUpdate update) {
        session.execute(APPLY_MOVING,
                update.getUuid(), update.getRssi(), update.getBatteryVoltage(),
                update.getFirstSeen(), update.getLastSeen(), update.getMac());
    }

    @Override
    public void applyAnchor(DataStoreSession session, AnchorUpdate update) {
        session.execute(APPLY_ANCHOR, update.getX(), update.getY(), update.getMac());
    }

    @Override
    public boolean stampPanicIfMonitored(DataStoreSession session, String mac, Instant at) {
        int panic = MonitorType.PANIC.getCode();
        return session.execute(STAMP_PANIC_IF_MONITORED, at, mac, panic, panic) > 0;
    }

    @Override
    public int stampViolation(DataStoreSession session, MonitorType monitorType, String mac, Instant at) {
        String sql = "UPDATE object_summary_table SET " + violationColumn(monitorType) + " = ? WHERE mac_address = ?";
        return session.execute(sql, at, mac);
    }

    @Override
    public List<ViolationCandidate> findViolationsSince(DataStoreSession session, MonitorType monitorType, Instant since) {
        String column = violationColumn(monitorType);
        String sql = "SELECT mac_address, uuid, " + column + " FROM object_summary_table WHERE " + column + " >= ?";
        return session.query(sql,
                (row, rowNum) -> new ViolationCandidate(
                        row.getString("mac_address"),
                        row.getString("uuid"),
                        ResultSetValues.instant(row, column)),
                since);
    }

    @Override
    public List<TagPlacement> findUnderActiveRoomPolicy(DataStoreSession session) {
        int location = MonitorType.LOCATION.getCode();
        return session.query(FIND_UNDER_ACTIVE_ROOM_POLICY, this::toPlacement, location, location);
    }

    @Override
    public List<TagPlacement> findUnderActiveDangerPolicy(DataStoreSession session) {
        int location = MonitorType.LOCATION.getCode();
        return session.query(FIND_UNDER_ACTIVE_DANGER_POLICY, this::toPlacement, location, location);
    }

    @Override
    public List<MonitoredTag> findUnderActiveMovementPolicy(DataStoreSession session) {
        int movement = MonitorType.MOVEMENT.getCode();
        return session.query(FIND_UNDER_ACTIVE_MOVEMENT_POLICY,
                (row, rowNum) -> new MonitoredTag(row.getString("mac_address"), row.getString("uuid")),
                movement, movement);
    }

    private static String violationColumn(MonitorType monitorType) {
        return VIOLATION_COLUMNS.get(monitorType);
    }

    private TagSummary toDomain(ResultSet row, int rowNum) throws SQLException {
        return TagSummary.builder()
                .mac(row.getString("mac_address"))
                .uuid(row.getString("uuid"))
                .rssi(ResultSetValues.nullableInt(row, "rssi"))
                .firstSeen(ResultSetValues.instant(row, "first_seen_timestamp"))
                .lastSeen(ResultSetValues.instant(row, "last_seen_timestamp"))
                .batteryVoltage(row.getBigDecimal("battery_voltage"))
                .anchorX(ResultSetValues.nullableInt(row, "base_x"))
                .anchorY(ResultSetValues.nullableInt(row, "base_y"))
                .locationUpdated(ResultSetValues.flag(row, "is_location_updated"))
                .geofenceViolationTimestamp(ResultSetValues.instant(row, "geofence_violation_timestamp"))
                .panicViolationTimestamp(ResultSetValues.instant(row, "panic_violation_timestamp"))
                .movementViolationTimestamp(ResultSetValues.instant(row, "movement_violation_timestamp"))
                .locationViolationTimestamp(ResultSetValues.instant(row, "location_violation_timestamp"))
                .build();
    }

    private TagPlacement toPlacement(ResultSet row, int rowNum) throws SQLException {
        return TagPlacement.builder()
                .mac(row.getString("mac_address"))
                .uuid(row.getString("uuid"))
                .assignedRoom(row.getString("assigned_room"))
                .currentRoom(row.getString("current_room"))
                .dangerArea(ResultSetValues.flag(row, "danger_area"))
                .firstSeen(ResultSetValues.instant(row, "first_seen_timestamp"))
                .lastSeen(ResultSetValues.instant(row, "last_seen_timestamp"))
                .stayDurationMinutes(row.getInt("stay_duration"))
                .build();
    }
}
