package com.koni.tracking.infrastructure.persistence.repository;

import com.koni.tracking.domain.model.MonitorType;
import com.koni.tracking.domain.model.ViolationEvent;
import com.koni.tracking.domain.repository.ViolationEventRepository;
import com.koni.tracking.domain.store.DataStoreSession;
import com.koni.tracking.infrastructure.persistence.jdbc.ResultSetValues;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * JDBC adapter for {@link ViolationEventRepository} over {@code notification_table}.
 */
@Component
public class JdbcViolationEventRepositoryAdapter implements ViolationEventRepository {

    private static final String COLUMNS = "id, monitor_type, mac_address, uuid, violation_timestamp, processed";

    private static final String FIND_BY_MONITOR_TYPE_SINCE =
            "SELECT " + COLUMNS + " FROM notification_table WHERE monitor_type = ? AND violation_timestamp > ?";

    private static final String INSERT =
            "INSERT INTO notification_table (monitor_type, mac_address, uuid, violation_timestamp, processed) "
                    + "VALUES (?, ?, ?, ?, 0)";

    private static final String FIND_UNPROCESSED =
            "SELECT " + COLUMNS + " FROM notification_table WHERE processed <> 1 ORDER BY id ASC";

    // Conditional so that concurrent drains cannot both deliver the same event
    private static final String MARK_PROCESSED =
            "UPDATE notification_table SET processed = 1 WHERE id = ? AND processed <> 1";

    private static final String DELETE_OLDER_THAN =
            "DELETE FROM notification_table WHERE violation_timestamp < ?";

    @Override
    public List<ViolationEvent> findByMonitorTypeSince(DataStoreSession session, MonitorType monitorType, Instant since) {
        return session.query(FIND_BY_MONITOR_TYPE_SINCE, this::toDomain, monitorType.getCode(), since);
    }

    @Override
    public void save(DataStoreSession session, ViolationEvent event) {
        if (event.isProcessed()) {
            throw new IllegalArgumentException("New violation events must be unprocessed");
        }
        session.execute(INSERT,
                event.getMonitorType().getCode(), event.getMac(), event.getUuid(), event.getViolationTimestamp());
    }

    @Override
    public List<ViolationEvent> findUnprocessed(DataStoreSession session) {
        return session.query(FIND_UNPROCESSED, this::toDomain);
    }

    @Override
    public boolean markProcessed(DataStoreSession session, long id) {
        return session.execute(MARK_PROCESSED, id) == 1;
    }

    @Override
    public int deleteOlderThan(DataStoreSession session, Instant cutoff) {
        return session.execute(DELETE_OLDER_THAN, cutoff);
    }

    private ViolationEvent toDomain(ResultSet row, int rowNum) throws SQLException {
        return new ViolationEvent(
                row.getLong("id"),
                MonitorType.fromCode(row.getInt("monitor_type")),
                row.getString("mac_address"),
                row.getString("uuid"),
                ResultSetValues.instant(row, "violation_timestamp"),
                ResultSetValues.flag(row, "processed")
        );
    }
}
