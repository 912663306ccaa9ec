package com.koni.tracking.infrastructure.persistence.repository;

import com.koni.tracking.domain.model.MonitorPolicy;
import com.koni.tracking.domain.model.PolicyTable;
import com.koni.tracking.domain.repository.MonitorPolicyRepository;
import com.koni.tracking.domain.store.DataStoreSession;
import com.koni.tracking.infrastructure.persistence.jdbc.ResultSetValues;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalTime;
import java.util.List;

/**
 * JDBC adapter for {@link MonitorPolicyRepository}.
 * The table name comes from {@link PolicyTable}, never from input.
 */
@Component
public class JdbcMonitorPolicyRepositoryAdapter implements MonitorPolicyRepository {

    @Override
    public List<MonitorPolicy> findAll(DataStoreSession session, PolicyTable table) {
        String sql = "SELECT id, area_id, enable, start_time, end_time, is_active FROM "
                + table.getTableName() + " ORDER BY id ASC";
        return session.query(sql, this::toDomain);
    }

    @Override
    public void updateActive(DataStoreSession session, PolicyTable table, long policyId, boolean active) {
        String sql = "UPDATE " + table.getTableName() + " SET is_active = ? WHERE id = ?";
        session.execute(sql, ResultSetValues.flag(active), policyId);
    }

    private MonitorPolicy toDomain(ResultSet row, int rowNum) throws SQLException {
        return new MonitorPolicy(
                row.getLong("id"),
                row.getInt("area_id"),
                ResultSetValues.flag(row, "enable"),
                row.getObject("start_time", LocalTime.class),
                row.getObject("end_time", LocalTime.class),
                ResultSetValues.flag(row, "is_active")
        );
    }
}
