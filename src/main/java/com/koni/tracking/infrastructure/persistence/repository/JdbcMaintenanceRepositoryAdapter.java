package com.koni.tracking.infrastructure.persistence.repository;

import com.koni.tracking.domain.repository.MaintenanceRepository;
import com.koni.tracking.domain.store.DataStoreSession;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class JdbcMaintenanceRepositoryAdapter implements MaintenanceRepository {

    private static final Pattern TABLE_NAME = Pattern.compile("[a-z_][a-z0-9_]*");

    /**
     * Runs {@code VACUUM} on one table. VACUUM cannot run inside a transaction block,
     * so the session must be in auto-commit mode.
     *
     * @throws IllegalArgumentException if the table name is not a plain lower-case identifier
     */
    @Override
    public void vacuum(DataStoreSession session, String table) {
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Not a table name: " + table);
        }
        session.execute("VACUUM " + table);
    }
}
