package com.koni.tracking.infrastructure.persistence.jdbc;

import com.koni.tracking.domain.exception.SessionOpenException;
import com.koni.tracking.domain.store.DataStoreSession;
import com.koni.tracking.domain.store.DataStoreSessionFactory;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens PostgreSQL sessions through {@link DriverManager}.
 * Every session runs in UTC and is tagged with an application name carrying its serial id.
 */
@Slf4j
public class JdbcDataStoreSessionFactory implements DataStoreSessionFactory {

    private final String url;
    private final Properties connectionProperties;
    private final String applicationName;

    public JdbcDataStoreSessionFactory(String url, String username, String password, String applicationName) {
        this.url = url;
        this.applicationName = applicationName;
        this.connectionProperties = new Properties();
        connectionProperties.setProperty("user", username);
        connectionProperties.setProperty("password", password);
    }

    @Override
    public DataStoreSession open(int serialId) {
        Connection connection;
        try {
            connection = DriverManager.getConnection(url, connectionProperties);
        } catch (SQLException e) {
            throw new SessionOpenException("Cannot connect session " + serialId + " to " + url, e);
        }

        JdbcDataStoreSession session = new JdbcDataStoreSession(serialId, connection);
        try {
            session.execute("SET TIME ZONE 'UTC'");
            session.execute("SET application_name TO " + session.escapeLiteral(applicationName + "-" + serialId));
        } catch (RuntimeException e) {
            session.close();
            throw new SessionOpenException("Cannot initialize session " + serialId, e);
        }

        log.debug("Opened session {} to {}", serialId, url);
        return session;
    }
}
