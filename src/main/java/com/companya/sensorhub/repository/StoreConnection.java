package com.companya.sensorhub.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A primary store handle owned by exactly one component. Statements run in
 * auto-commit mode through a {@link JdbcTemplate} pinned to this connection.
 */
@Slf4j
public class StoreConnection implements AutoCloseable {

    private final Connection connection;
    private final JdbcTemplate jdbcTemplate;
    private boolean closed;

    StoreConnection(Connection connection) {
        this.connection = connection;
        this.jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    }

    JdbcTemplate jdbc() {
        return jdbcTemplate;
    }

    public boolean isOpen() {
        if (closed) {
            return false;
        }
        try {
            return !connection.isClosed();
        } catch (SQLException ex) {
            return false;
        }
    }

    /**
     * Releases the underlying connection. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
        } catch (SQLException ex) {
            log.debug("Ignoring failure while releasing primary store connection: {}", ex.getMessage());
        }
    }
}
