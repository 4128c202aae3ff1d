package com.companya.sensorhub.repository;

import com.companya.sensorhub.config.SensorHubProperties;
import com.companya.sensorhub.exception.PrimaryStoreException;
import com.companya.sensorhub.model.Reading;
import com.companya.sensorhub.model.ReadingFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.function.Supplier;

/**
 * Adapter over the relational store that holds every ingested reading.
 *
 * <p>Connections are handed out to callers and never shared. {@link #connect()}
 * blocks until the store answers, retrying on a fixed interval forever: the
 * ingest path has no fallback if the store is unavailable.</p>
 */
@Slf4j
@Repository
public class ReadingStore {

    private static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]{0,62}";

    private static final RowMapper<Reading> READING_ROW_MAPPER = (rs, rowNum) -> new Reading(
            rs.getString("id"),
            rs.getObject("timestamp", OffsetDateTime.class).toInstant(),
            rs.getDouble("temperature"));

    private final DataSource dataSource;
    private final String table;
    private final RetryTemplate connectRetry;

    @Autowired
    public ReadingStore(DataSource dataSource, SensorHubProperties properties) {
        this(dataSource,
                properties.getPrimaryStore().getTable(),
                properties.getPrimaryStore().getReconnectInterval());
    }

    public ReadingStore(DataSource dataSource, String table, Duration reconnectInterval) {
        if (!table.matches(IDENTIFIER)) {
            throw new IllegalArgumentException("Not a plain SQL identifier: " + table);
        }
        this.dataSource = dataSource;
        this.table = table;
        this.connectRetry = RetryTemplate.builder()
                .infiniteRetry()
                .fixedBackoff(reconnectInterval.toMillis())
                .retryOn(PrimaryStoreException.class)
                .withListener(new RetryListener() {
                    @Override
                    public <T, E extends Throwable> void onError(RetryContext context,
                                                                 RetryCallback<T, E> callback,
                                                                 Throwable throwable) {
                        log.warn("Primary store connection failed (attempt {}): {}. Retrying in {} ms...",
                                context.getRetryCount(), throwable.getMessage(), reconnectInterval.toMillis());
                    }
                })
                .build();
    }

    /**
     * Opens a connection and makes sure the readings table exists.
     * Does not return until both succeed.
     */
    public StoreConnection connect() {
        return connectRetry.execute(context -> {
            StoreConnection connection = open();
            log.info("Connected to primary store, table '{}' ready", table);
            return connection;
        });
    }

    /**
     * Releases {@code stale} (if any) and returns a fresh connection, blocking like {@link #connect()}.
     */
    public StoreConnection reconnect(StoreConnection stale) {
        if (stale != null) {
            stale.close();
        }
        log.info("Reconnecting to primary store...");
        return connect();
    }

    /**
     * Creates the readings table if it is missing. Idempotent.
     */
    public void ensureSchema(StoreConnection connection) {
        run(connection, "create table " + table, () -> connection.jdbc().execute(
                "CREATE TABLE IF NOT EXISTS " + table + " ("
                        + "\"id\" VARCHAR(50) NOT NULL, "
                        + "\"timestamp\" TIMESTAMP WITH TIME ZONE NOT NULL, "
                        + "\"temperature\" REAL NOT NULL)"));
    }

    public void insert(StoreConnection connection, Reading reading) {
        run(connection, "insert reading for " + reading.sensorId(), () -> connection.jdbc().update(
                "INSERT INTO " + table + " (\"id\", \"timestamp\", \"temperature\") VALUES (?, ?, ?)",
                reading.sensorId(),
                toOffset(reading.timestamp()),
                (float) reading.temperature()));
    }

    /**
     * Returns the rows selected by {@code filter}, oldest first.
     */
    public List<Reading> query(StoreConnection connection, ReadingFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT \"id\", \"timestamp\", \"temperature\" FROM ").append(table);
        List<Object> args = new ArrayList<>();

        if (!filter.isUnrestricted()) {
            StringJoiner where = new StringJoiner(" OR ", " WHERE ", "");
            for (Map.Entry<String, Instant> bound : filter.newerThan().entrySet()) {
                where.add("(\"id\" = ? AND \"timestamp\" > ?)");
                args.add(bound.getKey());
                args.add(toOffset(bound.getValue()));
            }
            // sensors first seen after the last pass have no bound yet
            where.add("\"id\" NOT IN ("
                    + String.join(", ", Collections.nCopies(filter.newerThan().size(), "?")) + ")");
            args.addAll(filter.newerThan().keySet());
            sql.append(where);
        }
        sql.append(" ORDER BY \"timestamp\" ASC, \"id\" ASC");

        return call(connection, "query readings",
                () -> connection.jdbc().query(sql.toString(), READING_ROW_MAPPER, args.toArray()));
    }

    private StoreConnection open() {
        Connection raw;
        try {
            raw = dataSource.getConnection();
        } catch (SQLException ex) {
            throw new PrimaryStoreException("Could not open primary store connection", ex);
        }
        StoreConnection connection = new StoreConnection(raw);
        try {
            raw.setAutoCommit(true);
            ensureSchema(connection);
            return connection;
        } catch (SQLException ex) {
            connection.close();
            throw new PrimaryStoreException("Could not prepare primary store connection", ex);
        } catch (PrimaryStoreException ex) {
            connection.close();
            throw ex;
        }
    }

    private void run(StoreConnection connection, String operation, Runnable statement) {
        call(connection, operation, () -> {
            statement.run();
            return null;
        });
    }

    private <T> T call(StoreConnection connection, String operation, Supplier<T> statement) {
        if (!connection.isOpen()) {
            throw new PrimaryStoreException("Cannot " + operation + ": connection is closed", null);
        }
        try {
            return statement.get();
        } catch (DataAccessException ex) {
            throw new PrimaryStoreException("Failed to " + operation + ": " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    static OffsetDateTime toOffset(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }
}
