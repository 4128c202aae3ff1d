package com.companya.sensorhub.repository;

import com.companya.sensorhub.exception.PrimaryStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional persistence for replication high-water marks, kept in the primary store
 * next to the readings so a restarted replicator can resume instead of re-scanning.
 */
@Slf4j
@Repository
public class CheckpointStore {

    static final String TABLE = "replication_checkpoints";

    public void ensureSchema(StoreConnection connection) {
        try {
            connection.jdbc().execute("CREATE TABLE IF NOT EXISTS " + TABLE + " ("
                    + "\"sensor_id\" VARCHAR(50) NOT NULL PRIMARY KEY, "
                    + "\"high_water_mark\" TIMESTAMP WITH TIME ZONE NOT NULL, "
                    + "\"updated_at\" TIMESTAMP WITH TIME ZONE NOT NULL)");
        } catch (DataAccessException ex) {
            throw new PrimaryStoreException("Failed to create table " + TABLE, ex);
        }
    }

    public Map<String, Instant> load(StoreConnection connection) {
        Map<String, Instant> marks = new LinkedHashMap<>();
        try {
            connection.jdbc().query(
                    "SELECT \"sensor_id\", \"high_water_mark\" FROM " + TABLE + " ORDER BY \"sensor_id\"",
                    rs -> {
                        marks.put(rs.getString("sensor_id"),
                                rs.getObject("high_water_mark", OffsetDateTime.class).toInstant());
                    });
        } catch (DataAccessException ex) {
            throw new PrimaryStoreException("Failed to load replication checkpoints", ex);
        }
        log.debug("Loaded {} replication checkpoints", marks.size());
        return marks;
    }

    /**
     * Writes each mark, inserting rows for sensors seen for the first time.
     */
    public void save(StoreConnection connection, Map<String, Instant> marks) {
        JdbcTemplate jdbc = connection.jdbc();
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        try {
            marks.forEach((sensorId, mark) -> {
                OffsetDateTime value = mark.atOffset(ZoneOffset.UTC);
                int updated = jdbc.update(
                        "UPDATE " + TABLE + " SET \"high_water_mark\" = ?, \"updated_at\" = ? WHERE \"sensor_id\" = ?",
                        value, now, sensorId);
                if (updated == 0) {
                    jdbc.update(
                            "INSERT INTO " + TABLE + " (\"sensor_id\", \"high_water_mark\", \"updated_at\") VALUES (?, ?, ?)",
                            sensorId, value, now);
                }
            });
        } catch (DataAccessException ex) {
            throw new PrimaryStoreException("Failed to save replication checkpoints", ex);
        }
    }
}
