package com.vivek.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * JDBC {@link CheckpointStore} keeping one JSON row per run.
 * <p>
 * The upsert is an UPDATE followed by an INSERT when no row matched, which works the same on
 * H2 and PostgreSQL. The table is created by {@link #createTables()}.
 */
public class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    private static final Pattern TABLE_NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                run_id     VARCHAR(64)  NOT NULL PRIMARY KEY,
                status     VARCHAR(32)  NOT NULL,
                request    TEXT,
                state      TEXT         NOT NULL,
                created_at TIMESTAMP    NOT NULL,
                updated_at TIMESTAMP    NOT NULL
            )
            """;

    private static final String UPDATE_SQL = """
            UPDATE %s SET status = ?, request = ?, state = ?, updated_at = ?
            WHERE run_id = ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO %s (run_id, status, request, state, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_BY_ID_SQL = """
            SELECT state FROM %s WHERE run_id = ?
            """;

    private static final String SELECT_RECENT_SQL = """
            SELECT state FROM %s ORDER BY updated_at DESC, run_id DESC
            """;

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE run_id = ?
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final String tableName;

    public JdbcCheckpointStore(DataSource dataSource, String tableName) {
        this(dataSource, tableName, defaultObjectMapper());
    }

    public JdbcCheckpointStore(DataSource dataSource, String tableName, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        if (tableName == null || !TABLE_NAME_PATTERN.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid checkpoint table name: " + tableName);
        }
        this.tableName = tableName;
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Creates the checkpoint table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL.formatted(tableName))) {
            stmt.execute();
            log.info("Checkpoint table '{}' ensured", tableName);
        }
    }

    @Override
    public void save(RunCheckpoint checkpoint) {
        String json = serialize(checkpoint);
        Instant updatedAt = checkpoint.updatedAt() != null ? checkpoint.updatedAt() : Instant.now();
        Instant createdAt = checkpoint.createdAt() != null ? checkpoint.createdAt() : updatedAt;
        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL.formatted(tableName))) {
                stmt.setString(1, checkpoint.status().name());
                stmt.setString(2, checkpoint.request());
                stmt.setString(3, json);
                stmt.setTimestamp(4, Timestamp.from(updatedAt));
                stmt.setString(5, checkpoint.runId());
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL.formatted(tableName))) {
                    stmt.setString(1, checkpoint.runId());
                    stmt.setString(2, checkpoint.status().name());
                    stmt.setString(3, checkpoint.request());
                    stmt.setString(4, json);
                    stmt.setTimestamp(5, Timestamp.from(createdAt));
                    stmt.setTimestamp(6, Timestamp.from(updatedAt));
                    stmt.executeUpdate();
                }
            }
            log.debug("Saved checkpoint for run '{}' ({})", checkpoint.runId(), checkpoint.status());
        } catch (SQLException e) {
            throw new CheckpointException("Failed to save checkpoint for run " + checkpoint.runId(), e);
        }
    }

    @Override
    public Optional<RunCheckpoint> load(String runId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL.formatted(tableName))) {
            stmt.setString(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(deserialize(rs.getString("state")));
                }
            }
        } catch (SQLException e) {
            throw new CheckpointException("Failed to load checkpoint for run " + runId, e);
        }
        return Optional.empty();
    }

    @Override
    public List<RunCheckpoint> listRecent(int limit) {
        var runs = new ArrayList<RunCheckpoint>();
        if (limit <= 0) {
            return runs;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT_SQL.formatted(tableName))) {
            stmt.setMaxRows(limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    runs.add(deserialize(rs.getString("state")));
                }
            }
        } catch (SQLException e) {
            throw new CheckpointException("Failed to list checkpoints", e);
        }
        return runs;
    }

    @Override
    public boolean delete(String runId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL.formatted(tableName))) {
            stmt.setString(1, runId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new CheckpointException("Failed to delete checkpoint for run " + runId, e);
        }
    }

    private String serialize(RunCheckpoint checkpoint) {
        try {
            return objectMapper.writeValueAsString(checkpoint);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to serialize checkpoint for run " + checkpoint.runId(), e);
        }
    }

    private RunCheckpoint deserialize(String json) {
        try {
            return objectMapper.readValue(json, RunCheckpoint.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to deserialize checkpoint", e);
        }
    }
}
