package com.scoutintel.transferroom.output;

import com.scoutintel.transferroom.model.SyncRun;
import com.scoutintel.transferroom.model.SyncStatus;
import com.scoutintel.transferroom.model.SyncType;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for the data_sync_runs audit table.
 */
@Component
public class SyncRunStore {

    private static final String SELECT_COLUMNS = """
            SELECT sync_run_id, sync_type, status, records_fetched, records_inserted,
                   records_updated, records_failed, error_message, started_at,
                   completed_at, duration_seconds, metadata
            FROM data_sync_runs
            """;

    private static final RowMapper<SyncRun> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp completedAt = rs.getTimestamp("completed_at");
        long duration = rs.getLong("duration_seconds");
        Long durationSeconds = rs.wasNull() ? null : duration;
        return SyncRun.builder()
                .id(rs.getLong("sync_run_id"))
                .syncType(SyncType.fromValue(rs.getString("sync_type")))
                .status(SyncStatus.fromValue(rs.getString("status")))
                .recordsFetched(rs.getInt("records_fetched"))
                .recordsInserted(rs.getInt("records_inserted"))
                .recordsUpdated(rs.getInt("records_updated"))
                .recordsFailed(rs.getInt("records_failed"))
                .errorMessage(rs.getString("error_message"))
                .startedAt(rs.getTimestamp("started_at").toInstant())
                .completedAt(completedAt == null ? null : completedAt.toInstant())
                .durationSeconds(durationSeconds)
                .metadata(rs.getString("metadata"))
                .build();
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final String metadataPlaceholder;

    public SyncRunStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        DatabaseDialect dialect = DatabaseDialect.detect(jdbc.getJdbcTemplate().getDataSource());
        this.metadataPlaceholder = dialect == DatabaseDialect.POSTGRESQL
                ? "CAST(:metadata AS JSONB)"
                : ":metadata";
    }

    /**
     * Insert a new in_progress row and return its generated id.
     */
    public long insert(SyncType type, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("syncType", type.value())
                .addValue("status", SyncStatus.IN_PROGRESS.value())
                .addValue("startedAt", Timestamp.from(startedAt));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update("""
                INSERT INTO data_sync_runs (sync_type, status, started_at)
                VALUES (:syncType, :status, :startedAt)
                """, params, keyHolder);

        Map<String, Object> keys = keyHolder.getKeys();
        Object id = keys == null ? null : keys.get("sync_run_id");
        if (!(id instanceof Number number)) {
            throw new IllegalStateException("No sync_run_id generated for " + type.value() + " run");
        }
        return number.longValue();
    }

    /**
     * Write the terminal state of a run. Only rows still in_progress are touched.
     *
     * @throws IllegalStateException if the run does not exist or was already closed
     */
    public void close(SyncRun run) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", run.getId())
                .addValue("status", run.getStatus().value())
                .addValue("fetched", run.getRecordsFetched())
                .addValue("inserted", run.getRecordsInserted())
                .addValue("updated", run.getRecordsUpdated())
                .addValue("failed", run.getRecordsFailed())
                .addValue("errorMessage", run.getErrorMessage(), Types.VARCHAR)
                .addValue("completedAt", Timestamp.from(run.getCompletedAt()))
                .addValue("duration", run.getDurationSeconds(), Types.INTEGER)
                .addValue("metadata", run.getMetadata(), Types.VARCHAR)
                .addValue("inProgress", SyncStatus.IN_PROGRESS.value());

        int updated = jdbc.update("""
                UPDATE data_sync_runs
                SET status = :status,
                    records_fetched = :fetched,
                    records_inserted = :inserted,
                    records_updated = :updated,
                    records_failed = :failed,
                    error_message = :errorMessage,
                    completed_at = :completedAt,
                    duration_seconds = :duration,
                    metadata = %s
                WHERE sync_run_id = :id AND status = :inProgress
                """.formatted(metadataPlaceholder), params);

        if (updated == 0) {
            throw new IllegalStateException("Sync run " + run.getId() + " is not in progress");
        }
    }

    public Optional<SyncRun> findById(long id) {
        List<SyncRun> runs = jdbc.query(SELECT_COLUMNS + "WHERE sync_run_id = :id",
                new MapSqlParameterSource("id", id), ROW_MAPPER);
        return runs.stream().findFirst();
    }

    public Optional<SyncRun> findLatest(SyncType type) {
        List<SyncRun> runs = jdbc.query(
                SELECT_COLUMNS + "WHERE sync_type = :syncType ORDER BY started_at DESC, sync_run_id DESC LIMIT 1",
                new MapSqlParameterSource("syncType", type.value()), ROW_MAPPER);
        return runs.stream().findFirst();
    }
}
