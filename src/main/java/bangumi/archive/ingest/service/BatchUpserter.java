package bangumi.archive.ingest.service;

import bangumi.archive.ingest.exception.BatchCommitException;
import bangumi.archive.ingest.model.ProcessingStats;
import bangumi.archive.ingest.model.RecordType;
import bangumi.archive.ingest.model.StatsRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buffers normalized rows for one destination table and commits them as upsert batches.
 *
 * Each batch is a single multi-row INSERT ... ON CONFLICT (id, data_date) DO UPDATE
 * statement committed in its own transaction. A failing batch is rolled back and its
 * rows are counted as failed; later batches are still attempted. PostgreSQL reports per
 * row whether the insert or the update branch fired (xmax = 0 only for fresh tuples),
 * which feeds the inserted / updated counters.
 *
 * Not thread-safe. One instance per processor run.
 */
public class BatchUpserter {

    private static final Logger logger = LoggerFactory.getLogger(BatchUpserter.class);

    /** Upper bound on bind parameters in one statement for the PostgreSQL wire protocol */
    public static final int MAX_BIND_PARAMETERS = 32767;

    private final Connection connection;
    private final RecordType recordType;
    private final int batchSize;
    private final ProcessingStats stats;

    // Keyed on (id, data_date) so a later duplicate replaces the earlier row in place
    private final Map<List<Object>, StatsRow> buffer = new LinkedHashMap<>();

    private int batchNumber;

    public BatchUpserter(Connection connection, RecordType recordType, int batchSize, ProcessingStats stats) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1, got " + batchSize);
        }
        this.connection = connection;
        this.recordType = recordType;
        this.stats = stats;

        int maxRows = maxRowsPerStatement(recordType);
        if (batchSize > maxRows) {
            logger.warn("Batch size {} exceeds {} rows per statement for {}, using {}",
                    batchSize, maxRows, recordType.getTableName(), maxRows);
            this.batchSize = maxRows;
        } else {
            this.batchSize = batchSize;
        }
    }

    /**
     * Largest row count whose upsert stays within {@link #MAX_BIND_PARAMETERS}.
     */
    public static int maxRowsPerStatement(RecordType recordType) {
        return MAX_BIND_PARAMETERS / recordType.getColumns().size();
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Queue a row, committing the buffer once it reaches the batch size.
     */
    public void add(StatsRow row) {
        List<Object> key = List.of(row.getId(), row.getDataDate());
        if (buffer.put(key, row) != null) {
            stats.addSkipped(1);
            logger.debug("Duplicate {} id {} in batch, keeping the later record", recordType, row.getId());
        }
        if (buffer.size() >= batchSize) {
            flush();
        }
    }

    /**
     * Commit whatever is buffered. Safe to call with an empty buffer.
     */
    public void flush() {
        if (buffer.isEmpty()) {
            return;
        }

        List<StatsRow> rows = new ArrayList<>(buffer.values());
        buffer.clear();
        batchNumber++;

        try {
            commitBatch(rows, batchNumber);
            stats.recordBatch(true);
        } catch (BatchCommitException e) {
            logger.error("Upsert into {} failed: {}", recordType.getTableName(), e.getMessage(), e.getCause());
            stats.addFailed(e.getRowCount());
            stats.recordBatch(false);
        }
    }

    public int getPendingCount() {
        return buffer.size();
    }

    private void commitBatch(List<StatsRow> rows, int number) throws BatchCommitException {
        String sql = buildUpsertSql(recordType, rows.size());
        long inserted = 0;
        long updated = 0;

        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            bindRows(statement, rows);

            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    if (resultSet.getBoolean(1)) {
                        inserted++;
                    } else {
                        updated++;
                    }
                }
            }

            connection.commit();

        } catch (SQLException e) {
            rollback(number);
            throw new BatchCommitException(number, rows.size(), e);
        }

        stats.addInserted(inserted);
        stats.addUpdated(updated);
        logger.debug("Batch {} committed to {}: {} inserted, {} updated",
                number, recordType.getTableName(), inserted, updated);
    }

    private void bindRows(PreparedStatement statement, List<StatsRow> rows) throws SQLException {
        int columnCount = recordType.getColumns().size();
        int parameterIndex = 1;

        for (StatsRow row : rows) {
            List<Object> values = row.getValues();
            for (int column = 0; column < columnCount; column++) {
                Object value = values.get(column);
                if (value == null) {
                    statement.setNull(parameterIndex, recordType.getSqlType(column));
                } else {
                    statement.setObject(parameterIndex, value);
                }
                parameterIndex++;
            }
        }
    }

    private void rollback(int number) {
        try {
            connection.rollback();
        } catch (SQLException rollbackEx) {
            // Connection is likely gone; the next batch will report its own failure
            logger.warn("Rollback of batch {} on {} failed: {}",
                    number, recordType.getTableName(), rollbackEx.getMessage());
        }
    }

    /**
     * Build the multi-row upsert for a batch.
     *
     * Example for person_stats with two rows:
     * INSERT INTO person_stats (id, comments, collects, data_date) VALUES (?, ?, ?, ?), (?, ?, ?, ?)
     * ON CONFLICT (id, data_date) DO UPDATE SET comments = EXCLUDED.comments, collects = EXCLUDED.collects
     * RETURNING (xmax = 0) AS inserted
     *
     * @param recordType Destination record type
     * @param rowCount   Number of VALUES tuples
     * @return SQL with rowCount * columns parameters
     */
    public static String buildUpsertSql(RecordType recordType, int rowCount) {
        String tuple = "(" + String.join(", ", recordType.getPlaceholders()) + ")";

        StringBuilder sql = new StringBuilder();
        sql.append("INSERT INTO ").append(recordType.getTableName());
        sql.append(" (").append(String.join(", ", recordType.getColumns())).append(")");
        sql.append(" VALUES ");

        for (int i = 0; i < rowCount; i++) {
            if (i > 0) sql.append(", ");
            sql.append(tuple);
        }

        sql.append(" ON CONFLICT (").append(String.join(", ", RecordType.KEY_COLUMNS)).append(")");
        sql.append(" DO UPDATE SET ");

        List<String> updateColumns = recordType.getUpdateColumns();
        for (int i = 0; i < updateColumns.size(); i++) {
            if (i > 0) sql.append(", ");
            String column = updateColumns.get(i);
            sql.append(column).append(" = EXCLUDED.").append(column);
        }

        sql.append(" RETURNING (xmax = 0) AS inserted");
        return sql.toString();
    }
}
