package bangumi.archive.ingest.service;

import bangumi.archive.ingest.config.IngestProperties;
import bangumi.archive.ingest.exception.DatabaseConnectionException;
import bangumi.archive.ingest.exception.RecordValidationException;
import bangumi.archive.ingest.exception.SchemaInitializationException;
import bangumi.archive.ingest.model.ProcessingStats;
import bangumi.archive.ingest.model.RecordType;
import bangumi.archive.ingest.model.StatsRow;
import bangumi.archive.ingest.stream.JsonLine;
import bangumi.archive.ingest.stream.JsonLinesReader;
import bangumi.archive.ingest.transformer.RecordTransformer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Loads one record type's JSON lines file into its statistics table.
 *
 * Lifecycle: {@link #connect()} -> {@link #ensureSchema()} -> {@link #processFile}
 * (any number of times) -> {@link #close()}. The processor holds a single connection
 * for its whole lifetime and commits per batch through {@link BatchUpserter}.
 *
 * Record-level and batch-level problems are tallied in {@link ProcessingStats} and never
 * escape {@link #processFile}. Connection and DDL failures do.
 */
public class StatsFileProcessor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StatsFileProcessor.class);

    private final RecordType recordType;
    private final DataSource dataSource;
    private final IngestProperties properties;
    private final ObjectMapper objectMapper;

    private Connection connection;

    public StatsFileProcessor(RecordType recordType,
                              DataSource dataSource,
                              IngestProperties properties,
                              ObjectMapper objectMapper) {
        this.recordType = recordType;
        this.dataSource = dataSource;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public RecordType getRecordType() {
        return recordType;
    }

    public boolean isConnected() {
        return connection != null;
    }

    /**
     * Borrow the processor's connection. Calling it again while connected is a no-op.
     *
     * @throws DatabaseConnectionException if the database cannot be reached
     */
    public void connect() {
        if (connection != null) {
            return;
        }
        try {
            Connection opened = dataSource.getConnection();
            opened.setAutoCommit(false);
            connection = opened;
            logger.info("Database connection opened for {}", recordType);
        } catch (SQLException e) {
            throw new DatabaseConnectionException("Cannot connect to database for " + recordType + ": "
                    + e.getMessage(), e);
        }
    }

    /**
     * Create the destination table and its indexes if missing. Idempotent.
     *
     * @throws SchemaInitializationException if the DDL fails
     */
    public void ensureSchema() {
        requireConnection();

        try (Statement statement = connection.createStatement()) {
            for (String ddl : recordType.getSchemaStatements()) {
                statement.execute(ddl);
            }
            connection.commit();
            logger.info("Table {} is ready", recordType.getTableName());
        } catch (SQLException e) {
            rollbackQuietly();
            throw new SchemaInitializationException("Failed to create table " + recordType.getTableName()
                    + ": " + e.getMessage(), e);
        }
    }

    /**
     * Stream a source file through the transformer and upserter.
     *
     * @param sourceFile JSON lines file for this processor's record type
     * @param dataDate   Snapshot date stamped on every row
     * @param limit      Maximum number of non-blank lines to read; null or &lt;= 0 reads all
     * @return counters for this file
     * @throws NoSuchFileException if the source file is missing
     * @throws IOException         if the file cannot be read
     */
    public ProcessingStats processFile(Path sourceFile, LocalDate dataDate, Integer limit) throws IOException {
        requireConnection();
        Objects.requireNonNull(dataDate, "dataDate");

        if (!Files.isRegularFile(sourceFile)) {
            throw new NoSuchFileException(sourceFile.toString(), null, recordType + " source file not found");
        }

        long startTime = System.currentTimeMillis();
        boolean limited = limit != null && limit > 0;
        ProcessingStats stats = new ProcessingStats(recordType, sourceFile.getFileName().toString(), dataDate);
        BatchUpserter upserter = new BatchUpserter(connection, recordType, properties.getEffectiveBatchSize(), stats);
        RecordTransformer transformer = recordType.getTransformer();

        logger.info("Processing {} into {} for {}{}", sourceFile, recordType.getTableName(), dataDate,
                limited ? " (limit " + limit + ")" : "");

        try (JsonLinesReader reader = JsonLinesReader.open(sourceFile, objectMapper)) {
            while ((!limited || stats.getTotalRead() < limit) && reader.hasNext()) {
                JsonLine line = reader.next();
                stats.incrementTotalRead();

                if (line.isMalformed()) {
                    stats.incrementFailed();
                    logger.debug("{} line {}: invalid JSON ({})", recordType, line.getLineNumber(), line.getError());
                    continue;
                }

                try {
                    StatsRow row = transformer.transform(line.getNode(), dataDate);
                    upserter.add(row);
                } catch (RecordValidationException e) {
                    stats.incrementFailed();
                    logger.debug("{} line {}: rejected on field '{}': {}",
                            recordType, line.getLineNumber(), e.getField(), e.getMessage());
                }
            }

            upserter.flush();

        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        stats.setDurationMs(System.currentTimeMillis() - startTime);
        logger.info("Finished {}", stats.toSummary());
        if (stats.getFailedBatches() > 0) {
            logger.warn("{} of {} batches for {} were rolled back",
                    stats.getFailedBatches(), stats.getBatches(), recordType.getTableName());
        }

        return stats;
    }

    /**
     * Release the connection. No-op when never connected; safe to call twice.
     */
    @Override
    public void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
            logger.info("Database connection closed for {}", recordType);
        } catch (SQLException e) {
            logger.warn("Error closing database connection for {}: {}", recordType, e.getMessage());
        } finally {
            connection = null;
        }
    }

    private void requireConnection() {
        if (connection == null) {
            throw new IllegalStateException("Processor for " + recordType + " is not connected");
        }
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            logger.warn("Rollback failed for {}: {}", recordType, e.getMessage());
        }
    }
}
