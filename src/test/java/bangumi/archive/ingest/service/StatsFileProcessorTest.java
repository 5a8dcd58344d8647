package bangumi.archive.ingest.service;

import bangumi.archive.ingest.config.IngestProperties;
import bangumi.archive.ingest.exception.DatabaseConnectionException;
import bangumi.archive.ingest.exception.SchemaInitializationException;
import bangumi.archive.ingest.model.ProcessingStats;
import bangumi.archive.ingest.model.RecordType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for StatsFileProcessor.
 * The JDBC layer is mocked; every upsert reports each of its rows as freshly inserted.
 */
class StatsFileProcessorTest {

    private static final LocalDate DATA_DATE = LocalDate.of(2025, 9, 2);

    @TempDir
    Path tempDir;

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private PreparedStatement preparedStatement;

    @Mock
    private ResultSet resultSet;

    @Mock
    private Statement ddlStatement;

    private IngestProperties properties;
    private StatsFileProcessor processor;

    // Rows left to report for the current upsert
    private final AtomicInteger pendingRows = new AtomicInteger();

    @BeforeEach
    void setUp() throws SQLException {
        MockitoAnnotations.openMocks(this);

        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(ddlStatement);
        when(connection.prepareStatement(anyString())).thenAnswer(invocation -> {
            String sql = invocation.getArgument(0);
            pendingRows.set(sql.split("\\), \\(").length);
            return preparedStatement;
        });
        when(preparedStatement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenAnswer(invocation -> pendingRows.getAndDecrement() > 0);
        when(resultSet.getBoolean(1)).thenReturn(true);

        properties = new IngestProperties();
        properties.setArchiveDir(tempDir.toString());
        processor = new StatsFileProcessor(RecordType.CHARACTER, dataSource, properties, new ObjectMapper());
    }

    // ===== Lifecycle =====

    @Test
    void testConnect_DisablesAutoCommit() throws SQLException {
        // When
        processor.connect();
        processor.connect();

        // Then
        assertThat(processor.isConnected()).isTrue();
        verify(dataSource, times(1)).getConnection();
        verify(connection).setAutoCommit(false);
    }

    @Test
    void testConnect_FailureRaisesDatabaseConnectionException() throws SQLException {
        // Given
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));

        // When / Then
        assertThatThrownBy(() -> processor.connect())
                .isInstanceOf(DatabaseConnectionException.class)
                .hasMessageContaining("Connection refused");
        assertThat(processor.isConnected()).isFalse();
    }

    @Test
    void testClose_WithoutConnectIsSafe() {
        // When / Then
        processor.close();
        processor.close();
        assertThat(processor.isConnected()).isFalse();
    }

    @Test
    void testClose_ReleasesConnectionOnce() throws SQLException {
        // Given
        processor.connect();

        // When
        processor.close();
        processor.close();

        // Then
        verify(connection, times(1)).close();
        assertThat(processor.isConnected()).isFalse();
    }

    @Test
    void testProcessFile_RequiresConnection() throws IOException {
        // Given
        Path file = writeLines("{\"id\": 1}");

        // When / Then
        assertThatThrownBy(() -> processor.processFile(file, DATA_DATE, null))
                .isInstanceOf(IllegalStateException.class);
    }

    // ===== Schema =====

    @Test
    void testEnsureSchema_ExecutesDdlAndCommits() throws SQLException {
        // Given
        processor.connect();

        // When
        processor.ensureSchema();

        // Then
        verify(ddlStatement, times(RecordType.CHARACTER.getSchemaStatements().size())).execute(anyString());
        verify(connection).commit();
    }

    @Test
    void testEnsureSchema_FailureRollsBack() throws SQLException {
        // Given
        processor.connect();
        when(ddlStatement.execute(anyString())).thenThrow(new SQLException("permission denied"));

        // When / Then
        assertThatThrownBy(() -> processor.ensureSchema())
                .isInstanceOf(SchemaInitializationException.class)
                .hasMessageContaining("character_stats");
        verify(connection).rollback();
        verify(connection, never()).commit();
    }

    // ===== File processing =====

    @Test
    void testProcessFile_MalformedLineAmongHundred() throws IOException {
        // Given
        StringBuilder content = new StringBuilder();
        for (int i = 1; i <= 100; i++) {
            content.append(i == 50 ? "{\"id\": 50, \"comments\":" : "{\"id\": " + i + ", \"comments\": 3}").append('\n');
        }
        Path file = write(content.toString());
        processor.connect();

        // When
        ProcessingStats stats = processor.processFile(file, DATA_DATE, null);

        // Then
        assertThat(stats.getTotalRead()).isEqualTo(100);
        assertThat(stats.getUpserted()).isEqualTo(99);
        assertThat(stats.getFailed()).isEqualTo(1);
        assertThat(stats.getTableName()).isEqualTo("character_stats");
        assertThat(stats.getDataDate()).isEqualTo(DATA_DATE);
    }

    @Test
    void testProcessFile_LimitStopsReading() throws IOException {
        // Given
        StringBuilder content = new StringBuilder();
        for (int i = 1; i <= 5000; i++) {
            content.append("{\"id\": ").append(i).append("}\n");
        }
        Path file = write(content.toString());
        properties.setBatchSize(500);
        processor.connect();

        // When
        ProcessingStats stats = processor.processFile(file, DATA_DATE, 1000);

        // Then
        assertThat(stats.getTotalRead()).isEqualTo(1000);
        assertThat(stats.getInserted()).isEqualTo(1000);
        assertThat(stats.getBatches()).isEqualTo(2);
    }

    @Test
    void testProcessFile_NonPositiveLimitReadsEverything() throws IOException {
        // Given
        Path file = writeLines("{\"id\": 1}", "{\"id\": 2}", "{\"id\": 3}");
        processor.connect();

        // When
        ProcessingStats stats = processor.processFile(file, DATA_DATE, 0);

        // Then
        assertThat(stats.getTotalRead()).isEqualTo(3);
    }

    @Test
    void testProcessFile_InvalidIdsAreCountedAsFailed() throws IOException {
        // Given
        Path file = writeLines("{\"id\": 1}", "{\"comments\": 4}", "{\"id\": -2}", "[]", "{\"id\": 5}");
        processor.connect();

        // When
        ProcessingStats stats = processor.processFile(file, DATA_DATE, null);

        // Then
        assertThat(stats.getTotalRead()).isEqualTo(5);
        assertThat(stats.getFailed()).isEqualTo(3);
        assertThat(stats.getInserted()).isEqualTo(2);
    }

    @Test
    void testProcessFile_BlankLinesAreNotCounted() throws IOException {
        // Given
        Path file = write("{\"id\": 1}\n\n\n{\"id\": 2}\n");
        processor.connect();

        // When
        ProcessingStats stats = processor.processFile(file, DATA_DATE, null);

        // Then
        assertThat(stats.getTotalRead()).isEqualTo(2);
        assertThat(stats.getFailed()).isZero();
    }

    @Test
    void testProcessFile_BadLinesDoNotStopTheFile() throws IOException {
        // Given - one line with trailing data, one with an invalid UTF-8 sequence
        byte[] invalidUtf8 = new byte[] { '{', '"', 'i', 'd', '"', ':', '2', ',', '"', 'n', '"', ':', '"',
                (byte) 0xC3, 0x28, '"', '}', '\n' };
        Path file = tempDir.resolve("character.jsonlines");
        Files.write(file, "{\"id\": 1}\n".getBytes(StandardCharsets.UTF_8));
        Files.write(file, invalidUtf8, StandardOpenOption.APPEND);
        Files.write(file, "{\"id\": 3}} \n{\"id\": 4}\n".getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);
        processor.connect();

        // When
        ProcessingStats stats = processor.processFile(file, DATA_DATE, null);

        // Then
        assertThat(stats.getTotalRead()).isEqualTo(4);
        assertThat(stats.getFailed()).isEqualTo(2);
        assertThat(stats.getInserted()).isEqualTo(2);
    }

    @Test
    void testProcessFile_EmptyFileCommitsNothing() throws IOException, SQLException {
        // Given
        Path file = write("");
        processor.connect();

        // When
        ProcessingStats stats = processor.processFile(file, DATA_DATE, null);

        // Then
        assertThat(stats.getTotalRead()).isZero();
        assertThat(stats.getBatches()).isZero();
        verify(connection, never()).prepareStatement(anyString());
    }

    @Test
    void testProcessFile_FailedBatchDoesNotAbortFile() throws IOException, SQLException {
        // Given
        Path file = writeLines("{\"id\": 1}", "{\"id\": 2}", "{\"id\": 3}", "{\"id\": 4}");
        properties.setBatchSize(2);
        when(preparedStatement.executeQuery())
                .thenThrow(new SQLException("deadlock detected"))
                .thenReturn(resultSet);
        processor.connect();

        // When
        ProcessingStats stats = processor.processFile(file, DATA_DATE, null);

        // Then
        assertThat(stats.getFailed()).isEqualTo(2);
        assertThat(stats.getInserted()).isEqualTo(2);
        assertThat(stats.getFailedBatches()).isEqualTo(1);
        verify(connection).rollback();
    }

    @Test
    void testProcessFile_MissingFile() {
        // Given
        Path missing = tempDir.resolve("character.jsonlines");
        processor.connect();

        // When / Then
        assertThatThrownBy(() -> processor.processFile(missing, DATA_DATE, null))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void testClose_CloseErrorStillReleasesConnection() throws SQLException {
        // Given
        processor.connect();
        doThrow(new SQLException("already closed")).when(connection).close();

        // When
        processor.close();

        // Then
        assertThat(processor.isConnected()).isFalse();
    }

    private Path writeLines(String... lines) throws IOException {
        return write(String.join("\n", lines) + "\n");
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("character.jsonlines");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
