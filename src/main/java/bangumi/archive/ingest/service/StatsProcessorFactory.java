package bangumi.archive.ingest.service;

import bangumi.archive.ingest.config.IngestProperties;
import bangumi.archive.ingest.exception.UnsupportedRecordTypeException;
import bangumi.archive.ingest.model.RecordType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.Arrays;
import java.util.List;

/**
 * Factory for {@link StatsFileProcessor} instances.
 *
 * Resolves a record type name to its {@link RecordType} and hands the database and
 * ingest configuration to a fresh processor. Holds no per-run state.
 */
@Service
@Slf4j
public class StatsProcessorFactory {

    private final DataSource dataSource;
    private final IngestProperties properties;
    private final ObjectMapper objectMapper;

    public StatsProcessorFactory(DataSource dataSource, IngestProperties properties, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Create a processor for a record type name.
     *
     * @param typeName character, person or subject (case-insensitive)
     * @return a new, unconnected processor
     * @throws UnsupportedRecordTypeException for unknown names
     */
    public StatsFileProcessor createProcessor(String typeName) {
        RecordType type = RecordType.fromTypeName(typeName)
                .orElseThrow(() -> new UnsupportedRecordTypeException(
                        String.format("Unsupported data type: %s. Supported types: %s",
                                typeName, String.join(", ", getSupportedTypes()))));
        return createProcessor(type);
    }

    public StatsFileProcessor createProcessor(RecordType type) {
        log.debug("Creating {} processor", type);
        return new StatsFileProcessor(type, dataSource, properties, objectMapper);
    }

    public static boolean isSupportedType(String typeName) {
        return RecordType.fromTypeName(typeName).isPresent();
    }

    public static List<String> getSupportedTypes() {
        return Arrays.stream(RecordType.values())
                .map(RecordType::getTypeName)
                .toList();
    }
}
