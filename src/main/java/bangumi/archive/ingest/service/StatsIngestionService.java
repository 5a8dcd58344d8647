package bangumi.archive.ingest.service;

import bangumi.archive.ingest.config.IngestProperties;
import bangumi.archive.ingest.dto.TypeProcessingResult;
import bangumi.archive.ingest.exception.DatabaseConnectionException;
import bangumi.archive.ingest.exception.DateResolutionException;
import bangumi.archive.ingest.exception.SchemaInitializationException;
import bangumi.archive.ingest.model.ProcessingStats;
import bangumi.archive.ingest.model.RecordType;
import bangumi.archive.ingest.model.Revision;
import bangumi.archive.ingest.revision.RevisionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Loads the current archive checkout: one processor per record type, run one after the
 * other against the same data date.
 *
 * A missing file or a schema failure only fails its own type. A database connection
 * failure is rethrown since no other type could succeed either.
 */
@Service
public class StatsIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(StatsIngestionService.class);

    private final StatsProcessorFactory processorFactory;
    private final IngestProperties properties;
    private final RevisionSource revisionSource;
    private final SnapshotDateResolver dateResolver;

    public StatsIngestionService(StatsProcessorFactory processorFactory,
                                 IngestProperties properties,
                                 RevisionSource revisionSource,
                                 SnapshotDateResolver dateResolver) {
        this.processorFactory = processorFactory;
        this.properties = properties;
        this.revisionSource = revisionSource;
        this.dateResolver = dateResolver;
    }

    /**
     * Data date for a single-pass run: the configured ingest.data-date if set, otherwise
     * the date in the checkout's HEAD commit message.
     */
    public LocalDate resolveCurrentDataDate() throws DateResolutionException {
        Optional<LocalDate> fixed = properties.getFixedDataDate();
        if (fixed.isPresent()) {
            logger.info("Using configured data date: {}", fixed.get());
            return fixed.get();
        }
        LocalDate resolved = dateResolver.resolve(revisionSource.readMessage(Revision.HEAD));
        logger.info("Data date from HEAD commit: {}", resolved);
        return resolved;
    }

    /**
     * Process several record types in order.
     *
     * @throws DatabaseConnectionException if the database is unreachable
     */
    public List<TypeProcessingResult> processTypes(List<RecordType> types, LocalDate dataDate, Integer limit) {
        List<TypeProcessingResult> results = new ArrayList<>();
        for (RecordType type : types) {
            results.add(processType(type, dataDate, limit));
        }

        long succeeded = results.stream().filter(TypeProcessingResult::isSuccessful).count();
        logger.info("Processed {}/{} data types for {}", succeeded, types.size(), dataDate);
        return results;
    }

    /**
     * Connect, ensure the table, load the type's file and disconnect.
     *
     * @throws DatabaseConnectionException if the database is unreachable
     */
    public TypeProcessingResult processType(RecordType type, LocalDate dataDate, Integer limit) {
        logger.info("=== Processing {} data ===", type);
        Path sourceFile = properties.getSourceFile(type);

        try (StatsFileProcessor processor = processorFactory.createProcessor(type)) {
            processor.connect();
            processor.ensureSchema();

            ProcessingStats stats = processor.processFile(sourceFile, dataDate, limit);
            logger.info("{} data processed", type);
            return TypeProcessingResult.success(type, stats);

        } catch (NoSuchFileException e) {
            logger.warn("{} file does not exist: {}", type, sourceFile);
            return TypeProcessingResult.missingFile(type, "File not found: " + sourceFile);
        } catch (SchemaInitializationException e) {
            logger.error("Failed to prepare table for {}", type, e);
            return TypeProcessingResult.failed(type, e.getMessage());
        } catch (IOException e) {
            logger.error("Failed to read {} file {}", type, sourceFile, e);
            return TypeProcessingResult.failed(type, "Read error: " + e.getMessage());
        }
    }
}
