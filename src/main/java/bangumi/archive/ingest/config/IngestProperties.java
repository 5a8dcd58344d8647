package bangumi.archive.ingest.config;

import bangumi.archive.ingest.model.RecordType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Loader configuration, bound from the ingest.* properties:
 * - ingest.archive-dir
 * - ingest.batch-size
 * - ingest.data-date
 * - ingest.files.character / person / subject
 * - ingest.snapshot.date-pattern
 * - ingest.iteration.start-date / branch
 * - ingest.git.executable
 */
@Configuration
@ConfigurationProperties(prefix = "ingest")
@Data
public class IngestProperties {

    public static final int DEFAULT_BATCH_SIZE = 1000;

    /** Working tree of the archive checkout holding the jsonlines files */
    private String archiveDir = "bangumiArchive";

    /** Rows per upsert transaction */
    private int batchSize = DEFAULT_BATCH_SIZE;

    /**
     * Explicit data date (yyyy-MM-dd) for single-pass runs. When blank the date is
     * read from the checkout's HEAD commit message.
     */
    private String dataDate = "";

    private Files files = new Files();

    private Snapshot snapshot = new Snapshot();

    private Iteration iteration = new Iteration();

    private Git git = new Git();

    @Data
    public static class Files {
        private String character = "character.jsonlines";
        private String person = "person.jsonlines";
        private String subject = "subject.jsonlines";
    }

    @Data
    public static class Snapshot {
        /** First capture group must be the yyyy-MM-dd snapshot date */
        private String datePattern = "dump-(\\d{4}-\\d{2}-\\d{2})\\.\\d+Z\\.zip";
    }

    @Data
    public static class Iteration {
        /** Oldest snapshot date to load; blank disables iteration mode */
        private String startDate = "";

        /** Branch whose history is walked */
        private String branch = "master";
    }

    @Data
    public static class Git {
        private String executable = "git";
    }

    // ========================================
    // HELPER METHODS
    // ========================================

    public Path getArchivePath() {
        return Paths.get(archiveDir);
    }

    /**
     * Source file for a record type inside the archive checkout.
     */
    public Path getSourceFile(RecordType type) {
        String fileName;
        switch (type) {
            case CHARACTER:
                fileName = files.getCharacter();
                break;
            case PERSON:
                fileName = files.getPerson();
                break;
            case SUBJECT:
                fileName = files.getSubject();
                break;
            default:
                throw new IllegalArgumentException("No source file configured for " + type);
        }
        return getArchivePath().resolve(fileName);
    }

    public Optional<LocalDate> getIterationStartDate() {
        return parseDate(iteration.getStartDate());
    }

    public Optional<LocalDate> getFixedDataDate() {
        return parseDate(dataDate);
    }

    public boolean isIterationEnabled() {
        return getIterationStartDate().isPresent();
    }

    /**
     * Batch size guarded against misconfiguration.
     */
    public int getEffectiveBatchSize() {
        return batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
    }

    private static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.trim().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(LocalDate.parse(value.trim()));
    }
}
