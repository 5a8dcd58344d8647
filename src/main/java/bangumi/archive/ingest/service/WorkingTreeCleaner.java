package bangumi.archive.ingest.service;

import bangumi.archive.ingest.config.IngestProperties;
import bangumi.archive.ingest.model.RecordType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Removes the per-type source files from the archive checkout between revisions so each
 * checkout starts from a clean slate. Failures are logged, never thrown.
 */
@Component
public class WorkingTreeCleaner {

    private static final Logger logger = LoggerFactory.getLogger(WorkingTreeCleaner.class);

    private final IngestProperties properties;

    public WorkingTreeCleaner(IngestProperties properties) {
        this.properties = properties;
    }

    /**
     * Delete the character, person and subject files if present.
     *
     * @return number of files actually deleted
     */
    public int removeSourceFiles() {
        int deleted = 0;
        for (RecordType type : RecordType.values()) {
            if (deleteIfPresent(properties.getSourceFile(type))) {
                deleted++;
            }
        }
        return deleted;
    }

    private boolean deleteIfPresent(Path file) {
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                logger.debug("Deleted working file: {}", file);
            }
            return deleted;
        } catch (IOException e) {
            logger.warn("Failed to delete working file {}: {}", file, e.getMessage());
            return false;
        }
    }
}
