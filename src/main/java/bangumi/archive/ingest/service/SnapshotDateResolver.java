package bangumi.archive.ingest.service;

import bangumi.archive.ingest.config.IngestProperties;
import bangumi.archive.ingest.exception.DateResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the snapshot date from an archive commit message.
 *
 * Archive commits reference the dump they were built from, e.g.
 * "dump-2025-09-02.210328Z.zip". The pattern is configurable via
 * ingest.snapshot.date-pattern; its first capture group must be the yyyy-MM-dd date.
 */
@Service
public class SnapshotDateResolver {

    private static final Logger log = LoggerFactory.getLogger(SnapshotDateResolver.class);

    private final Pattern datePattern;

    public SnapshotDateResolver(IngestProperties properties) {
        this.datePattern = Pattern.compile(properties.getSnapshot().getDatePattern());
        if (datePattern.matcher("").groupCount() < 1) {
            throw new IllegalArgumentException(
                    "Snapshot date pattern needs a capture group for the date: " + datePattern.pattern());
        }
        log.info("SnapshotDateResolver initialized with pattern: {}", datePattern.pattern());
    }

    /**
     * Resolve the snapshot date of a commit message.
     *
     * @param message Full commit message or subject line
     * @return the date in the first dump reference found
     * @throws DateResolutionException if no dump reference is present or its date is invalid
     */
    public LocalDate resolve(String message) throws DateResolutionException {
        if (message == null || message.isBlank()) {
            throw new DateResolutionException("Commit message is empty, no snapshot date to resolve");
        }

        Matcher matcher = datePattern.matcher(message);
        if (!matcher.find()) {
            throw new DateResolutionException(String.format(
                    "No snapshot date in commit message '%s' (pattern '%s')",
                    firstLine(message), datePattern.pattern()));
        }

        String dateText = matcher.group(1);
        try {
            return LocalDate.parse(dateText);
        } catch (DateTimeParseException e) {
            throw new DateResolutionException("Invalid snapshot date '" + dateText + "' in commit message", e);
        }
    }

    /**
     * Like {@link #resolve(String)} but for listing, where undated commits are expected.
     */
    public Optional<LocalDate> tryResolve(String message) {
        try {
            return Optional.of(resolve(message));
        } catch (DateResolutionException e) {
            log.trace("Ignoring commit without snapshot date: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String firstLine(String message) {
        String trimmed = message.strip();
        int newline = trimmed.indexOf('\n');
        return newline >= 0 ? trimmed.substring(0, newline) : trimmed;
    }
}
