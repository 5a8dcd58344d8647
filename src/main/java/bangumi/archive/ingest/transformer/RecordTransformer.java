package bangumi.archive.ingest.transformer;

import bangumi.archive.ingest.exception.RecordValidationException;
import bangumi.archive.ingest.model.StatsRow;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;

/**
 * Turns one decoded JSON line into the destination row of its record type.
 *
 * Implementations are pure: no logging and no I/O. Rejections are reported through
 * {@link RecordValidationException} and tallied by the caller.
 */
public interface RecordTransformer {

    /**
     * Transform a single source record.
     *
     * @param record   The decoded JSON line
     * @param dataDate Snapshot date stamped on the row
     * @return The normalized row, never null
     * @throws RecordValidationException if the record cannot produce a row
     */
    StatsRow transform(JsonNode record, LocalDate dataDate) throws RecordValidationException;
}
