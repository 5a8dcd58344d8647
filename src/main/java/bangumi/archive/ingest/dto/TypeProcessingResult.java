package bangumi.archive.ingest.dto;

import bangumi.archive.ingest.model.ProcessingStats;
import bangumi.archive.ingest.model.RecordType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of loading one record type for one data date.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TypeProcessingResult {

    public enum Status {
        /** File was read to the end (or limit); row-level failures are in the stats */
        SUCCESS,
        /** Source file absent for this revision */
        MISSING_FILE,
        /** Schema creation or file reading failed */
        FAILED
    }

    private RecordType recordType;
    private Status status;
    private ProcessingStats stats;
    private String errorMessage;

    public static TypeProcessingResult success(RecordType recordType, ProcessingStats stats) {
        return new TypeProcessingResult(recordType, Status.SUCCESS, stats, null);
    }

    public static TypeProcessingResult missingFile(RecordType recordType, String errorMessage) {
        return new TypeProcessingResult(recordType, Status.MISSING_FILE, null, errorMessage);
    }

    public static TypeProcessingResult failed(RecordType recordType, String errorMessage) {
        return new TypeProcessingResult(recordType, Status.FAILED, null, errorMessage);
    }

    public boolean isSuccessful() {
        return status == Status.SUCCESS;
    }
}
