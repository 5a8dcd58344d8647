package bangumi.archive.ingest.exception;

/**
 * A single source record does not meet the shape of its destination row.
 * Scoped to that record: the caller counts it as failed and moves on.
 */
public class RecordValidationException extends Exception {

    private final String field;

    public RecordValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Name of the offending source field.
     */
    public String getField() {
        return field;
    }
}
