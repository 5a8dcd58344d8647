package bangumi.archive.ingest.exception;

/**
 * One upsert batch could not be committed and was rolled back.
 */
public class BatchCommitException extends Exception {

    private final int batchNumber;
    private final int rowCount;

    public BatchCommitException(int batchNumber, int rowCount, Throwable cause) {
        super(String.format("Batch %d (%d rows) rolled back: %s", batchNumber, rowCount, cause.getMessage()), cause);
        this.batchNumber = batchNumber;
        this.rowCount = rowCount;
    }

    public int getBatchNumber() {
        return batchNumber;
    }

    public int getRowCount() {
        return rowCount;
    }
}
