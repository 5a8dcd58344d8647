package bangumi.archive.ingest.exception;

public class UnsupportedRecordTypeException extends IllegalArgumentException {

    public UnsupportedRecordTypeException(String message) {
        super(message);
    }
}
