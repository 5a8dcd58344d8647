package bangumi.archive.ingest.exception;

/**
 * No snapshot date could be extracted from a revision's commit message.
 */
public class DateResolutionException extends Exception {

    public DateResolutionException(String message) {
        super(message);
    }

    public DateResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
