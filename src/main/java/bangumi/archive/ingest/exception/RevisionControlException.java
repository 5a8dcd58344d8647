package bangumi.archive.ingest.exception;

/**
 * A git command against the archive checkout failed.
 */
public class RevisionControlException extends RuntimeException {

    public RevisionControlException(String message) {
        super(message);
    }

    public RevisionControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
