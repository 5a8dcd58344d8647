package bangumi.archive.ingest.exception;

/**
 * The database is unreachable or rejected the credentials. Fatal to the run.
 */
public class DatabaseConnectionException extends RuntimeException {

    public DatabaseConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
