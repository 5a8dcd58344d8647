package bangumi.archive.ingest.exception;

/**
 * Destination table or index DDL failed.
 */
public class SchemaInitializationException extends RuntimeException {

    public SchemaInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
