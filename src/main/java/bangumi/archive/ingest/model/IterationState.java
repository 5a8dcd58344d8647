package bangumi.archive.ingest.model;

/**
 * States walked by the snapshot iteration for every revision.
 */
public enum IterationState {
    IDLE,
    CHECKOUT,
    RESOLVE_DATE,
    PROCESS,
    CLEANUP,
    DONE
}
