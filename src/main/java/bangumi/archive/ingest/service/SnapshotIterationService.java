package bangumi.archive.ingest.service;

import bangumi.archive.ingest.dto.IterationSummary;
import bangumi.archive.ingest.dto.IterationSummary.RevisionResult;
import bangumi.archive.ingest.dto.IterationSummary.RevisionStatus;
import bangumi.archive.ingest.dto.TypeProcessingResult;
import bangumi.archive.ingest.exception.DatabaseConnectionException;
import bangumi.archive.ingest.exception.DateResolutionException;
import bangumi.archive.ingest.exception.RevisionControlException;
import bangumi.archive.ingest.model.IterationState;
import bangumi.archive.ingest.model.RecordType;
import bangumi.archive.ingest.model.Revision;
import bangumi.archive.ingest.revision.RevisionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Walks the archive history from a start date to the newest revision and loads every
 * snapshot under its own date.
 *
 * Per revision: CHECKOUT -> RESOLVE_DATE -> PROCESS -> CLEANUP. A failed checkout or an
 * undated commit skips straight to CLEANUP and the walk continues with the next
 * revision; nothing is retried. A database connection failure ends the walk.
 *
 * The checkout is forced, so local changes in the archive directory are discarded.
 */
@Service
public class SnapshotIterationService {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotIterationService.class);

    private final RevisionSource revisionSource;
    private final SnapshotDateResolver dateResolver;
    private final StatsIngestionService ingestionService;
    private final WorkingTreeCleaner cleaner;

    private IterationState state = IterationState.IDLE;

    public SnapshotIterationService(RevisionSource revisionSource,
                                    SnapshotDateResolver dateResolver,
                                    StatsIngestionService ingestionService,
                                    WorkingTreeCleaner cleaner) {
        this.revisionSource = revisionSource;
        this.dateResolver = dateResolver;
        this.ingestionService = ingestionService;
        this.cleaner = cleaner;
    }

    public IterationState getState() {
        return state;
    }

    /**
     * Load every revision from startDate onward.
     *
     * @param startDate Oldest snapshot date to load
     * @param types     Record types to load per revision
     * @param limit     Optional per-file line limit
     * @return per-revision outcomes
     * @throws DatabaseConnectionException if the database becomes unreachable
     * @throws RevisionControlException    if the revision list cannot be read
     */
    public IterationSummary iterate(LocalDate startDate, List<RecordType> types, Integer limit) {
        long startTime = System.currentTimeMillis();
        IterationSummary summary = new IterationSummary(startDate);
        transition(IterationState.IDLE);

        logger.info("Starting snapshot iteration from {}", startDate);
        List<Revision> revisions = revisionSource.listRevisionsSince(startDate);
        if (revisions.isEmpty()) {
            logger.error("No revision found with a snapshot date on or after {}", startDate);
            transition(IterationState.DONE);
            return summary;
        }

        cleaner.removeSourceFiles();

        try {
            for (int i = 0; i < revisions.size(); i++) {
                Revision revision = revisions.get(i);
                logger.info("=== Revision {}/{}: {} {} ===",
                        i + 1, revisions.size(), revision.getShortId(), revision.getSubject());

                RevisionResult result = processRevision(revision, types, limit);
                summary.add(result);

                if (result.getStatus() != RevisionStatus.PROCESSED) {
                    logger.warn("Revision {} finished with status {}: {}",
                            revision.getShortId(), result.getStatus(), result.getErrorMessage());
                }
            }
        } finally {
            summary.setDurationMs(System.currentTimeMillis() - startTime);
            transition(IterationState.DONE);
        }

        logger.info("Iteration completed: {} revisions, {} processed, {} partially failed, {} skipped, {} checkout failures",
                summary.getTotalRevisions(),
                summary.countByStatus(RevisionStatus.PROCESSED),
                summary.countByStatus(RevisionStatus.PARTIALLY_FAILED),
                summary.countByStatus(RevisionStatus.SKIPPED_NO_DATE),
                summary.countByStatus(RevisionStatus.CHECKOUT_FAILED));
        return summary;
    }

    private RevisionResult processRevision(Revision revision, List<RecordType> types, Integer limit) {
        transition(IterationState.CHECKOUT);
        try {
            revisionSource.checkout(revision);
        } catch (RevisionControlException e) {
            logger.error("Checkout of {} failed", revision.getShortId(), e);
            cleanup();
            return new RevisionResult(revision, null, RevisionStatus.CHECKOUT_FAILED, List.of(), e.getMessage());
        }

        transition(IterationState.RESOLVE_DATE);
        LocalDate dataDate;
        try {
            dataDate = dateResolver.resolve(revisionSource.readMessage(revision));
        } catch (DateResolutionException | RevisionControlException e) {
            logger.warn("Skipping {}: {}", revision.getShortId(), e.getMessage());
            cleanup();
            return new RevisionResult(revision, null, RevisionStatus.SKIPPED_NO_DATE, List.of(), e.getMessage());
        }

        transition(IterationState.PROCESS);
        logger.info("Data date: {}", dataDate);
        List<TypeProcessingResult> typeResults;
        try {
            typeResults = ingestionService.processTypes(types, dataDate, limit);
        } finally {
            cleanup();
        }

        boolean allSucceeded = typeResults.stream().allMatch(TypeProcessingResult::isSuccessful);
        if (allSucceeded) {
            return new RevisionResult(revision, dataDate, RevisionStatus.PROCESSED, typeResults, null);
        }
        return new RevisionResult(revision, dataDate, RevisionStatus.PARTIALLY_FAILED, typeResults,
                "Some data types failed for " + dataDate);
    }

    private void cleanup() {
        transition(IterationState.CLEANUP);
        int deleted = cleaner.removeSourceFiles();
        logger.debug("Removed {} working files", deleted);
    }

    private void transition(IterationState next) {
        logger.debug("Iteration state {} -> {}", state, next);
        state = next;
    }
}
