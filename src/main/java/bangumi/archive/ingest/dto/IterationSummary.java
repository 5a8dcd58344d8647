package bangumi.archive.ingest.dto;

import bangumi.archive.ingest.model.Revision;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Results of walking the archive history, one entry per revision in processing order.
 */
@Data
@NoArgsConstructor
public class IterationSummary {

    private LocalDate startDate;
    private List<RevisionResult> revisionResults = new ArrayList<>();
    private long durationMs;

    public IterationSummary(LocalDate startDate) {
        this.startDate = startDate;
    }

    public void add(RevisionResult result) {
        revisionResults.add(result);
    }

    public int getTotalRevisions() {
        return revisionResults.size();
    }

    public long countByStatus(RevisionStatus status) {
        return revisionResults.stream()
                .filter(r -> r.getStatus() == status)
                .count();
    }

    /**
     * True when at least one revision ran and every revision loaded all its types.
     */
    public boolean isFullySuccessful() {
        return !revisionResults.isEmpty() && countByStatus(RevisionStatus.PROCESSED) == revisionResults.size();
    }

    public enum RevisionStatus {
        /** Every requested type loaded */
        PROCESSED,
        /** Some types failed or their files were missing */
        PARTIALLY_FAILED,
        /** Commit message carried no snapshot date */
        SKIPPED_NO_DATE,
        /** git checkout failed */
        CHECKOUT_FAILED
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RevisionResult {
        private Revision revision;
        private LocalDate dataDate;
        private RevisionStatus status;
        private List<TypeProcessingResult> typeResults;
        private String errorMessage;
    }
}
