package bangumi.archive.ingest.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Counters for one source file processed by one processor run. Held in memory and
 * logged at the end of the run, never persisted.
 */
@Data
@NoArgsConstructor
public class ProcessingStats {

    private RecordType recordType;
    private String sourceFile;
    private LocalDate dataDate;

    private long totalRead;
    private long inserted;
    private long updated;
    private long skipped;
    private long failed;

    private int batches;
    private int failedBatches;

    private long durationMs;

    public ProcessingStats(RecordType recordType, String sourceFile, LocalDate dataDate) {
        this.recordType = recordType;
        this.sourceFile = sourceFile;
        this.dataDate = dataDate;
    }

    public void incrementTotalRead() {
        totalRead++;
    }

    public void incrementFailed() {
        failed++;
    }

    public void addFailed(long count) {
        failed += count;
    }

    public void addInserted(long count) {
        inserted += count;
    }

    public void addUpdated(long count) {
        updated += count;
    }

    public void addSkipped(long count) {
        skipped += count;
    }

    public void recordBatch(boolean committed) {
        batches++;
        if (!committed) {
            failedBatches++;
        }
    }

    /**
     * Rows committed to the destination table, inserted or overwritten.
     */
    public long getUpserted() {
        return inserted + updated;
    }

    public String getTableName() {
        return recordType != null ? recordType.getTableName() : null;
    }

    public String toSummary() {
        return String.format(
                "%s -> %s [%s]: read=%d, inserted=%d, updated=%d, skipped=%d, failed=%d, batches=%d (failed %d), %dms",
                sourceFile, getTableName(), dataDate, totalRead, inserted, updated, skipped, failed,
                batches, failedBatches, durationMs);
    }
}
