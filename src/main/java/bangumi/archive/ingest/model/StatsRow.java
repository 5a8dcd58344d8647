package bangumi.archive.ingest.model;

import java.time.LocalDate;
import java.util.List;

/**
 * One normalized destination row. Values are in the column order of the owning
 * {@link RecordType}.
 */
public interface StatsRow {

    int getId();

    LocalDate getDataDate();

    /**
     * Bind values in {@link RecordType#getColumns()} order. Nullable columns may hold null.
     */
    List<Object> getValues();
}
