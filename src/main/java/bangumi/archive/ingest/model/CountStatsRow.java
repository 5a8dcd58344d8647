package bangumi.archive.ingest.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Row shape shared by character_stats and person_stats.
 */
@Value
public class CountStatsRow implements StatsRow {

    int id;
    int comments;
    int collects;
    LocalDate dataDate;

    @Override
    public List<Object> getValues() {
        return Arrays.asList(id, comments, collects, dataDate);
    }
}
