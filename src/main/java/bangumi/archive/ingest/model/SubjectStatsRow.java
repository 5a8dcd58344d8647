package bangumi.archive.ingest.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Row shape of subject_stats. All analytic columns are nullable; the JSON columns hold
 * the raw JSON text of the source values.
 */
@Value
public class SubjectStatsRow implements StatsRow {

    int id;
    BigDecimal score;
    String scoreDetails;
    Integer rank;
    String favorite;
    LocalDate dataDate;

    @Override
    public List<Object> getValues() {
        // Arrays.asList keeps nulls, List.of would reject them
        return Arrays.asList(id, score, scoreDetails, rank, favorite, dataDate);
    }
}
