package bangumi.archive.ingest.transformer;

import bangumi.archive.ingest.exception.RecordValidationException;
import bangumi.archive.ingest.model.CountStatsRow;
import bangumi.archive.ingest.model.StatsRow;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;

/**
 * Transformer for character and person records.
 *
 * Only the id is mandatory. The comment and collect counters are advisory: missing or
 * unusable values load as 0 instead of rejecting the record.
 */
public class CharacterPersonTransformer implements RecordTransformer {

    @Override
    public StatsRow transform(JsonNode record, LocalDate dataDate) throws RecordValidationException {
        TransformerUtils.requireObject(record);

        int id = TransformerUtils.requireId(record);
        int comments = TransformerUtils.countOrZero(record, "comments");
        int collects = TransformerUtils.countOrZero(record, "collects");

        return new CountStatsRow(id, comments, collects, dataDate);
    }
}
