package bangumi.archive.ingest.transformer;

import bangumi.archive.ingest.exception.RecordValidationException;
import bangumi.archive.ingest.model.StatsRow;
import bangumi.archive.ingest.model.SubjectStatsRow;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Transformer for subject records.
 *
 * score is kept to one decimal within the rating scale, rank must be positive, and the
 * score_details / favorite objects are stored as-is in JSONB columns. Anything absent or
 * unusable becomes NULL, never 0, so "unrated" stays distinguishable from a real value.
 */
public class SubjectTransformer implements RecordTransformer {

    static final BigDecimal MIN_SCORE = BigDecimal.ZERO;
    static final BigDecimal MAX_SCORE = BigDecimal.TEN;

    @Override
    public StatsRow transform(JsonNode record, LocalDate dataDate) throws RecordValidationException {
        TransformerUtils.requireObject(record);

        int id = TransformerUtils.requireId(record);
        BigDecimal score = TransformerUtils.scoreOrNull(record, "score", MIN_SCORE, MAX_SCORE);
        String scoreDetails = TransformerUtils.jsonOrNull(record, "score_details");
        Integer rank = TransformerUtils.positiveIntOrNull(record, "rank");
        String favorite = TransformerUtils.jsonOrNull(record, "favorite");

        return new SubjectStatsRow(id, score, scoreDetails, rank, favorite, dataDate);
    }
}
