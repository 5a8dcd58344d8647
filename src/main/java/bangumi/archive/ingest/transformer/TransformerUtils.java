package bangumi.archive.ingest.transformer;

import bangumi.archive.ingest.exception.RecordValidationException;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Field coercion rules shared by the record transformers.
 *
 * Two policies live here:
 * 1. Strict (id) - reject the record with a {@link RecordValidationException}
 * 2. Lenient (counters, score, rank) - fall back to 0 or NULL depending on the column
 */
public final class TransformerUtils {

    private static final String ID_FIELD = "id";

    private TransformerUtils() {
    }

    /**
     * A JSON line must decode to an object to carry any fields at all.
     */
    public static void requireObject(JsonNode record) throws RecordValidationException {
        if (record == null || !record.isObject()) {
            throw new RecordValidationException("record",
                    "Expected a JSON object but got " + (record == null ? "nothing" : record.getNodeType()));
        }
    }

    /**
     * Extract the mandatory entity id: a non-negative whole number that fits an INTEGER
     * column. Numeric strings are accepted.
     *
     * @throws RecordValidationException when missing, non-numeric, fractional, negative
     *                                   or out of range
     */
    public static int requireId(JsonNode record) throws RecordValidationException {
        JsonNode node = record.get(ID_FIELD);
        if (node == null || node.isNull()) {
            throw new RecordValidationException(ID_FIELD, "id is missing");
        }

        BigDecimal value = toDecimal(node);
        if (value == null) {
            throw new RecordValidationException(ID_FIELD, "id is not numeric: " + node);
        }

        long id;
        try {
            id = value.longValueExact();
        } catch (ArithmeticException e) {
            throw new RecordValidationException(ID_FIELD, "id is not a whole number in range: " + node);
        }

        if (id < 0) {
            throw new RecordValidationException(ID_FIELD, "id is negative: " + id);
        }
        if (id > Integer.MAX_VALUE) {
            throw new RecordValidationException(ID_FIELD, "id exceeds INTEGER range: " + id);
        }
        return (int) id;
    }

    /**
     * Counter field: absent, null, non-numeric or negative values load as 0; fractions are
     * truncated; values beyond the INTEGER range are capped.
     */
    public static int countOrZero(JsonNode record, String field) {
        BigDecimal value = toDecimal(record.get(field));
        if (value == null || value.signum() <= 0) {
            return 0;
        }
        BigDecimal truncated = value.setScale(0, RoundingMode.DOWN);
        if (truncated.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
            return Integer.MAX_VALUE;
        }
        return truncated.intValue();
    }

    /**
     * Score field rounded half-up to one decimal place, NULL when absent, non-numeric or
     * outside [min, max].
     */
    public static BigDecimal scoreOrNull(JsonNode record, String field, BigDecimal min, BigDecimal max) {
        BigDecimal value = toDecimal(record.get(field));
        if (value == null) {
            return null;
        }
        BigDecimal rounded = value.setScale(1, RoundingMode.HALF_UP);
        if (rounded.compareTo(min) < 0 || rounded.compareTo(max) > 0) {
            return null;
        }
        return rounded;
    }

    /**
     * Positive whole number or NULL. Zero counts as "no value", which is how the archive
     * marks unranked entries.
     */
    public static Integer positiveIntOrNull(JsonNode record, String field) {
        BigDecimal value = toDecimal(record.get(field));
        if (value == null || value.signum() <= 0) {
            return null;
        }
        try {
            long whole = value.longValueExact();
            return whole <= Integer.MAX_VALUE ? (int) whole : null;
        } catch (ArithmeticException e) {
            return null;
        }
    }

    /**
     * Opaque JSON value rendered back to JSON text, NULL when absent or JSON null.
     */
    public static String jsonOrNull(JsonNode record, String field) {
        JsonNode node = record.get(field);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.toString();
    }

    /**
     * Numeric view of a JSON number or numeric string; null for everything else.
     */
    static BigDecimal toDecimal(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            if (node.isDouble() || node.isFloat()) {
                double d = node.doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    return null;
                }
                return BigDecimal.valueOf(d);
            }
            return node.decimalValue();
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
