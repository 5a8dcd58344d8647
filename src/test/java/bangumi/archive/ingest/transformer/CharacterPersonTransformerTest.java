package bangumi.archive.ingest.transformer;

import bangumi.archive.ingest.exception.RecordValidationException;
import bangumi.archive.ingest.model.CountStatsRow;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class CharacterPersonTransformerTest {

    private static final LocalDate DATA_DATE = LocalDate.of(2025, 9, 2);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CharacterPersonTransformer transformer = new CharacterPersonTransformer();

    @Test
    void testTransform_AllFieldsPresent() throws Exception {
        // Given
        JsonNode record = objectMapper.readTree("{\"id\": 1, \"comments\": 12, \"collects\": 340, \"name\": \"x\"}");

        // When
        CountStatsRow row = (CountStatsRow) transformer.transform(record, DATA_DATE);

        // Then
        assertEquals(new CountStatsRow(1, 12, 340, DATA_DATE), row);
    }

    @Test
    void testTransform_MissingCountersDefaultToZero() throws Exception {
        // Given
        JsonNode record = objectMapper.readTree("{\"id\": 5}");

        // When
        CountStatsRow row = (CountStatsRow) transformer.transform(record, DATA_DATE);

        // Then
        assertThat(row.getId()).isEqualTo(5);
        assertThat(row.getComments()).isZero();
        assertThat(row.getCollects()).isZero();
        assertThat(row.getDataDate()).isEqualTo(DATA_DATE);
    }

    @Test
    void testTransform_NullAndNonNumericCountersBecomeZero() throws Exception {
        // Given
        JsonNode record = objectMapper.readTree("{\"id\": 9, \"comments\": null, \"collects\": \"many\"}");

        // When
        CountStatsRow row = (CountStatsRow) transformer.transform(record, DATA_DATE);

        // Then
        assertThat(row.getComments()).isZero();
        assertThat(row.getCollects()).isZero();
    }

    @Test
    void testTransform_NumericStringCountersAreParsed() throws Exception {
        // Given
        JsonNode record = objectMapper.readTree("{\"id\": \"42\", \"comments\": \"7\", \"collects\": 3.9}");

        // When
        CountStatsRow row = (CountStatsRow) transformer.transform(record, DATA_DATE);

        // Then
        assertThat(row.getId()).isEqualTo(42);
        assertThat(row.getComments()).isEqualTo(7);
        assertThat(row.getCollects()).isEqualTo(3);
    }

    @Test
    void testTransform_NegativeCountersClampToZero() throws Exception {
        // Given
        JsonNode record = objectMapper.readTree("{\"id\": 3, \"comments\": -4, \"collects\": -1}");

        // When
        CountStatsRow row = (CountStatsRow) transformer.transform(record, DATA_DATE);

        // Then
        assertThat(row.getComments()).isZero();
        assertThat(row.getCollects()).isZero();
    }

    @Test
    void testTransform_MissingIdIsRejected() throws Exception {
        // Given
        JsonNode record = objectMapper.readTree("{\"comments\": 1}");

        // When / Then
        assertThatThrownBy(() -> transformer.transform(record, DATA_DATE))
                .isInstanceOf(RecordValidationException.class)
                .satisfies(e -> assertThat(((RecordValidationException) e).getField()).isEqualTo("id"));
    }

    @Test
    void testTransform_NonObjectLineIsRejected() throws Exception {
        // Given
        JsonNode record = objectMapper.readTree("[1, 2, 3]");

        // When / Then
        assertThatThrownBy(() -> transformer.transform(record, DATA_DATE))
                .isInstanceOf(RecordValidationException.class)
                .hasMessageContaining("ARRAY");
    }
}
