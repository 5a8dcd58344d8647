package bangumi.archive.ingest.config;

import bangumi.archive.ingest.model.RecordType;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(IngestProperties.class);

    @Test
    void testDefaults() {
        // Given
        IngestProperties properties = new IngestProperties();

        // Then
        assertThat(properties.getBatchSize()).isEqualTo(1000);
        assertThat(properties.getSourceFile(RecordType.CHARACTER))
                .isEqualTo(Paths.get("bangumiArchive", "character.jsonlines"));
        assertThat(properties.getSourceFile(RecordType.SUBJECT))
                .isEqualTo(Paths.get("bangumiArchive", "subject.jsonlines"));
        assertThat(properties.isIterationEnabled()).isFalse();
        assertThat(properties.getFixedDataDate()).isEmpty();
        assertThat(properties.getIteration().getBranch()).isEqualTo("master");
    }

    @Test
    void testBinding_FromProperties() {
        contextRunner
                .withPropertyValues(
                        "ingest.archive-dir=/data/archive",
                        "ingest.batch-size=250",
                        "ingest.data-date=2025-09-02",
                        "ingest.files.person=people.jsonlines",
                        "ingest.iteration.start-date=2025-08-01",
                        "ingest.iteration.branch=main")
                .run(context -> {
                    IngestProperties properties = context.getBean(IngestProperties.class);
                    assertThat(properties.getEffectiveBatchSize()).isEqualTo(250);
                    assertThat(properties.getFixedDataDate()).contains(LocalDate.of(2025, 9, 2));
                    assertThat(properties.getIterationStartDate()).contains(LocalDate.of(2025, 8, 1));
                    assertThat(properties.isIterationEnabled()).isTrue();
                    assertThat(properties.getIteration().getBranch()).isEqualTo("main");
                    assertThat(properties.getSourceFile(RecordType.PERSON))
                            .isEqualTo(Paths.get("/data/archive", "people.jsonlines"));
                });
    }

    @Test
    void testBinding_BlankDatesAreUnset() {
        contextRunner
                .withPropertyValues("ingest.data-date=", "ingest.iteration.start-date=  ")
                .run(context -> {
                    IngestProperties properties = context.getBean(IngestProperties.class);
                    assertThat(properties.getFixedDataDate()).isEmpty();
                    assertThat(properties.isIterationEnabled()).isFalse();
                });
    }

    @Test
    void testEffectiveBatchSize_FallsBackOnNonPositive() {
        // Given
        IngestProperties properties = new IngestProperties();
        properties.setBatchSize(0);

        // Then
        assertThat(properties.getEffectiveBatchSize()).isEqualTo(IngestProperties.DEFAULT_BATCH_SIZE);
    }

    @Test
    void testIterationStartDate_InvalidFormat() {
        // Given
        IngestProperties properties = new IngestProperties();
        properties.getIteration().setStartDate("2025/09/01");

        // When / Then
        assertThatThrownBy(properties::getIterationStartDate).isInstanceOf(DateTimeParseException.class);
    }
}
