package bangumi.archive.ingest.cli;

import bangumi.archive.ingest.config.IngestProperties;
import bangumi.archive.ingest.dto.IterationSummary;
import bangumi.archive.ingest.dto.TypeProcessingResult;
import bangumi.archive.ingest.exception.UnsupportedRecordTypeException;
import bangumi.archive.ingest.service.SnapshotIterationService;
import bangumi.archive.ingest.service.StatsIngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Command line entry point.
 *
 * With ingest.iteration.start-date set the archive history is walked from that date;
 * otherwise the current checkout is loaded once. Exit code 0 means every requested
 * type (and every revision) loaded, 1 otherwise.
 */
@Component
public class StatsLoaderRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(StatsLoaderRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final IngestProperties properties;
    private final StatsIngestionService ingestionService;
    private final SnapshotIterationService iterationService;

    private int exitCode = EXIT_OK;

    public StatsLoaderRunner(IngestProperties properties,
                             StatsIngestionService ingestionService,
                             SnapshotIterationService iterationService) {
        this.properties = properties;
        this.ingestionService = ingestionService;
        this.iterationService = iterationService;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getNonOptionArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(List<String> args) {
        logger.info("=== Bangumi archive stats loader ===");

        CommandLineArguments arguments;
        try {
            arguments = CommandLineArguments.parse(args);
        } catch (UnsupportedRecordTypeException e) {
            logger.error(e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            if (properties.isIterationEnabled()) {
                return runIteration(properties.getIterationStartDate().get(), arguments);
            }
            return runSinglePass(arguments);
        } catch (Exception e) {
            logger.error("Run failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    private int runSinglePass(CommandLineArguments arguments) throws Exception {
        LocalDate dataDate = ingestionService.resolveCurrentDataDate();
        logger.info("Data date: {}", dataDate);

        List<TypeProcessingResult> results =
                ingestionService.processTypes(arguments.getTypes(), dataDate, arguments.getLimit());

        long succeeded = results.stream().filter(TypeProcessingResult::isSuccessful).count();
        logger.info("=== Processing complete ===");
        logger.info("Successfully processed: {}/{} data types", succeeded, results.size());

        if (succeeded == results.size()) {
            logger.info("All data processed");
            return EXIT_OK;
        }
        logger.warn("Some data types failed");
        return EXIT_FAILURE;
    }

    private int runIteration(LocalDate startDate, CommandLineArguments arguments) {
        logger.info("Start date: {}", startDate);

        IterationSummary summary = iterationService.iterate(startDate, arguments.getTypes(), arguments.getLimit());
        return summary.isFullySuccessful() ? EXIT_OK : EXIT_FAILURE;
    }
}
