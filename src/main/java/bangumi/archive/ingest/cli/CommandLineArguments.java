package bangumi.archive.ingest.cli;

import bangumi.archive.ingest.exception.UnsupportedRecordTypeException;
import bangumi.archive.ingest.model.RecordType;
import bangumi.archive.ingest.service.StatsProcessorFactory;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Parsed positional arguments: {@code [run] [<type>|all] [limit]}.
 *
 * - no type: all types
 * - numeric first argument: all types with that limit
 * - invalid limit: ignored with a warning
 */
@Value
@Slf4j
public class CommandLineArguments {

    public static final String ALL = "all";
    private static final String RUN = "run";

    List<RecordType> types;

    /** Per-file line limit, null for no limit */
    Integer limit;

    /**
     * @throws UnsupportedRecordTypeException for an unknown type name
     */
    public static CommandLineArguments parse(List<String> rawArgs) {
        List<String> args = new ArrayList<>(rawArgs);
        if (!args.isEmpty() && RUN.equalsIgnoreCase(args.get(0).trim())) {
            args.remove(0);
        }

        if (args.isEmpty()) {
            log.info("No data type given, processing all data types");
            return new CommandLineArguments(allTypes(), null);
        }

        String first = args.get(0).trim().toLowerCase(Locale.ROOT);

        Integer leadingLimit = parseLimit(first);
        if (leadingLimit != null) {
            log.info("No data type given, processing all data types limited to the first {} records", leadingLimit);
            return new CommandLineArguments(allTypes(), leadingLimit);
        }

        List<RecordType> types;
        if (ALL.equals(first)) {
            types = allTypes();
        } else {
            RecordType type = RecordType.fromTypeName(first)
                    .orElseThrow(() -> new UnsupportedRecordTypeException(String.format(
                            "Unsupported data type: %s. Supported types: %s",
                            first, String.join(", ", StatsProcessorFactory.getSupportedTypes()))));
            types = List.of(type);
        }

        Integer limit = null;
        if (args.size() > 1) {
            limit = parseLimit(args.get(1).trim());
            if (limit == null) {
                log.warn("Invalid limit '{}', processing all records", args.get(1));
            } else {
                log.info("Limiting processing to the first {} records", limit);
            }
        }

        return new CommandLineArguments(types, limit);
    }

    private static List<RecordType> allTypes() {
        return Arrays.asList(RecordType.values());
    }

    private static Integer parseLimit(String value) {
        try {
            int parsed = Integer.parseInt(value);
            return parsed > 0 ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
