package bangumi.archive.ingest.model;

import bangumi.archive.ingest.transformer.CharacterPersonTransformer;
import bangumi.archive.ingest.transformer.RecordTransformer;
import bangumi.archive.ingest.transformer.SubjectTransformer;

import java.sql.Types;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of archive record types.
 *
 * Each constant is a row of the dispatch table used by the loader: destination table,
 * column layout (in bind order, key columns included), JDBC types for null binding,
 * idempotent DDL and the transformer turning a raw JSON line into a {@link StatsRow}.
 * Character and person share one table shape.
 */
public enum RecordType {

    CHARACTER("character", "character_stats",
            List.of("id", "comments", "collects", "data_date"),
            new int[] { Types.INTEGER, Types.INTEGER, Types.INTEGER, Types.DATE },
            List.of("?", "?", "?", "?"),
            new CharacterPersonTransformer()),

    PERSON("person", "person_stats",
            List.of("id", "comments", "collects", "data_date"),
            new int[] { Types.INTEGER, Types.INTEGER, Types.INTEGER, Types.DATE },
            List.of("?", "?", "?", "?"),
            new CharacterPersonTransformer()),

    SUBJECT("subject", "subject_stats",
            List.of("id", "score", "score_details", "rank", "favorite", "data_date"),
            new int[] { Types.INTEGER, Types.NUMERIC, Types.VARCHAR, Types.INTEGER, Types.VARCHAR, Types.DATE },
            List.of("?", "?", "?::jsonb", "?", "?::jsonb", "?"),
            new SubjectTransformer());

    public static final List<String> KEY_COLUMNS = List.of("id", "data_date");

    private final String typeName;
    private final String tableName;
    private final List<String> columns;
    private final int[] sqlTypes;
    private final List<String> placeholders;
    private final RecordTransformer transformer;

    RecordType(String typeName, String tableName, List<String> columns, int[] sqlTypes,
            List<String> placeholders, RecordTransformer transformer) {
        this.typeName = typeName;
        this.tableName = tableName;
        this.columns = columns;
        this.sqlTypes = sqlTypes;
        this.placeholders = placeholders;
        this.transformer = transformer;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getTableName() {
        return tableName;
    }

    public List<String> getColumns() {
        return columns;
    }

    public int getSqlType(int columnIndex) {
        return sqlTypes[columnIndex];
    }

    public List<String> getPlaceholders() {
        return placeholders;
    }

    public RecordTransformer getTransformer() {
        return transformer;
    }

    /**
     * Columns overwritten when the (id, data_date) key already exists.
     */
    public List<String> getUpdateColumns() {
        return columns.stream()
                .filter(column -> !KEY_COLUMNS.contains(column))
                .toList();
    }

    /**
     * Idempotent DDL creating the table, its primary key and indexes.
     */
    public List<String> getSchemaStatements() {
        if (this == SUBJECT) {
            return List.of(
                    """
                    CREATE TABLE IF NOT EXISTS subject_stats (
                        id INTEGER NOT NULL,
                        score NUMERIC(3,1),
                        score_details JSONB,
                        rank INTEGER,
                        favorite JSONB,
                        data_date DATE NOT NULL,
                        PRIMARY KEY (id, data_date)
                    )
                    """,
                    "CREATE INDEX IF NOT EXISTS idx_subject_stats_score ON subject_stats(score DESC)",
                    "CREATE INDEX IF NOT EXISTS idx_subject_stats_rank ON subject_stats(rank ASC)",
                    "CREATE INDEX IF NOT EXISTS idx_subject_stats_score_details ON subject_stats USING GIN(score_details)",
                    "CREATE INDEX IF NOT EXISTS idx_subject_stats_favorite ON subject_stats USING GIN(favorite)");
        }
        return List.of(
                """
                CREATE TABLE IF NOT EXISTS %s (
                    id INTEGER NOT NULL,
                    comments INTEGER DEFAULT 0,
                    collects INTEGER DEFAULT 0,
                    data_date DATE NOT NULL,
                    PRIMARY KEY (id, data_date)
                )
                """.formatted(tableName),
                "CREATE INDEX IF NOT EXISTS idx_%1$s_comments ON %1$s(comments DESC)".formatted(tableName),
                "CREATE INDEX IF NOT EXISTS idx_%1$s_collects ON %1$s(collects DESC)".formatted(tableName));
    }

    /**
     * Look up a record type by its CLI name, ignoring case and surrounding whitespace.
     */
    public static Optional<RecordType> fromTypeName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.typeName.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return typeName;
    }
}
