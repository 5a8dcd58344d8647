package bangumi.archive.ingest.stream;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * One non-blank line of a JSON lines file: either the decoded tree or the parse error.
 */
@Value
public class JsonLine {

    /** 1-based physical line number in the file */
    long lineNumber;

    /** Decoded value, null when the line is not valid JSON */
    JsonNode node;

    /** Parser message when the line is not valid JSON */
    String error;

    public static JsonLine parsed(long lineNumber, JsonNode node) {
        return new JsonLine(lineNumber, node, null);
    }

    public static JsonLine malformed(long lineNumber, String error) {
        return new JsonLine(lineNumber, null, error);
    }

    public boolean isMalformed() {
        return node == null;
    }
}
