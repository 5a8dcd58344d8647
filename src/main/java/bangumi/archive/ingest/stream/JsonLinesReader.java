package bangumi.archive.ingest.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Single-pass iterator over a UTF-8 JSON lines file.
 *
 * Lines are read and decoded lazily, one per {@link #next()} call. Blank lines are
 * skipped. A line that is not valid UTF-8, or not exactly one JSON value, is returned as
 * a malformed {@link JsonLine} rather than ending the iteration. The underlying file is
 * closed as soon as the last line has been read, or on {@link #close()}, whichever comes
 * first. The iterator cannot be restarted.
 */
@Slf4j
public class JsonLinesReader implements Iterator<JsonLine>, Closeable {

    private final ObjectReader jsonReader;
    private final InputStream in;

    // Strict decoder, applied per line so an invalid byte only spoils its own line
    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder();
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream(256);

    private JsonLine pending;
    private long lineNumber;
    private boolean closed;

    private JsonLinesReader(InputStream in, ObjectMapper objectMapper) {
        this.in = in;
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Open a file for reading.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     */
    public static JsonLinesReader open(Path path, ObjectMapper objectMapper) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(path));
        return new JsonLinesReader(in, objectMapper);
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (closed) {
            return false;
        }
        pending = readNext();
        return pending != null;
    }

    @Override
    public JsonLine next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more lines");
        }
        JsonLine line = pending;
        pending = null;
        return line;
    }

    /**
     * Number of physical lines consumed so far, blank lines included.
     */
    public long getLinesConsumed() {
        return lineNumber;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            in.close();
        }
    }

    private JsonLine readNext() {
        try {
            byte[] raw;
            while ((raw = readRawLine()) != null) {
                lineNumber++;

                String text;
                try {
                    text = decoder.decode(ByteBuffer.wrap(raw)).toString();
                } catch (CharacterCodingException e) {
                    log.debug("Line {} is not valid UTF-8: {}", lineNumber, e.toString());
                    return JsonLine.malformed(lineNumber, "Invalid UTF-8: " + e);
                }

                String trimmed = text.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                return decode(trimmed);
            }
            close();
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading line " + (lineNumber + 1), e);
        }
    }

    /**
     * Bytes of the next line without its terminator ("\n" or "\r\n"); null at end of file.
     */
    private byte[] readRawLine() throws IOException {
        lineBuffer.reset();
        boolean sawAny = false;
        int b;
        while ((b = in.read()) != -1) {
            sawAny = true;
            if (b == '\n') {
                break;
            }
            lineBuffer.write(b);
        }
        if (!sawAny) {
            return null;
        }
        byte[] bytes = lineBuffer.toByteArray();
        if (bytes.length > 0 && bytes[bytes.length - 1] == '\r') {
            return Arrays.copyOf(bytes, bytes.length - 1);
        }
        return bytes;
    }

    private JsonLine decode(String text) {
        try {
            JsonNode node = jsonReader.readTree(text);
            return JsonLine.parsed(lineNumber, node);
        } catch (JsonProcessingException e) {
            log.debug("Line {} is not valid JSON: {}", lineNumber, e.getOriginalMessage());
            return JsonLine.malformed(lineNumber, e.getOriginalMessage());
        }
    }
}
