package com.hierarchy.federation.ingest;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot adapter over a JSON document.
 *
 * <p>Accepts either a JSON array of objects:</p>
 * <pre>
 * [
 *   {"agentId": "A001", "name": "Sarah Johnson", "level": 1},
 *   {"agentId": "A002", "name": "Chris Brown", "level": 3, "parentId": "A001"}
 * ]
 * </pre>
 *
 * <p>or JSON Lines, one object per line:</p>
 * <pre>
 * {"id": "mar001", "name": "Sarah Johnson", "role": "Marketing Director"}
 * {"id": "mar002", "name": "Michelle Rodriguez", "role": "Marketing Manager", "reportsTo": "mar001"}
 * </pre>
 *
 * <p>Blank lines are ignored. A line that is not exactly one JSON value, or
 * content after the closing bracket of an array, fails the whole snapshot, since a partial snapshot cannot be told apart from a shrunken source.</p>
 */
public class JsonSnapshotSource implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(JsonSnapshotSource.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final ReaderOpener opener;
    private final String description;

    public JsonSnapshotSource(Path path) {
        Objects.requireNonNull(path, "path");
        this.opener = () -> Files.newBufferedReader(path, StandardCharsets.UTF_8);
        this.description = path.toString();
    }

    private JsonSnapshotSource(ReaderOpener opener, String description) {
        this.opener = opener;
        this.description = description;
    }

    /**
     * Creates a source over in-memory JSON content.
     */
    public static JsonSnapshotSource ofString(String content) {
        Objects.requireNonNull(content, "content");
        return new JsonSnapshotSource(() -> new StringReader(content), "inline");
    }

    @Override
    public List<JsonNode> pullSnapshot(String sourceSystem) throws IOException {
        try (BufferedReader reader = new BufferedReader(opener.open())) {
            String content = readAll(reader);
            String trimmed = content.trim();
            List<JsonNode> records = trimmed.startsWith("[") ? readArray(trimmed) : readLines(content);
            log.debug("snapshot.read source={} location={} records={}", sourceSystem, description, records.size());
            return records;
        }
    }

    private static List<JsonNode> readArray(String content) throws IOException {
        JsonNode root = MAPPER.readTree(content);
        List<JsonNode> records = new ArrayList<>(root.size());
        for (JsonNode element : root) {
            records.add(element);
        }
        return records;
    }

    private static List<JsonNode> readLines(String content) throws IOException {
        List<JsonNode> records = new ArrayList<>();
        long lineNumber = 0;
        for (String line : content.split("\\R")) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                records.add(MAPPER.readTree(trimmed));
            } catch (IOException e) {
                throw new IOException("Invalid JSON on line " + lineNumber + ": " + e.getMessage(), e);
            }
        }
        return records;
    }

    private static String readAll(Reader reader) throws IOException {
        StringBuilder sb = new StringBuilder();
        char[] buffer = new char[8192];
        int read;
        while ((read = reader.read(buffer)) != -1) {
            sb.append(buffer, 0, read);
        }
        return sb.toString();
    }

    @FunctionalInterface
    private interface ReaderOpener {
        Reader open() throws IOException;
    }

    @Override
    public String toString() {
        return "JsonSnapshotSource{" + description + '}';
    }
}
