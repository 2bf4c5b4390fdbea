package im.arun.booklink.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects authoring anomalies reported while processing one document.
 * Every entry is also logged through SLF4J; the collected entries can be written
 * out as a JSON report next to the build output.
 */
public class Diagnostics {
    private static final Logger systemLogger = LoggerFactory.getLogger(Diagnostics.class);

    public static final String SECTION_DEPTH = "section-depth";
    public static final String SECTION_CONTEXT = "section-context";
    public static final String MIXED_OUTPUT = "mixed-output";
    public static final String BIBLIOGRAPHY = "bibliography";
    public static final String DOCTEST_IGNORE = "doctest-ignore";
    public static final String SYMBOL_STORE = "symbol-store";
    public static final String UNRESOLVED = "unresolved";

    private final String documentName;
    private final List<Map<String, Object>> entries = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public Diagnostics() {
        this("document");
    }

    public Diagnostics(String documentName) {
        this.documentName = documentName == null ? "Untitled" : documentName;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void warn(String category, String message, Object... args) {
        String formatted = String.format(message, args);
        systemLogger.warn("[{}] {}: {}", documentName, category, formatted);
        record("WARNING", category, formatted);
    }

    public void info(String category, String message, Object... args) {
        String formatted = String.format(message, args);
        systemLogger.debug("[{}] {}: {}", documentName, category, formatted);
        record("INFO", category, formatted);
    }

    private void record(String level, String category, String message) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("document", documentName);
        entry.put("level", level);
        entry.put("category", category);
        entry.put("message", message);
        entries.add(entry);
    }

    public List<Map<String, Object>> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public long count(String category) {
        return entries.stream().filter(e -> category.equals(e.get("category"))).count();
    }

    public long warningCount() {
        return entries.stream().filter(e -> "WARNING".equals(e.get("level"))).count();
    }

    public String getDocumentName() {
        return documentName;
    }

    /**
     * Writes all collected entries to {@code path} as a JSON array.
     */
    public void writeTo(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        objectMapper.writeValue(path.toFile(), entries);
        systemLogger.info("Wrote {} diagnostics to {}", entries.size(), path);
    }
}
