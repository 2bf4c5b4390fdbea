package im.arun.booklink.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.booklink.util.Diagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Directory of symbol table records, one {@code <document>.refs.json} file per document.
 * Records are written whole (temp file plus move) so a reader never sees a partial record.
 * There is no locking: the build order must guarantee a record is written before a
 * dependent document is processed.
 */
public class SymbolTableStore {
    private static final Logger logger = LoggerFactory.getLogger(SymbolTableStore.class);
    static final String SUFFIX = ".refs.json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public SymbolTableStore(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Path getDirectory() {
        return directory;
    }

    public Path recordPath(String documentName) {
        return directory.resolve(documentName + SUFFIX);
    }

    public void write(SymbolTableRecord record) throws IOException {
        if (record.getDocument() == null || record.getDocument().isBlank()) {
            throw new IllegalArgumentException("Symbol table record has no document name");
        }
        Files.createDirectories(directory);
        Path target = recordPath(record.getDocument());
        Path temp = Files.createTempFile(directory, record.getDocument(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), record);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.info("Exported {} labels, {} targets and {} terms to {}",
            record.getReferenceLabels().size(), record.getTargets().size(), record.getTerms().size(), target);
    }

    /**
     * Reads the record of another document. A missing, unreadable or incompatible
     * record is reported and yields an empty result.
     */
    public Optional<SymbolTableRecord> read(String documentName, Diagnostics diagnostics) {
        Path path = recordPath(documentName);
        if (!Files.exists(path)) {
            diagnostics.warn(Diagnostics.SYMBOL_STORE, "No symbol table record for '%s' at %s", documentName, path);
            return Optional.empty();
        }
        try {
            SymbolTableRecord record = objectMapper.readValue(path.toFile(), SymbolTableRecord.class);
            if (record.getVersion() != SymbolTableRecord.CURRENT_VERSION) {
                diagnostics.warn(Diagnostics.SYMBOL_STORE, "Record %s has version %d, expected %d; ignoring it",
                    path, record.getVersion(), SymbolTableRecord.CURRENT_VERSION);
                return Optional.empty();
            }
            if (record.getDocument() == null) {
                record.setDocument(documentName);
            }
            return Optional.of(record);
        } catch (IOException e) {
            diagnostics.warn(Diagnostics.SYMBOL_STORE, "Cannot read record %s: %s", path, e.getMessage());
            return Optional.empty();
        }
    }
}
