package im.arun.booklink.pipeline;

import im.arun.booklink.config.BookLinkConfig;
import im.arun.booklink.model.OutputFormat;
import im.arun.booklink.model.TermEntry;
import im.arun.booklink.numbering.ReferenceLabelTable;
import im.arun.booklink.store.SymbolTableRecord;
import im.arun.booklink.util.Diagnostics;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-document state threaded through the passes of one pipeline run.
 * Nothing here is shared between runs.
 */
@Getter
public class ProcessingContext {

    private final String documentName;
    private final BookLinkConfig config;
    private final Diagnostics diagnostics;
    private final ReferenceLabelTable labels = new ReferenceLabelTable();
    private final Map<String, TermEntry> terms = new LinkedHashMap<>();
    private final List<SymbolTableRecord> externalRecords = new ArrayList<>();
    private final Map<String, String> bibliography = new LinkedHashMap<>();

    public ProcessingContext(String documentName, BookLinkConfig config, Diagnostics diagnostics) {
        this.documentName = documentName;
        this.config = config;
        this.diagnostics = diagnostics;
    }

    public OutputFormat getFormat() {
        return config.getFormat();
    }

    public void addExternalRecord(SymbolTableRecord record) {
        externalRecords.add(record);
    }

    public List<SymbolTableRecord> getExternalRecords() {
        return Collections.unmodifiableList(externalRecords);
    }

    public void setBibliography(Map<String, String> entries) {
        bibliography.clear();
        bibliography.putAll(entries);
    }
}
