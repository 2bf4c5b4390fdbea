package im.arun.booklink.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import im.arun.booklink.model.TermEntry;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Persisted symbol table of one document: reference labels, declared anchor
 * identifiers and collected index terms.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"version", "document", "reference_labels", "targets", "terms"})
public class SymbolTableRecord {

    public static final int CURRENT_VERSION = 1;

    @JsonProperty("version")
    private int version = CURRENT_VERSION;

    @JsonProperty("document")
    private String document;

    @JsonProperty("reference_labels")
    private Map<String, String> referenceLabels = new LinkedHashMap<>();

    @JsonProperty("targets")
    private Set<String> targets = new TreeSet<>();

    @JsonProperty("terms")
    private Map<String, TermEntry> terms = new LinkedHashMap<>();

    public SymbolTableRecord(String document) {
        this.document = document;
    }
}
