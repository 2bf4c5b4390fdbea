package im.arun.booklink.numbering;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Anchor identifier to rendered label, e.g. {@code "fig-tree" -> "3.2"}.
 * Filled by the numbering pass and sealed when it completes.
 */
public class ReferenceLabelTable {

    private final Map<String, String> labels = new LinkedHashMap<>();
    private boolean sealed;

    public void put(String id, String label) {
        if (sealed) {
            throw new IllegalStateException("Reference labels are sealed; cannot add '" + id + "'");
        }
        labels.put(id, label);
    }

    public String get(String id) {
        return id == null ? null : labels.get(id);
    }

    public boolean contains(String id) {
        return id != null && labels.containsKey(id);
    }

    public int size() {
        return labels.size();
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(labels);
    }
}
