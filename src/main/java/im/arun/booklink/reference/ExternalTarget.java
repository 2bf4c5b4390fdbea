package im.arun.booklink.reference;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Where an identifier declared by another document lives, and its label if numbered.
 */
@Data
@AllArgsConstructor
public class ExternalTarget {
    private String uri;
    private String label;

    public String href(String id) {
        return uri + "#" + id;
    }
}
