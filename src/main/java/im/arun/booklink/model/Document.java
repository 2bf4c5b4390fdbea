package im.arun.booklink.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A parsed source file: its base name (used to key the symbol table record and
 * build link URIs) and the root of its tree.
 */
@Data
@AllArgsConstructor
public class Document {
    private String name;
    private Node root;
}
