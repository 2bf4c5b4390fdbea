package im.arun.booklink.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The closed set of node kinds a document tree may contain.
 * Kinds the passes do not care about are carried through untouched.
 */
public enum NodeKind {
    DOCUMENT,
    SECTION,
    TITLE,
    PARAGRAPH,
    TEXT,
    EMPHASIS,
    FIGURE,
    TABLE,
    CAPTION,
    TARGET,
    REFERENCE,
    CITATION_REFERENCE,
    INDEX_TERM,
    INDEX,
    EXAMPLE,
    DOCTEST_BLOCK,
    LITERAL,
    LITERAL_BLOCK,
    SECTION_CONTEXT,
    CONTENTS,
    BULLET_LIST,
    LIST_ITEM,
    RAW,
    GENERATED,
    OTHER;

    /**
     * Name used in the serialized tree, e.g. {@code citation-reference}.
     */
    @JsonValue
    public String getTag() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    @JsonCreator
    public static NodeKind fromTag(String tag) {
        if (tag == null) {
            return OTHER;
        }
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }

    /**
     * Leaf kinds whose content lives in {@link Node#getText()}.
     */
    public boolean isTextual() {
        return this == TEXT || this == LITERAL || this == LITERAL_BLOCK
            || this == DOCTEST_BLOCK || this == RAW || this == GENERATED;
    }
}
