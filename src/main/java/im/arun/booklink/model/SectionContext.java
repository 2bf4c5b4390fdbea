package im.arun.booklink.model;

import java.util.Locale;

/**
 * Numbering regime of top-level sections.
 */
public enum SectionContext {
    BODY,
    PREFACE,
    APPENDIX;

    /**
     * Parses the value of a {@code section-context} marker; null when unknown.
     */
    public static SectionContext parse(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "body":
            case "main":
                return BODY;
            case "preface":
            case "frontmatter":
                return PREFACE;
            case "appendix":
            case "appendices":
                return APPENDIX;
            default:
                return null;
        }
    }
}
