package im.arun.booklink.colorize;

/**
 * Lexical category of a colorized span. The markup name is what renderers put in
 * CSS classes ({@code pysrc-keyword}) and LaTeX macros ({@code \pysrckeyword}).
 */
public enum SpanTag {
    PROMPT("prompt"),
    CONTINUATION("more"),
    KEYWORD("keyword"),
    BUILTIN("builtin"),
    STRING("string"),
    COMMENT("comment"),
    EXCEPTION("except"),
    OUTPUT("output"),
    PLAIN("other");

    private final String markupName;

    SpanTag(String markupName) {
        this.markupName = markupName;
    }

    public String getMarkupName() {
        return markupName;
    }
}
