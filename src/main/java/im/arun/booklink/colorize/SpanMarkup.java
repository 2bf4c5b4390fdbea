package im.arun.booklink.colorize;

/**
 * Turns one span into output markup, e.g. an HTML {@code <span>} or a LaTeX macro call.
 */
@FunctionalInterface
public interface SpanMarkup {
    String markup(String text, SpanTag tag);
}
