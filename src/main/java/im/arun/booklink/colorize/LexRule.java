package im.arun.booklink.colorize;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * One classifier of the lexer: text matching {@code pattern} at the current position gets {@code tag}.
 */
@Getter
@AllArgsConstructor
public class LexRule {
    private final SpanTag tag;
    private final Pattern pattern;
}
