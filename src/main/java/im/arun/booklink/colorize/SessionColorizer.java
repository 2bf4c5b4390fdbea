package im.arun.booklink.colorize;

import im.arun.booklink.util.Diagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Colorizes interactive interpreter sessions.
 * <p>
 * In block mode the text is read line by line. A line starting with the primary prompt
 * opens (or continues) a source run; a continuation-prompt line continues an open source
 * run; any other line belongs to the output run. Each source run is tokenized by the
 * {@link SourceLexer}. Each output run becomes one {@code output} span, or, when it holds
 * a traceback, an {@code except} span from the {@code Traceback} line onward.
 * <p>
 * In inline mode the whole text is tokenized as source.
 */
public class SessionColorizer {
    private static final Logger logger = LoggerFactory.getLogger(SessionColorizer.class);

    static final Pattern EXCEPTION = Pattern.compile("(.*)(^Traceback \\(most recent call last\\):.*)",
        Pattern.DOTALL | Pattern.MULTILINE);
    static final Pattern DOCTEST_DIRECTIVE = Pattern.compile("#\\s*doctest:.*");

    private final SourceLexer lexer;
    private final Diagnostics diagnostics;

    public SessionColorizer() {
        this(new PythonVocabulary(), null);
    }

    /**
     * @param diagnostics where mixed output/traceback blocks are reported; may be null
     */
    public SessionColorizer(PythonVocabulary vocabulary, Diagnostics diagnostics) {
        this.lexer = new SourceLexer(vocabulary);
        this.diagnostics = diagnostics;
    }

    /**
     * Colorizes {@code text}, passing every span through {@code markup}.
     * Segments (source runs, output, tracebacks) are joined by newlines.
     */
    public String colorize(String text, SpanMarkup markup, boolean inline, boolean stripDirectives) {
        return segments(text, inline, stripDirectives).stream()
            .map(segment -> segment.stream()
                .map(span -> markup.markup(span.getText(), span.getTag()))
                .collect(Collectors.joining()))
            .collect(Collectors.joining("\n"));
    }

    public String colorize(String text, SpanMarkup markup) {
        return colorize(text, markup, false, true);
    }

    /**
     * All spans in order, without segment boundaries.
     */
    public List<Span> spans(String text, boolean inline, boolean stripDirectives) {
        List<Span> result = new ArrayList<>();
        segments(text, inline, stripDirectives).forEach(result::addAll);
        return result;
    }

    public List<Span> spans(String text) {
        return spans(text, false, true);
    }

    List<List<Span>> segments(String text, boolean inline, boolean stripDirectives) {
        String session = text == null ? "" : text;
        if (stripDirectives) {
            session = DOCTEST_DIRECTIVE.matcher(session).replaceAll("");
        }

        List<List<Span>> segments = new ArrayList<>();
        if (inline) {
            String source = session.strip();
            if (!source.isEmpty()) {
                segments.add(lexer.tokenize(source));
            }
            return segments;
        }

        List<String> source = new ArrayList<>();
        List<String> output = new ArrayList<>();
        for (String line : session.split("\n", -1)) {
            boolean isSource = SourceLexer.PROMPT.matcher(line).lookingAt()
                || (!source.isEmpty() && SourceLexer.CONTINUATION.matcher(line).lookingAt());
            if (isSource) {
                flushOutput(output, segments);
                source.add(line);
            } else {
                flushSource(source, segments);
                output.add(line);
            }
        }
        flushSource(source, segments);
        flushOutput(output, segments);
        return segments;
    }

    private void flushSource(List<String> lines, List<List<Span>> segments) {
        if (lines.isEmpty()) {
            return;
        }
        String run = String.join("\n", lines).strip();
        lines.clear();
        if (!run.isEmpty()) {
            segments.add(lexer.tokenize(run));
        }
    }

    private void flushOutput(List<String> lines, List<List<Span>> segments) {
        if (lines.isEmpty()) {
            return;
        }
        String run = String.join("\n", lines).strip();
        lines.clear();
        if (run.isEmpty()) {
            return;
        }

        Matcher matcher = EXCEPTION.matcher(run);
        if (!matcher.matches()) {
            segments.add(List.of(new Span(run, SpanTag.OUTPUT)));
            return;
        }
        String before = matcher.group(1).strip();
        String traceback = matcher.group(2).strip();
        if (!before.isEmpty()) {
            reportMixedOutput(before);
            segments.add(List.of(new Span(before, SpanTag.OUTPUT)));
        }
        segments.add(List.of(new Span(traceback, SpanTag.EXCEPTION)));
    }

    private void reportMixedOutput(String before) {
        String firstLine = before.lines().findFirst().orElse("");
        if (diagnostics != null) {
            diagnostics.warn(Diagnostics.MIXED_OUTPUT,
                "Session block mixes output and a traceback (output starts with '%s')", firstLine);
        } else {
            logger.warn("Session block mixes output and a traceback (output starts with '{}')", firstLine);
        }
    }
}
