package im.arun.booklink.colorize;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits interpreter input into tagged spans.
 * <p>
 * At every position the rules are tried in order and the first one that matches wins:
 * string, comment, keyword, builtin, primary prompt, continuation prompt. A character no
 * rule claims is "other"; runs of such characters are emitted as a single
 * {@link SpanTag#PLAIN} span.
 */
public class SourceLexer {

    static final Pattern STRING = Pattern.compile(
        "\"\"\"(?:\"\"\"|.*?[^\"]\"\"\"|.*\\z)"
            + "|'''(?:'''|.*?[^\\\\']'''|.*\\z)"
            + "|\"(?:\"|[^\\n]*?[^\\\\\\n\"]\"|[^\\n]*)"
            + "|'(?:'|[^\\n]*?[^\\\\\\n']'|[^\\n]*)",
        Pattern.DOTALL);
    static final Pattern COMMENT = Pattern.compile("#[^\\n]*");
    static final Pattern PROMPT = Pattern.compile("^[ \\t]*>>>(?:[ \\t]|$)", Pattern.MULTILINE);
    static final Pattern CONTINUATION = Pattern.compile("^[ \\t]*\\.\\.\\.(?:[ \\t]|$)", Pattern.MULTILINE);

    private final List<LexRule> rules;

    public SourceLexer(PythonVocabulary vocabulary) {
        this.rules = List.of(
            new LexRule(SpanTag.STRING, STRING),
            new LexRule(SpanTag.COMMENT, COMMENT),
            new LexRule(SpanTag.KEYWORD, wordAlternation(vocabulary.getKeywords())),
            new LexRule(SpanTag.BUILTIN, wordAlternation(vocabulary.getBuiltins())),
            new LexRule(SpanTag.PROMPT, PROMPT),
            new LexRule(SpanTag.CONTINUATION, CONTINUATION));
    }

    public List<LexRule> getRules() {
        return rules;
    }

    public List<Span> tokenize(String source) {
        List<Span> spans = new ArrayList<>();
        StringBuilder other = new StringBuilder();
        List<Matcher> matchers = new ArrayList<>(rules.size());
        for (LexRule rule : rules) {
            matchers.add(rule.getPattern().matcher(source)
                .useTransparentBounds(true)
                .useAnchoringBounds(false));
        }

        int position = 0;
        while (position < source.length()) {
            int end = -1;
            SpanTag tag = null;
            for (int i = 0; i < rules.size(); i++) {
                Matcher matcher = matchers.get(i);
                matcher.region(position, source.length());
                if (matcher.lookingAt() && matcher.end() > position) {
                    end = matcher.end();
                    tag = rules.get(i).getTag();
                    break;
                }
            }

            if (tag == null) {
                other.append(source.charAt(position));
                position++;
                continue;
            }

            flushOther(other, spans);
            String text = source.substring(position, end);
            if (tag == SpanTag.STRING && text.indexOf('\n') >= 0) {
                splitMultilineString(text, spans);
            } else {
                spans.add(new Span(text, tag));
            }
            position = end;
        }
        flushOther(other, spans);
        return spans;
    }

    /**
     * A string spanning lines keeps the continuation prompts that start its inner lines;
     * those are tagged as prompts, the pieces between them as string.
     */
    static void splitMultilineString(String text, List<Span> spans) {
        Matcher matcher = CONTINUATION.matcher(text);
        int start = 0;
        while (matcher.find()) {
            if (matcher.start() > start) {
                spans.add(new Span(text.substring(start, matcher.start()), SpanTag.STRING));
            }
            if (matcher.end() > matcher.start()) {
                spans.add(new Span(matcher.group(), SpanTag.CONTINUATION));
            }
            start = matcher.end();
        }
        if (start < text.length()) {
            spans.add(new Span(text.substring(start), SpanTag.STRING));
        }
    }

    private static void flushOther(StringBuilder other, List<Span> spans) {
        if (other.length() > 0) {
            spans.add(new Span(other.toString(), SpanTag.PLAIN));
            other.setLength(0);
        }
    }

    private static Pattern wordAlternation(Collection<String> words) {
        if (words.isEmpty()) {
            return Pattern.compile("(?!)");
        }
        String alternation = words.stream()
            .sorted((a, b) -> b.length() - a.length())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternation + ")\\b");
    }
}
