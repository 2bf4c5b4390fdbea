package im.arun.booklink.post;

import im.arun.booklink.model.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prefixes section headings of a rendered chapter with its chapter number.
 * <p>
 * A chapter file whose title reads {@code "N. Title"} gets {@code N.} in front of every
 * heading. LaTeX output additionally defines {@code \chnum} and {@code \chtitle}
 * before {@code \begin{document}}.
 */
public class ChapterNumberer {
    private static final Logger logger = LoggerFactory.getLogger(ChapterNumberer.class);

    static final Pattern LATEX_TITLE = Pattern.compile("pdftitle=\\{(\\d+)\\. ([^}]+)}");
    static final Pattern LATEX_BOOKMARK = Pattern.compile("(pdfbookmark\\[\\d+]\\{)");
    static final Pattern LATEX_SECTION = Pattern.compile("(section\\*\\{)");
    static final Pattern LATEX_BEGIN = Pattern.compile("(\\\\begin\\{document})");
    static final Pattern HTML_TITLE = Pattern.compile("<h1 class=\"title\">(\\d+)\\.");
    static final Pattern HTML_HEADING = Pattern.compile("(<h\\d><a[^>]*>)");

    public String apply(String rendered, OutputFormat format) {
        return format == OutputFormat.LATEX ? applyLatex(rendered) : applyHtml(rendered);
    }

    String applyLatex(String text) {
        Matcher title = LATEX_TITLE.matcher(text);
        if (!title.find()) {
            return text;
        }
        String number = title.group(1);
        String chapterTitle = title.group(2);
        String result = prefix(LATEX_BOOKMARK, text, number);
        result = prefix(LATEX_SECTION, result, number);
        String definitions = "\\def\\chnum{" + number + "}\n\\def\\chtitle{" + chapterTitle + "}\n";
        result = LATEX_BEGIN.matcher(result).replaceAll(Matcher.quoteReplacement(definitions) + "$1");
        logger.debug("Applied chapter number {} to LaTeX output", number);
        return result;
    }

    String applyHtml(String text) {
        Matcher title = HTML_TITLE.matcher(text);
        if (!title.find()) {
            return text;
        }
        String number = title.group(1);
        logger.debug("Applied chapter number {} to HTML output", number);
        return prefix(HTML_HEADING, text, number);
    }

    /**
     * Rewrites {@code file} in place; the format is taken from its extension.
     *
     * @return whether the file was changed
     */
    public boolean applyTo(Path file) throws IOException {
        String name = file.getFileName().toString();
        OutputFormat format = name.endsWith(OutputFormat.LATEX.getExtension()) ? OutputFormat.LATEX : OutputFormat.HTML;
        String original = Files.readString(file, StandardCharsets.UTF_8);
        String updated = apply(original, format);
        if (updated.equals(original)) {
            return false;
        }
        Files.writeString(file, updated, StandardCharsets.UTF_8);
        logger.info("Added chapter numbers to {}", file);
        return true;
    }

    private static String prefix(Pattern pattern, String text, String number) {
        return pattern.matcher(text).replaceAll("$1" + Matcher.quoteReplacement(number + "."));
    }
}
