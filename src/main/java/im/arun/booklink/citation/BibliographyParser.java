package im.arun.booklink.citation;

import im.arun.booklink.util.Diagnostics;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads author and year out of a BibTeX-style file, one line at a time.
 * This is pattern matching, not a BibTeX grammar: only {@code @type{key,},
 * {@code author = ...,} and {@code year = ...,} lines are recognized and
 * everything else is skipped.
 */
public class BibliographyParser {
    private static final Logger logger = LoggerFactory.getLogger(BibliographyParser.class);

    private static final Pattern ENTRY = Pattern.compile("^\\s*@\\s*(\\w+)\\s*[{(]\\s*([^,\\s]+)\\s*,");
    private static final Pattern FIELD = Pattern.compile("(?i)^\\s*(author|year)\\s*=\\s*(.*?)\\s*$");
    private static final Pattern AND = Pattern.compile("(?i)\\s+and\\s+");

    static final String MISSING = "None";

    public Map<String, String> parse(Path file, Diagnostics diagnostics) throws IOException {
        Map<String, String> result = parse(Files.readAllLines(file, StandardCharsets.UTF_8), diagnostics);
        logger.info("Loaded {} bibliography entries from {}", result.size(), file);
        return result;
    }

    /**
     * Maps lowercase citation keys to {@code [Author, Year]} strings.
     */
    public Map<String, String> parse(List<String> lines, Diagnostics diagnostics) {
        Map<String, String> citations = new LinkedHashMap<>();
        String key = null;
        String author = null;
        String year = null;

        for (String line : lines) {
            Matcher entry = ENTRY.matcher(line);
            if (entry.find()) {
                if (key != null) {
                    citations.put(key, format(key, author, year, diagnostics));
                }
                key = entry.group(2).toLowerCase(Locale.ROOT);
                author = null;
                year = null;
                continue;
            }
            if (key == null) {
                continue;
            }
            Matcher field = FIELD.matcher(line);
            if (field.matches()) {
                String value = cleanValue(field.group(2));
                if ("author".equalsIgnoreCase(field.group(1))) {
                    author = value;
                } else {
                    year = value;
                }
            }
        }
        if (key != null) {
            citations.put(key, format(key, author, year, diagnostics));
        }
        return citations;
    }

    private String format(String key, String author, String year, Diagnostics diagnostics) {
        String authors = author == null || author.isEmpty() ? null : formatAuthors(author);
        String cleanYear = year == null || year.isEmpty() ? null : year;
        if (authors == null || cleanYear == null) {
            diagnostics.warn(Diagnostics.BIBLIOGRAPHY, "Bibliography entry '%s' is missing %s",
                key, authors == null ? (cleanYear == null ? "author and year" : "author") : "year");
        }
        return "[" + (authors == null ? MISSING : authors) + ", " + (cleanYear == null ? MISSING : cleanYear) + "]";
    }

    /**
     * Last names only: {@code A}, {@code A & B}, {@code A, B, & C}, {@code A et al}.
     */
    static String formatAuthors(String author) {
        List<String> names = new ArrayList<>();
        for (String person : AND.split(author)) {
            String last = lastName(person);
            if (!last.isEmpty()) {
                names.add(last);
            }
        }
        switch (names.size()) {
            case 0:
                return null;
            case 1:
                return names.get(0);
            case 2:
                return names.get(0) + " & " + names.get(1);
            case 3:
                return names.get(0) + ", " + names.get(1) + ", & " + names.get(2);
            default:
                return names.get(0) + " et al";
        }
    }

    static String lastName(String person) {
        String name = StringUtils.strip(person.trim(), "{}\"");
        int comma = name.indexOf(',');
        if (comma >= 0) {
            return StringUtils.strip(name.substring(0, comma).trim(), "{}\"");
        }
        String[] tokens = name.split("\\s+");
        return StringUtils.strip(tokens[tokens.length - 1], "{}\"");
    }

    /**
     * Drops the trailing comma and any wrapping braces or quotes.
     */
    static String cleanValue(String raw) {
        String value = StringUtils.stripEnd(raw.trim(), ",").trim();
        String previous;
        do {
            previous = value;
            value = StringUtils.strip(value, "{}\"").trim();
        } while (!value.equals(previous));
        return value;
    }
}
