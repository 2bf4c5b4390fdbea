package im.arun.booklink.numbering;

import im.arun.booklink.model.SectionContext;
import im.arun.booklink.util.Numerals;

import java.util.List;

/**
 * Renders counter values as the labels readers see.
 */
public final class LabelFormatter {

    private LabelFormatter() {}

    /**
     * Top-level counter in the alphabet of the section context:
     * arabic in the body, uppercase roman in a preface, uppercase letters in appendices.
     */
    public static String topLevel(int value, SectionContext context) {
        switch (context) {
            case PREFACE:
                return Numerals.upperRoman(value);
            case APPENDIX:
                return Numerals.upperLetter(value);
            case BODY:
            default:
                return Numerals.arabic(value);
        }
    }

    /**
     * Dot-joined section counters, e.g. {@code 3.2} or {@code B.1}.
     */
    public static String section(List<Integer> values, SectionContext context) {
        StringBuilder sb = new StringBuilder(topLevel(values.get(0), context));
        for (int i = 1; i < values.size(); i++) {
            sb.append('.').append(values.get(i));
        }
        return sb.toString();
    }

    /**
     * Figure or table label, {@code <top-level>.<n>}.
     */
    public static String floating(int topValue, int number, SectionContext context) {
        return topLevel(topValue, context) + "." + number;
    }

    /**
     * Example label such as {@code (1)}, {@code (1a)} or {@code (1a.ii.3)}:
     * depth 0 arabic, depth 1 lowercase letters appended directly,
     * depth 2 lowercase roman and deeper levels arabic, dot separated.
     */
    public static String example(List<Integer> values) {
        StringBuilder sb = new StringBuilder("(");
        for (int depth = 0; depth < values.size(); depth++) {
            int value = values.get(depth);
            switch (depth) {
                case 0:
                    sb.append(Numerals.arabic(value));
                    break;
                case 1:
                    sb.append(Numerals.lowerLetter(value));
                    break;
                case 2:
                    sb.append('.').append(Numerals.lowerRoman(value));
                    break;
                default:
                    sb.append('.').append(Numerals.arabic(value));
                    break;
            }
        }
        return sb.append(')').toString();
    }
}
