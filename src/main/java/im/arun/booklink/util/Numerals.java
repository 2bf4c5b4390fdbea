package im.arun.booklink.util;

import java.util.Locale;

/**
 * Counter alphabets used by section and example labels.
 */
public final class Numerals {

    private static final int[] ROMAN_VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] ROMAN_SYMBOLS = {"M", "CM", "D", "CD", "C", "XC", "L", "XL", "X", "IX", "V", "IV", "I"};

    private Numerals() {}

    public static String arabic(int value) {
        return Integer.toString(value);
    }

    /**
     * Uppercase roman numeral; values below 1 fall back to arabic.
     */
    public static String upperRoman(int value) {
        if (value < 1) {
            return arabic(value);
        }
        StringBuilder sb = new StringBuilder();
        int remaining = value;
        for (int i = 0; i < ROMAN_VALUES.length; i++) {
            while (remaining >= ROMAN_VALUES[i]) {
                sb.append(ROMAN_SYMBOLS[i]);
                remaining -= ROMAN_VALUES[i];
            }
        }
        return sb.toString();
    }

    public static String lowerRoman(int value) {
        return upperRoman(value).toLowerCase(Locale.ROOT);
    }

    /**
     * Bijective base-26 letters: 1 is "A", 26 is "Z", 27 is "AA".
     */
    public static String upperLetter(int value) {
        if (value < 1) {
            return arabic(value);
        }
        StringBuilder sb = new StringBuilder();
        int remaining = value;
        while (remaining > 0) {
            remaining--;
            sb.insert(0, (char) ('A' + remaining % 26));
            remaining /= 26;
        }
        return sb.toString();
    }

    public static String lowerLetter(int value) {
        return upperLetter(value).toLowerCase(Locale.ROOT);
    }
}
