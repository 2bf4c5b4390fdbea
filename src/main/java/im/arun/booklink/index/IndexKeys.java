package im.arun.booklink.index;

import java.util.Locale;
import java.util.Set;

/**
 * Index keys: lowercase term text with runs of non-word characters collapsed to
 * {@code _}, made unique by a numeric suffix ({@code foo}, {@code foo_2}, ...).
 */
public final class IndexKeys {

    private IndexKeys() {}

    public static String normalize(String text) {
        String key = text.toLowerCase(Locale.ROOT).replaceAll("\\W+", "_");
        key = key.replaceAll("^_+|_+$", "");
        return key.isEmpty() ? "term" : key;
    }

    /**
     * Returns {@code key} or the first free suffixed variant, and claims it in {@code used}.
     */
    public static String disambiguate(String key, Set<String> used) {
        String candidate = key;
        int suffix = 2;
        while (used.contains(candidate)) {
            candidate = key + "_" + suffix++;
        }
        used.add(candidate);
        return candidate;
    }
}
