package dev.animetracker.parser;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Show title helpers shared by feed search and show matching.
 */
public final class TitleNormalizer {

    // Release feeds name sequels "S2"; catalogs say "2nd Season", "Season 2", "Part 2", ...
    private static final List<Pattern> SEASON_SUFFIXES = List.of(
            Pattern.compile("\\s+(?:2nd|3rd|[4-9]th)\\s+Season\\s*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+Season\\s+\\d+\\s*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+S\\d+\\s*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+Part\\s+\\d+\\s*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+(?:II|III|IV|V|VI|VII|VIII|IX|X)\\s*$"),
            Pattern.compile("\\s+Cour\\s+\\d+\\s*$", Pattern.CASE_INSENSITIVE));

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TitleNormalizer() {
    }

    /**
     * Strip season suffixes so a catalog title matches how release feeds name the show.
     * "Sousou no Frieren 2nd Season" becomes "Sousou no Frieren".
     */
    public static String normalizeForSearch(String title) {
        if (title == null) {
            return "";
        }
        String result = title.trim();
        for (Pattern suffix : SEASON_SUFFIXES) {
            result = suffix.matcher(result).replaceAll("");
        }
        return result.trim();
    }

    /**
     * Lower-cased title with punctuation collapsed to single spaces, for equality checks.
     */
    public static String comparisonKey(String title) {
        if (title == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(title.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}
