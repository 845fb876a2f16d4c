package dcc.quoteme.lambda.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes quote and author text so that cosmetic differences (case, spacing, typographic
 * punctuation, trailing periods) do not defeat duplicate detection.
 */
public final class TextNormalizer {
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    // Runs after whitespace collapsing, so a space is the only whitespace left
    private static final Pattern TRAILING_PERIODS = Pattern.compile("[. ]+$");

    private TextNormalizer() {
    }

    /**
     * Lower-cases, maps curly quotes, dashes and the ellipsis glyph to ASCII, collapses
     * whitespace and strips every trailing period. Quotes that legitimately end in "..." lose
     * them too; authors such as "Twain." and "Twain" compare equal in exchange.
     * <p>
     * The result never starts or ends with a space or ends with a period, which keeps the
     * operation idempotent.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String result = text.toLowerCase(Locale.ROOT)
                .replace('\n', ' ')
                .replace('\t', ' ')
                .replace('\u201C', '"')
                .replace('\u201D', '"')
                .replace('\u2018', '\'')
                .replace('\u2019', '\'')
                .replace('\u2014', '-')
                .replace('\u2013', '-')
                .replace("\u2026", "...");

        result = WHITESPACE_RUN.matcher(result).replaceAll(" ");
        result = TRAILING_PERIODS.matcher(result).replaceAll("");
        return result.startsWith(" ") ? result.substring(1) : result;
    }
}
