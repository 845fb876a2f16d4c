package dcc.quoteme.lambda.util;

import java.util.Arrays;
import java.util.List;

/**
 * Cheap similarity measure for quote and author strings, returning a score in [0, 1].
 * <p>
 * Strings whose lengths differ by at most {@value #POSITIONAL_LENGTH_TOLERANCE} characters are
 * compared position by position; anything else is compared by shared words. The positional
 * comparison is sensitive to insertions: one extra character near the start shifts every later
 * position and collapses the score even for otherwise identical text.
 */
public final class SimilarityScorer {
    static final int POSITIONAL_LENGTH_TOLERANCE = 3;
    // Words of this length or shorter ("a", "to", "of") are ignored in the word comparison
    static final int MIN_SIGNIFICANT_WORD_LENGTH = 2;

    private SimilarityScorer() {
    }

    public static double similarity(String a, String b) {
        boolean aEmpty = a == null || a.isEmpty();
        boolean bEmpty = b == null || b.isEmpty();
        if (aEmpty && bEmpty) {
            return 1.0;
        }
        if (aEmpty || bEmpty) {
            return 0.0;
        }

        int[] aChars = a.codePoints().toArray();
        int[] bChars = b.codePoints().toArray();
        if (Math.abs(aChars.length - bChars.length) <= POSITIONAL_LENGTH_TOLERANCE) {
            return positionalSimilarity(aChars, bChars);
        }
        return wordOverlapSimilarity(a, b);
    }

    private static double positionalSimilarity(int[] a, int[] b) {
        int maxLength = Math.max(a.length, b.length);
        if (maxLength == 0) {
            return 0.0;
        }

        int shared = Math.min(a.length, b.length);
        int matches = 0;
        for (int i = 0; i < shared; i++) {
            if (a[i] == b[i]) {
                matches++;
            }
        }
        return (double) matches / maxLength;
    }

    /**
     * Dice-style overlap: every significant word of {@code a} found anywhere in {@code b} counts,
     * so a word repeated in {@code a} is counted once per occurrence. With repeated words the
     * score therefore depends on argument order.
     */
    private static double wordOverlapSimilarity(String a, String b) {
        String[] aWords = a.split(" ", -1);
        List<String> bWords = Arrays.asList(b.split(" ", -1));

        int commonWords = 0;
        for (String word : aWords) {
            if (word.codePointCount(0, word.length()) > MIN_SIGNIFICANT_WORD_LENGTH && bWords.contains(word)) {
                commonWords++;
            }
        }

        int totalWords = aWords.length + bWords.size();
        return totalWords > 0 ? (2.0 * commonWords) / totalWords : 0.0;
    }
}
