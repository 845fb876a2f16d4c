package dcc.quoteme.lambda.service;

import dcc.quoteme.lambda.model.MatchVerdict;
import dcc.quoteme.lambda.util.SimilarityScorer;
import dcc.quoteme.lambda.util.TextNormalizer;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decides whether a candidate quote duplicates an existing one. Rules are tried in order and the
 * first that holds wins:
 * <ol>
 *     <li>normalized quote and author both equal: {@code exact_match}</li>
 *     <li>quote similarity at least 0.90 and equal authors: {@code similar_quote_same_author_<q>}</li>
 *     <li>equal quotes and author similarity at least 0.85: {@code same_quote_similar_author_<a>}</li>
 *     <li>quote similarity at least 0.95 and author similarity at least 0.90: {@code both_similar_q<q>_a<a>}</li>
 * </ol>
 */
public final class DuplicateClassifier {
    static final double SIMILAR_QUOTE_THRESHOLD = 0.90;
    static final double SIMILAR_AUTHOR_THRESHOLD = 0.85;
    static final double BOTH_SIMILAR_QUOTE_THRESHOLD = 0.95;
    static final double BOTH_SIMILAR_AUTHOR_THRESHOLD = 0.90;

    private DuplicateClassifier() {
    }

    public static MatchVerdict classify(String candidateQuote, String candidateAuthor,
                                        String existingQuote, String existingAuthor) {
        String quoteA = TextNormalizer.normalize(candidateQuote);
        String quoteB = TextNormalizer.normalize(existingQuote);
        String authorA = TextNormalizer.normalize(candidateAuthor);
        String authorB = TextNormalizer.normalize(existingAuthor);

        boolean sameQuote = quoteA.equals(quoteB);
        boolean sameAuthor = authorA.equals(authorB);

        if (sameQuote && sameAuthor) {
            return MatchVerdict.match(MatchVerdict.EXACT_MATCH);
        }

        double quoteSimilarity = SimilarityScorer.similarity(quoteA, quoteB);
        if (quoteSimilarity >= SIMILAR_QUOTE_THRESHOLD && sameAuthor) {
            return MatchVerdict.match(MatchVerdict.SIMILAR_QUOTE_SAME_AUTHOR + "_" + formatScore(quoteSimilarity));
        }

        double authorSimilarity = SimilarityScorer.similarity(authorA, authorB);
        if (sameQuote && authorSimilarity >= SIMILAR_AUTHOR_THRESHOLD) {
            return MatchVerdict.match(MatchVerdict.SAME_QUOTE_SIMILAR_AUTHOR + "_" + formatScore(authorSimilarity));
        }

        if (quoteSimilarity >= BOTH_SIMILAR_QUOTE_THRESHOLD && authorSimilarity >= BOTH_SIMILAR_AUTHOR_THRESHOLD) {
            return MatchVerdict.match(MatchVerdict.BOTH_SIMILAR
                    + "_q" + formatScore(quoteSimilarity)
                    + "_a" + formatScore(authorSimilarity));
        }

        return MatchVerdict.noMatch();
    }

    // Exact binary value rounded half-even, the same digits printf-style "%.2f" formatting yields
    static String formatScore(double score) {
        return new BigDecimal(score).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }
}
