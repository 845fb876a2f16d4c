package dcc.quoteme.lambda.service;

import dcc.quoteme.lambda.model.MatchVerdict;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class DuplicateClassifierTest {

    @Test
    public void classify_CosmeticDifferencesOnly_ShouldBeExactMatch() {
        MatchVerdict verdict = DuplicateClassifier.classify("Be yourself.", "Oscar Wilde", "be yourself", "oscar wilde.");

        Assertions.assertTrue(verdict.isMatch());
        Assertions.assertEquals("exact_match", verdict.getReason());
    }

    @Test
    public void classify_TrailingPunctuationAdded_ShouldBeSimilarQuoteSameAuthor() {
        // Arrange: 52 of 54 positions agree
        String candidate = "The only way to do great work is to love what you do";
        String existing = "The only way to do great work is to love what you do!!";

        // Act
        MatchVerdict verdict = DuplicateClassifier.classify(candidate, "Steve Jobs", existing, "Steve Jobs");

        // Assert
        Assertions.assertTrue(verdict.isMatch());
        Assertions.assertEquals("similar_quote_same_author_0.96", verdict.getReason());
    }

    @Test
    public void classify_WordsInsertedInTheMiddle_ShouldNotMatch() {
        // Word overlap gives 16/22, below the 0.90 threshold
        MatchVerdict verdict = DuplicateClassifier.classify(
                "Life is what happens when you're busy making other plans", "John Lennon",
                "Life is what happens to you while you're busy making other plans", "John Lennon");

        Assertions.assertFalse(verdict.isMatch());
        Assertions.assertNull(verdict.getReason());
    }

    @Test
    public void classify_SameQuoteAuthorMisspelled_ShouldBeSameQuoteSimilarAuthor() {
        // "mark twian" against "mark twain": 8 of 10 positions
        MatchVerdict verdict = DuplicateClassifier.classify("Get busy living", "Mark Twain", "Get busy living", "Mark Twian");

        Assertions.assertFalse(verdict.isMatch());

        // "mark twaim": 9 of 10 positions
        verdict = DuplicateClassifier.classify("Get busy living", "Mark Twain", "Get busy living", "Mark Twaim");
        Assertions.assertTrue(verdict.isMatch());
        Assertions.assertEquals("same_quote_similar_author_0.90", verdict.getReason());
    }

    @Test
    public void classify_BothSlightlyDifferent_ShouldBeBothSimilar() {
        // Quote: 39 of 40 positions, author: 9 of 10 positions
        String quote = "abcdefghij abcdefghij abcdefghij abcdefg";
        String variant = "abcdefghij abcdefghij abcdefghij abcdefx";

        MatchVerdict verdict = DuplicateClassifier.classify(quote, "Mark Twain", variant, "Mark Twaim");

        Assertions.assertTrue(verdict.isMatch());
        Assertions.assertEquals("both_similar_q0.97_a0.90", verdict.getReason());
    }

    @Test
    public void classify_DifferentQuotes_ShouldNotMatch() {
        MatchVerdict verdict = DuplicateClassifier.classify("Stay hungry, stay foolish", "Steve Jobs",
                "Simplicity is the ultimate sophistication", "Leonardo da Vinci");

        Assertions.assertFalse(verdict.isMatch());
    }

    @Test
    public void formatScore_ShouldRoundToTwoDecimals() {
        Assertions.assertEquals("0.96", DuplicateClassifier.formatScore(52.0 / 54.0));
        Assertions.assertEquals("1.00", DuplicateClassifier.formatScore(1.0));
        Assertions.assertEquals("0.90", DuplicateClassifier.formatScore(0.9));
    }
}
