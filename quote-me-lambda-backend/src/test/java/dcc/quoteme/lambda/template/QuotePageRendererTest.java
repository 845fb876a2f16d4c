package dcc.quoteme.lambda.template;

import dcc.quoteme.lambda.model.Quote;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class QuotePageRendererTest {
    static final String WEB_APP_URL = "https://quote-me.example.com";

    private final QuotePageRenderer renderer = new QuotePageRenderer(WEB_APP_URL);

    @Test
    public void quotePage_ShouldCarryOpenGraphAndTwitterTags() {
        // Arrange
        Quote quote = new Quote("q1", "Be yourself", "Oscar Wilde", List.of("Life", "Wisdom"));

        // Act
        String html = renderer.quotePage(quote);

        // Assert
        Assertions.assertTrue(html.contains("<meta property=\"og:url\" content=\"https://quote-me.example.com/quote/q1\">"));
        Assertions.assertTrue(html.contains("<meta property=\"og:title\" content=\"Quote by Oscar Wilde\">"));
        Assertions.assertTrue(html.contains("<meta name=\"twitter:card\" content=\"summary_large_image\">"));
        Assertions.assertTrue(html.contains("<meta property=\"article:tag\" content=\"Wisdom\">"));
        Assertions.assertTrue(html.contains("content=\"5;url=https://quote-me.example.com/quote/q1\""));
    }

    @Test
    public void quotePage_MarkupInQuote_ShouldBeEscaped() {
        Quote quote = new Quote("q1", "<script>alert('x')</script>", "Mallory & Co", List.of("<b>"));

        String html = renderer.quotePage(quote);

        Assertions.assertFalse(html.contains("<script>"));
        Assertions.assertTrue(html.contains("&lt;script&gt;"));
        Assertions.assertTrue(html.contains("Mallory &amp; Co"));
        Assertions.assertTrue(html.contains("content=\"&lt;b&gt;\""));
    }

    @Test
    public void quotePage_LongQuote_ShouldShortenDescription() {
        String text = "a".repeat(120);

        String html = renderer.quotePage(new Quote("q1", text, "Author"));

        Assertions.assertTrue(html.contains("content=\"&quot;" + "a".repeat(100) + "...&quot; - Author\""));
    }

    @Test
    public void notFoundPage_ShouldRedirectHome() {
        String html = renderer.notFoundPage();

        Assertions.assertTrue(html.contains("Quote Not Found"));
        Assertions.assertTrue(html.contains("content=\"5;url=https://quote-me.example.com\""));
    }
}
