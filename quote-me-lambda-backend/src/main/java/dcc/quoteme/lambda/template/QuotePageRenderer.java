package dcc.quoteme.lambda.template;

import dcc.quoteme.lambda.model.Quote;

import java.util.List;

import static org.apache.commons.text.StringEscapeUtils.escapeHtml4;

/**
 * Share pages for a single quote, carrying the Open Graph and Twitter Card tags that link
 * previews are built from. Every value taken from a quote is HTML-escaped.
 */
public class QuotePageRenderer {
    static final int DESCRIPTION_LENGTH = 100;
    private static final String SITE_DESCRIPTION = "Discover and share inspiring, witty, and wise quotes with Quote Me.";

    private static final String STYLE = "<style>\n"
            + "body { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; "
            + "background: linear-gradient(135deg, #667eea 0%, #764ba2 100%); color: white; display: flex; "
            + "justify-content: center; align-items: center; min-height: 100vh; margin: 0; padding: 20px; }\n"
            + ".container { max-width: 600px; text-align: center; background: rgba(255, 255, 255, 0.1); padding: 40px; border-radius: 20px; }\n"
            + ".quote { font-size: 1.6em; font-style: italic; line-height: 1.5; margin-bottom: 20px; }\n"
            + ".author { font-size: 1.2em; margin-bottom: 20px; }\n"
            + ".tags { margin-bottom: 20px; opacity: 0.8; }\n"
            + "a { color: white; text-decoration: underline; }\n"
            + "</style>\n";

    private final String webAppUrl;

    public QuotePageRenderer(String webAppUrl) {
        this.webAppUrl = webAppUrl;
    }

    public String quotePage(Quote quote) {
        String rawText = quote.getQuote() != null ? quote.getQuote() : "";
        String author = escapeHtml4(quote.getAuthor() != null ? quote.getAuthor() : "Unknown");
        String id = escapeHtml4(quote.getId());
        String quoteText = escapeHtml4(rawText);
        String description = "&quot;" + escapeHtml4(shorten(rawText)) + "&quot; - " + author;
        String url = escapeHtml4(webAppUrl) + "/quote/" + id;
        String image = escapeHtml4(webAppUrl) + "/images/preview.png";

        return "<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n"
                + "<meta charset=\"UTF-8\">\n"
                + "<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n"
                + "<title>" + author + " - Quote Me</title>\n"
                + "<meta name=\"title\" content=\"" + author + " - Quote Me\">\n"
                + "<meta name=\"description\" content=\"" + description + "\">\n"
                + "<meta property=\"og:type\" content=\"article\">\n"
                + "<meta property=\"og:url\" content=\"" + url + "\">\n"
                + "<meta property=\"og:title\" content=\"Quote by " + author + "\">\n"
                + "<meta property=\"og:description\" content=\"" + description + "\">\n"
                + "<meta property=\"og:image\" content=\"" + image + "\">\n"
                + "<meta property=\"og:image:width\" content=\"1200\">\n"
                + "<meta property=\"og:image:height\" content=\"630\">\n"
                + "<meta property=\"og:site_name\" content=\"Quote Me\">\n"
                + "<meta property=\"og:locale\" content=\"en_US\">\n"
                + "<meta property=\"article:author\" content=\"" + author + "\">\n"
                + tagMetaTags(quote.getTags())
                + "<meta name=\"twitter:card\" content=\"summary_large_image\">\n"
                + "<meta name=\"twitter:url\" content=\"" + url + "\">\n"
                + "<meta name=\"twitter:title\" content=\"Quote by " + author + "\">\n"
                + "<meta name=\"twitter:description\" content=\"" + description + "\">\n"
                + "<meta name=\"twitter:image\" content=\"" + image + "\">\n"
                + "<meta http-equiv=\"refresh\" content=\"5;url=" + url + "\">\n"
                + STYLE
                + "</head>\n<body>\n<div class=\"container\">\n"
                + "<div class=\"quote\">&quot;" + quoteText + "&quot;</div>\n"
                + "<div class=\"author\">&mdash; " + author + "</div>\n"
                + (quote.getTags().isEmpty() ? "" : "<div class=\"tags\">" + escapeHtml4(String.join(", ", quote.getTags())) + "</div>\n")
                + "<div class=\"redirect\">Redirecting to Quote Me app... "
                + "<a href=\"" + url + "\">Click here if not redirected</a></div>\n"
                + "</div>\n</body>\n</html>";
    }

    public String notFoundPage() {
        String home = escapeHtml4(webAppUrl);
        String image = home + "/images/preview.png";
        return "<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n"
                + "<meta charset=\"UTF-8\">\n"
                + "<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n"
                + "<title>Quote Me - Share Inspiring Quotes</title>\n"
                + "<meta name=\"description\" content=\"" + SITE_DESCRIPTION + "\">\n"
                + "<meta property=\"og:type\" content=\"website\">\n"
                + "<meta property=\"og:url\" content=\"" + home + "\">\n"
                + "<meta property=\"og:title\" content=\"Quote Me - Share Inspiring Quotes\">\n"
                + "<meta property=\"og:description\" content=\"" + SITE_DESCRIPTION + "\">\n"
                + "<meta property=\"og:image\" content=\"" + image + "\">\n"
                + "<meta name=\"twitter:card\" content=\"summary_large_image\">\n"
                + "<meta name=\"twitter:title\" content=\"Quote Me - Share Inspiring Quotes\">\n"
                + "<meta name=\"twitter:description\" content=\"" + SITE_DESCRIPTION + "\">\n"
                + "<meta name=\"twitter:image\" content=\"" + image + "\">\n"
                + "<meta http-equiv=\"refresh\" content=\"5;url=" + home + "\">\n"
                + STYLE
                + "</head>\n<body>\n<div class=\"container\">\n"
                + "<h1>Quote Not Found</h1>\n"
                + "<p>The quote you're looking for doesn't exist or has been removed.</p>\n"
                + "<p>Redirecting to Quote Me... <a href=\"" + home + "\">Click here if not redirected</a></p>\n"
                + "</div>\n</body>\n</html>";
    }

    public String errorPage() {
        String home = escapeHtml4(webAppUrl);
        return "<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n"
                + "<title>Quote Me - Error</title>\n"
                + "<meta http-equiv=\"refresh\" content=\"3;url=" + home + "\">\n"
                + "</head>\n<body>\n"
                + "<h1>Something went wrong</h1>\n"
                + "<p><a href=\"" + home + "\">Go to Quote Me</a></p>\n"
                + "</body>\n</html>";
    }

    static String shorten(String text) {
        return text.length() > DESCRIPTION_LENGTH ? text.substring(0, DESCRIPTION_LENGTH) + "..." : text;
    }

    private static String tagMetaTags(List<String> tags) {
        StringBuilder meta = new StringBuilder();
        for (String tag : tags) {
            meta.append("<meta property=\"article:tag\" content=\"").append(escapeHtml4(tag)).append("\">\n");
        }
        return meta.toString();
    }
}
