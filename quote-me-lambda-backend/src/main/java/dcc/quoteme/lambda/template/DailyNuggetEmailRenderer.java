package dcc.quoteme.lambda.template;

import dcc.quoteme.lambda.model.EmailContent;
import dcc.quoteme.lambda.model.Quote;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import static org.apache.commons.text.StringEscapeUtils.escapeHtml4;

/**
 * Builds the Daily Nugget email: subject, HTML body with share links, and a plain-text fallback.
 */
public class DailyNuggetEmailRenderer {
    static final int MAX_TAGS = 5;
    private static final DateTimeFormatter SUBJECT_DATE = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

    private final String webAppUrl;

    public DailyNuggetEmailRenderer(String webAppUrl) {
        this.webAppUrl = webAppUrl;
    }

    public EmailContent render(Quote quote, LocalDate date) {
        String formattedDate = SUBJECT_DATE.format(date);
        String id = quote.getId() != null ? quote.getId() : "";
        String sharedText = "\"" + quote.getQuote() + "\" - " + quote.getAuthor();

        String twitterUrl = ShareLinks.twitter(sharedText);
        String viewUrl = ShareLinks.quotePage(webAppUrl, id);
        String appUrl = "quoteme:///quote/" + id;

        String html = "<!DOCTYPE html>\n"
                + "<html>\n<head>\n<meta charset=\"utf-8\">\n<style>\n"
                + "body { font-family: 'Georgia', serif; background-color: #f5f5f5; margin: 0; padding: 0; }\n"
                + ".container { max-width: 600px; margin: 40px auto; background: white; border-radius: 10px; overflow: hidden; }\n"
                + ".header { background: linear-gradient(135deg, #667eea 0%, #764ba2 100%); color: white; padding: 30px; text-align: center; }\n"
                + ".content { padding: 40px; }\n"
                + ".quote { font-size: 24px; line-height: 1.6; color: #2d3748; font-style: italic; margin: 20px 0; }\n"
                + ".author { font-size: 18px; color: #4a5568; text-align: right; margin: 20px 0; }\n"
                + ".tag { display: inline-block; background: #edf2f7; color: #4a5568; padding: 5px 15px; border-radius: 20px; margin: 5px; font-size: 14px; }\n"
                + ".share-section { background: #f8f9fa; border-radius: 8px; padding: 20px; margin: 30px 0; text-align: center; }\n"
                + ".share-button { display: inline-block; margin: 0 8px; padding: 10px 20px; background: white; border: 1px solid #e2e8f0; border-radius: 6px; text-decoration: none; color: #4a5568; }\n"
                + ".action-button { display: inline-block; padding: 12px 30px; background: #667eea; color: white; text-decoration: none; border-radius: 6px; margin: 0 10px; }\n"
                + ".footer { background: #f7fafc; padding: 20px; text-align: center; color: #718096; font-size: 14px; }\n"
                + "</style>\n</head>\n<body>\n<div class=\"container\">\n"
                + "<div class=\"header\"><h1 style=\"margin: 0; font-size: 28px;\">Daily Nugget</h1>"
                + "<p style=\"margin: 10px 0 0 0;\">Your daily dose of inspiration</p></div>\n"
                + "<div class=\"content\">\n"
                + "<div class=\"quote\">&quot;" + escapeHtml4(quote.getQuote()) + "&quot;</div>\n"
                + "<div class=\"author\">&mdash; " + escapeHtml4(quote.getAuthor()) + "</div>\n"
                + tagsHtml(quote.getTags())
                + "<div class=\"share-section\"><div>Share this quote</div>\n"
                + link(twitterUrl, "Twitter")
                + link(ShareLinks.facebook(webAppUrl, id, sharedText), "Facebook")
                + link(ShareLinks.linkedIn(webAppUrl, id), "LinkedIn")
                + link(ShareLinks.mail(sharedText), "Email")
                + "</div>\n"
                + "<div style=\"text-align: center; margin: 30px 0;\">"
                + "<a href=\"" + escapeHtml4(viewUrl) + "\" class=\"action-button\">View in Browser</a>"
                + "<a href=\"" + escapeHtml4(appUrl) + "\" class=\"action-button\">Open in App</a></div>\n"
                + "</div>\n"
                + "<div class=\"footer\"><p>You're receiving this because you subscribed to Daily Nuggets.</p>"
                + "<p><a href=\"quoteme:///profile\">Manage your subscription</a> in the Quote Me app.</p>"
                + "<p style=\"font-size: 12px;\"><a href=\"" + escapeHtml4(webAppUrl) + "/profile\">Or manage in your browser</a></p></div>\n"
                + "</div>\n</body>\n</html>\n";

        String text = "Daily Nugget - " + formattedDate + "\n\n"
                + "\"" + quote.getQuote() + "\"\n\n"
                + "- " + quote.getAuthor() + "\n\n"
                + "Tags: " + String.join(", ", quote.getTags()) + "\n\n"
                + "---\nShare this quote:\n"
                + "* Twitter: " + twitterUrl + "\n"
                + "* View in browser: " + viewUrl + "\n"
                + "* Open in app: " + appUrl + "\n\n"
                + "---\nYou're receiving this because you subscribed to Daily Nuggets.\n"
                + "Manage your subscription in the Quote Me app.\n";

        return new EmailContent("Your Daily Nugget - " + formattedDate, html, text);
    }

    private static String tagsHtml(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        StringBuilder html = new StringBuilder("<div class=\"tags\">");
        for (String tag : tags.subList(0, Math.min(MAX_TAGS, tags.size()))) {
            html.append("<span class=\"tag\">").append(escapeHtml4(tag)).append("</span>");
        }
        return html.append("</div>\n").toString();
    }

    private static String link(String href, String label) {
        return "<a href=\"" + escapeHtml4(href) + "\" class=\"share-button\">" + label + "</a>\n";
    }
}
