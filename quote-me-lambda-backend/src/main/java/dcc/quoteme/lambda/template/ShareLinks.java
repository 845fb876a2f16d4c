package dcc.quoteme.lambda.template;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

final class ShareLinks {
    private ShareLinks() {
    }

    /**
     * Percent-encodes a query component, spaces as {@code %20} rather than {@code +}.
     */
    static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static String quotePage(String webAppUrl, String quoteId) {
        return webAppUrl + "/quote/" + quoteId;
    }

    static String twitter(String sharedText) {
        return "https://twitter.com/intent/tweet?text=" + encode(sharedText) + "&hashtag=DailyNugget";
    }

    static String facebook(String webAppUrl, String quoteId, String sharedText) {
        return "https://www.facebook.com/sharer/sharer.php?u=" + quotePage(webAppUrl, quoteId) + "&quote=" + encode(sharedText);
    }

    static String linkedIn(String webAppUrl, String quoteId) {
        return "https://www.linkedin.com/sharing/share-offsite/?url=" + quotePage(webAppUrl, quoteId);
    }

    static String mail(String sharedText) {
        return "mailto:?subject=" + encode("Check out this inspiring quote!")
                + "&body=" + encode(sharedText + "\n\nShared from Quote Me Daily Nuggets");
    }
}
