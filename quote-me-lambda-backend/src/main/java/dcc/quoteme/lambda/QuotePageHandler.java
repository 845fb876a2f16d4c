package dcc.quoteme.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import dcc.quoteme.lambda.model.Quote;
import dcc.quoteme.lambda.repository.QuoteRepository;
import dcc.quoteme.lambda.template.QuotePageRenderer;
import dcc.quoteme.lambda.util.EnvConfig;
import org.apache.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static dcc.quoteme.lambda.util.ApiResponses.html;
import static dcc.quoteme.lambda.util.RequestUtil.header;
import static dcc.quoteme.lambda.util.RequestUtil.lastPathSegment;
import static dcc.quoteme.lambda.util.RequestUtil.normalizedPath;
import static dcc.quoteme.lambda.util.RequestUtil.pathParam;
import static dcc.quoteme.lambda.util.RequestUtil.queryParam;

/**
 * Serves {@code /quote/{id}} as a small HTML page carrying Open Graph and Twitter Card tags, so
 * shared links unfurl with the quote text before redirecting to the web app.
 */
public class QuotePageHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {
    private static final Logger logger = LoggerFactory.getLogger(QuotePageHandler.class);

    private static final Map<String, String> PAGE_HEADERS = Map.of(
            "Cache-Control", "public, max-age=3600",
            "Access-Control-Allow-Origin", "*");
    static final List<String> SOCIAL_BOTS = List.of(
            "facebookexternalhit", "twitterbot", "linkedinbot", "whatsapp", "telegrambot",
            "slackbot", "discordbot", "pinterest", "redditbot", "skypeuripreview");

    private final QuoteRepository quoteRepository;
    private final QuotePageRenderer pageRenderer;

    public QuotePageHandler() {
        this(new QuoteRepository(), new QuotePageRenderer(EnvConfig.get(EnvConfig.WEB_APP_URL, EnvConfig.DEFAULT_WEB_APP_URL)));
    }

    public QuotePageHandler(QuoteRepository quoteRepository, QuotePageRenderer pageRenderer) {
        this.quoteRepository = quoteRepository;
        this.pageRenderer = pageRenderer;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent event, Context context) {
        try {
            String quoteId = pathParam(event, "id");
            if (quoteId == null || quoteId.isEmpty()) {
                quoteId = lastPathSegment(normalizedPath(event));
            }

            boolean bot = isSocialBot(header(event, "User-Agent"));
            boolean htmlRequested = "html".equals(queryParam(event, "format"));
            logger.info("Quote page request: id={}, socialBot={}, formatHtml={}", quoteId, bot, htmlRequested);

            Quote quote = quoteId.isEmpty() ? null : quoteRepository.findById(quoteId);
            if (quote == null || !quote.qualifiesAsQuote()) {
                logger.info("Quote not found: {}", quoteId);
                return html(HttpStatus.SC_NOT_FOUND, pageRenderer.notFoundPage(), PAGE_HEADERS);
            }
            return html(HttpStatus.SC_OK, pageRenderer.quotePage(quote), PAGE_HEADERS);
        } catch (Exception e) {
            logger.error("Error rendering quote page", e);
            return html(HttpStatus.SC_INTERNAL_SERVER_ERROR, pageRenderer.errorPage(), PAGE_HEADERS);
        }
    }

    static boolean isSocialBot(String userAgent) {
        if (userAgent == null) {
            return false;
        }
        String agent = userAgent.toLowerCase(Locale.ROOT);
        return SOCIAL_BOTS.stream().anyMatch(agent::contains);
    }
}
