package dcc.quoteme.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import dcc.quoteme.lambda.client.CognitoTokenClient;
import dcc.quoteme.lambda.model.TokenResponse;
import dcc.quoteme.lambda.repository.QuoteRepository;
import dcc.quoteme.lambda.service.OAuthService;
import dcc.quoteme.lambda.template.OAuthPageRenderer;
import dcc.quoteme.lambda.util.EnvConfig;
import dcc.quoteme.lambda.util.SystemTimeProvider;
import org.apache.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

import static dcc.quoteme.lambda.util.ApiResponses.corsHeaders;
import static dcc.quoteme.lambda.util.ApiResponses.html;
import static dcc.quoteme.lambda.util.ApiResponses.json;
import static dcc.quoteme.lambda.util.RequestUtil.header;
import static dcc.quoteme.lambda.util.RequestUtil.normalizedPath;
import static dcc.quoteme.lambda.util.RequestUtil.queryParam;

/**
 * Redirect target of the Cognito hosted UI. Exchanges the authorization code, records a one-time
 * success flag and sends the browser back to the web or mobile app.
 */
public class OAuthCallbackHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {
    private static final Logger logger = LoggerFactory.getLogger(OAuthCallbackHandler.class);

    private static final Map<String, String> HTML_HEADERS = Map.of(
            "Content-Type", "text/html",
            "Cache-Control", "no-cache, no-store, must-revalidate");
    private static final String[] MOBILE_AGENTS = {"iphone", "ipad", "android", "mobile"};

    private final CognitoTokenClient tokenClient;
    private final OAuthService oAuthService;
    private final OAuthPageRenderer pageRenderer;

    public OAuthCallbackHandler() {
        this(new CognitoTokenClient(EnvConfig.get(EnvConfig.COGNITO_DOMAIN), EnvConfig.get(EnvConfig.COGNITO_CLIENT_ID),
                        EnvConfig.get(EnvConfig.OAUTH_REDIRECT_URI)),
                new OAuthService(new QuoteRepository(), new SystemTimeProvider()),
                new OAuthPageRenderer(EnvConfig.get(EnvConfig.WEB_APP_URL, EnvConfig.DEFAULT_WEB_APP_URL)));
    }

    public OAuthCallbackHandler(CognitoTokenClient tokenClient, OAuthService oAuthService, OAuthPageRenderer pageRenderer) {
        this.tokenClient = tokenClient;
        this.oAuthService = oAuthService;
        this.pageRenderer = pageRenderer;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent event, Context context) {
        String path = normalizedPath(event);
        logger.info("path={}, httpMethod={}", path, event.getHttpMethod());

        if (path.endsWith("/auth/check")) {
            Map<String, Object> result = oAuthService.consumeSuccess(queryParam(event, "success_key"));
            return json(HttpStatus.SC_OK, result, corsHeaders("*"));
        }
        return handleCallback(event);
    }

    private APIGatewayProxyResponseEvent handleCallback(APIGatewayProxyRequestEvent event) {
        try {
            String error = queryParam(event, "error");
            if (error != null) {
                String description = queryParam(event, "error_description");
                logger.error("OAuth error: {} - {}", error, description);
                return html(HttpStatus.SC_BAD_REQUEST, pageRenderer.errorPage(description != null ? description : error), HTML_HEADERS);
            }

            String code = queryParam(event, "code");
            if (code == null || code.isEmpty()) {
                logger.error("No authorization code received");
                return html(HttpStatus.SC_BAD_REQUEST, pageRenderer.errorPage("No authorization code received"), HTML_HEADERS);
            }
            logger.info("Received authorization code, state={}", queryParam(event, "state"));

            TokenResponse tokens = tokenClient.exchangeCode(code);
            if (tokens.hasError()) {
                String message = tokens.getErrorDescription() != null ? tokens.getErrorDescription() : tokens.getError();
                return html(HttpStatus.SC_BAD_REQUEST, pageRenderer.errorPage(message), HTML_HEADERS);
            }
            if (tokens.getAccessToken() == null || tokens.getIdToken() == null) {
                logger.error("Missing tokens in token response");
                return html(HttpStatus.SC_BAD_REQUEST, pageRenderer.errorPage("Failed to obtain authentication tokens"), HTML_HEADERS);
            }

            String successKey = oAuthService.recordSuccess(tokens.getIdToken());
            boolean mobile = isMobile(header(event, "User-Agent"));
            logger.info("OAuth success, mobile={}", mobile);
            return html(HttpStatus.SC_OK, pageRenderer.successPage(mobile, successKey), HTML_HEADERS);
        } catch (Exception e) {
            logger.error("Unexpected error in OAuth callback", e);
            return html(HttpStatus.SC_INTERNAL_SERVER_ERROR, pageRenderer.errorPage("An unexpected error occurred"), HTML_HEADERS);
        }
    }

    static boolean isMobile(String userAgent) {
        if (userAgent == null) {
            return false;
        }
        String agent = userAgent.toLowerCase(Locale.ROOT);
        for (String marker : MOBILE_AGENTS) {
            if (agent.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
