package dcc.quoteme.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.google.gson.JsonSyntaxException;
import dcc.quoteme.lambda.exception.NotFoundException;
import dcc.quoteme.lambda.model.PushResult;
import dcc.quoteme.lambda.model.Quote;
import dcc.quoteme.lambda.model.Subscription;
import dcc.quoteme.lambda.model.UserClaims;
import dcc.quoteme.lambda.service.DailyDeliveryService;
import dcc.quoteme.lambda.service.SubscriptionService;
import dcc.quoteme.lambda.util.ClaimsExtractor;
import dcc.quoteme.lambda.util.EnvConfig;
import org.apache.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dcc.quoteme.lambda.util.ApiResponses.*;
import static dcc.quoteme.lambda.util.RequestUtil.jsonBody;
import static dcc.quoteme.lambda.util.RequestUtil.normalizedPath;

/**
 * Daily Nuggets subscription API: the caller manages their own subscription and can trigger test
 * deliveries; admins can list every subscriber.
 */
public class DailyNuggetsHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {
    private static final Logger logger = LoggerFactory.getLogger(DailyNuggetsHandler.class);

    private final SubscriptionService subscriptionService;
    private final DailyDeliveryService dailyDeliveryService;
    private final Map<String, String> corsHeaders;

    public DailyNuggetsHandler() {
        this(DailyNuggetsWiring.subscriptionService(), DailyNuggetsWiring.dailyDeliveryService(),
                EnvConfig.get(EnvConfig.CORS_ORIGIN, "*"));
    }

    public DailyNuggetsHandler(SubscriptionService subscriptionService, DailyDeliveryService dailyDeliveryService, String corsOrigin) {
        this.subscriptionService = subscriptionService;
        this.dailyDeliveryService = dailyDeliveryService;
        this.corsHeaders = corsHeaders(corsOrigin);
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent event, Context context) {
        try {
            String path = normalizedPath(event);
            String httpMethod = event.getHttpMethod();
            logger.info("path={}, httpMethod={}", path, httpMethod);

            if ("OPTIONS".equals(httpMethod)) {
                return options(corsHeaders);
            }

            UserClaims claims = ClaimsExtractor.fromEvent(event);

            if ("GET".equals(httpMethod) && path.endsWith("/admin/subscriptions")) {
                if (!claims.isAdmin()) {
                    return error(HttpStatus.SC_FORBIDDEN, "Admin access required", corsHeaders);
                }
                return listSubscriptions();
            }

            if (!claims.hasEmail()) {
                logger.error("Email not found in token claims");
                return error(HttpStatus.SC_BAD_REQUEST, "Invalid or expired token", corsHeaders);
            }
            String email = claims.getEmail();

            if (path.endsWith("/subscriptions") && "GET".equals(httpMethod)) {
                return json(HttpStatus.SC_OK, subscriptionService.getSubscription(email), corsHeaders);
            } else if (path.endsWith("/subscriptions") && "PUT".equals(httpMethod)) {
                Subscription subscription = subscriptionService.updateSubscription(email, jsonBody(event));
                return json(HttpStatus.SC_OK, Map.of("message", "Subscription updated successfully", "subscription", subscription), corsHeaders);
            } else if (path.endsWith("/subscriptions") && "DELETE".equals(httpMethod)) {
                subscriptionService.deleteSubscription(email);
                return json(HttpStatus.SC_OK, Map.of("message", "Subscription deleted successfully"), corsHeaders);
            } else if (path.endsWith("/subscriptions/test") && "POST".equals(httpMethod)) {
                Quote quote = dailyDeliveryService.sendTestEmail(email);
                return json(HttpStatus.SC_OK, Map.of("message", "Test email sent successfully", "quote", quote), corsHeaders);
            } else if (path.endsWith("/notifications/test") && "POST".equals(httpMethod)) {
                return sendTestNotification(email);
            }
            return error(HttpStatus.SC_NOT_FOUND, "Not found", corsHeaders);
        } catch (NotFoundException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            // Older clients read "message" for a missing subscription
            body.put("error", e.getMessage());
            body.put("message", e.getMessage());
            return json(HttpStatus.SC_NOT_FOUND, body, corsHeaders);
        } catch (JsonSyntaxException e) {
            return error(HttpStatus.SC_BAD_REQUEST, "Invalid JSON in request body", corsHeaders);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.SC_BAD_REQUEST, e.getMessage(), corsHeaders);
        } catch (Exception e) {
            logger.error("Error handling request", e);
            return error(HttpStatus.SC_INTERNAL_SERVER_ERROR, "Internal server error", corsHeaders);
        }
    }

    private APIGatewayProxyResponseEvent listSubscriptions() {
        List<Subscription> subscribers = subscriptionService.listAll();
        long active = subscribers.stream().filter(Subscription::isSubscribed).count();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("subscribers", subscribers);
        body.put("total", subscribers.size());
        body.put("active", active);
        return json(HttpStatus.SC_OK, body, corsHeaders);
    }

    private APIGatewayProxyResponseEvent sendTestNotification(String email) {
        DailyDeliveryService.TestNotification notification = dailyDeliveryService.sendTestNotification(email);
        PushResult result = notification.getResult();

        Map<String, Object> body = new LinkedHashMap<>();
        if (result.getSent() > 0) {
            body.put("message", "Test notification sent to " + result.getSent() + " device(s)");
            body.put("quote", notification.getQuote());
            body.put("errors", result.getErrors().isEmpty() ? null : result.getErrors());
            return json(HttpStatus.SC_OK, body, corsHeaders);
        }

        body.put("error", "Failed to send test notification");
        body.put("details", result.getErrors());
        return json(HttpStatus.SC_INTERNAL_SERVER_ERROR, body, corsHeaders);
    }
}
