package dcc.quoteme.lambda.util;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.apache.http.HttpStatus;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for API Gateway proxy responses shared by all handlers.
 */
public final class ApiResponses {
    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    private static final String ALLOW_HEADERS = "Content-Type,X-Amz-Date,Authorization,X-Api-Key,X-Amz-Security-Token";
    private static final String ALLOW_METHODS = "GET,POST,PUT,DELETE,OPTIONS";

    private ApiResponses() {
    }

    public static Gson gson() {
        return gson;
    }

    public static Map<String, String> corsHeaders(String allowOrigin) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Access-Control-Allow-Origin", allowOrigin);
        headers.put("Access-Control-Allow-Headers", ALLOW_HEADERS);
        headers.put("Access-Control-Allow-Methods", ALLOW_METHODS);
        return headers;
    }

    public static APIGatewayProxyResponseEvent json(int statusCode, Object body) {
        return json(statusCode, body, corsHeaders("*"));
    }

    public static APIGatewayProxyResponseEvent json(int statusCode, Object body, Map<String, String> extraHeaders) {
        Map<String, String> headers = new HashMap<>(extraHeaders);
        headers.put("Content-Type", "application/json");

        APIGatewayProxyResponseEvent response = new APIGatewayProxyResponseEvent();
        response.setStatusCode(statusCode);
        response.setHeaders(headers);
        response.setBody(body instanceof String ? (String) body : gson.toJson(body));
        return response;
    }

    public static APIGatewayProxyResponseEvent error(int statusCode, String error) {
        return json(statusCode, Map.of("error", error));
    }

    public static APIGatewayProxyResponseEvent error(int statusCode, String error, Map<String, String> extraHeaders) {
        return json(statusCode, Map.of("error", error), extraHeaders);
    }

    public static APIGatewayProxyResponseEvent forbidden() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Forbidden");
        body.put("message", "Admin access required");
        return json(HttpStatus.SC_FORBIDDEN, body);
    }

    public static APIGatewayProxyResponseEvent html(int statusCode, String html, Map<String, String> extraHeaders) {
        Map<String, String> headers = new HashMap<>(extraHeaders);
        headers.putIfAbsent("Content-Type", "text/html; charset=utf-8");

        APIGatewayProxyResponseEvent response = new APIGatewayProxyResponseEvent();
        response.setStatusCode(statusCode);
        response.setHeaders(headers);
        response.setBody(html);
        return response;
    }

    public static APIGatewayProxyResponseEvent options(Map<String, String> corsHeaders) {
        APIGatewayProxyResponseEvent response = new APIGatewayProxyResponseEvent();
        response.setStatusCode(HttpStatus.SC_OK);
        response.setHeaders(new HashMap<>(corsHeaders));
        response.setBody("");
        return response;
    }
}
