package dcc.quoteme.lambda.util;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public final class RequestUtil {
    private RequestUtil() {
    }

    public static String normalizedPath(APIGatewayProxyRequestEvent event) {
        String path = event.getPath() != null ? event.getPath() : "";
        // Normalize path by removing duplicate slashes
        while (path.contains("//")) {
            path = path.replace("//", "/");
        }
        return path;
    }

    /**
     * Parses the body as a JSON object; an absent body reads as {@code {}}.
     *
     * @throws JsonSyntaxException when the body is not a JSON object
     */
    public static JsonObject jsonBody(APIGatewayProxyRequestEvent event) {
        String body = event.getBody();
        if (body == null || body.isBlank()) {
            return new JsonObject();
        }
        JsonElement parsed = JsonParser.parseString(body);
        if (!parsed.isJsonObject()) {
            throw new JsonSyntaxException("Expected a JSON object");
        }
        return parsed.getAsJsonObject();
    }

    public static String queryParam(APIGatewayProxyRequestEvent event, String name) {
        Map<String, String> params = event.getQueryStringParameters();
        return params != null ? params.get(name) : null;
    }

    public static String pathParam(APIGatewayProxyRequestEvent event, String name) {
        Map<String, String> params = event.getPathParameters();
        return params != null ? params.get(name) : null;
    }

    /**
     * Header lookup ignoring case; API Gateway passes names through as the client sent them.
     */
    public static String header(APIGatewayProxyRequestEvent event, String name) {
        Map<String, String> headers = event.getHeaders();
        if (headers == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public static String lastPathSegment(String path) {
        String[] parts = path.split("/");
        return parts.length > 0 ? URLDecoder.decode(parts[parts.length - 1], StandardCharsets.UTF_8) : "";
    }

    public static String stringField(JsonObject body, String name) {
        JsonElement value = body.get(name);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }
}
