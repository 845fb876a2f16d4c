package dcc.quoteme.lambda;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds API Gateway events carrying an unsigned Cognito token, which is all the handlers decode.
 */
public final class TestEvents {
    private TestEvents() {
    }

    public static APIGatewayProxyRequestEvent event(String method, String path) {
        return new APIGatewayProxyRequestEvent()
                .withHttpMethod(method)
                .withPath(path)
                .withHeaders(new HashMap<>());
    }

    public static APIGatewayProxyRequestEvent adminEvent(String method, String path) {
        return withToken(event(method, path), token("admin-sub-12345678", "admin@example.com", "admin", "[\"Admins\"]"));
    }

    public static APIGatewayProxyRequestEvent userEvent(String method, String path) {
        return withToken(event(method, path), token("user-sub-87654321", "user@example.com", "testuser", "[\"Users\"]"));
    }

    public static APIGatewayProxyRequestEvent withToken(APIGatewayProxyRequestEvent event, String token) {
        Map<String, String> headers = new HashMap<>(event.getHeaders() != null ? event.getHeaders() : Map.of());
        headers.put("Authorization", "Bearer " + token);
        return event.withHeaders(headers);
    }

    public static String token(String sub, String email, String username, String groupsJson) {
        // Format: header.payload.signature (only a decodable payload is needed)
        String header = base64UrlEncode("{\"alg\":\"HS256\",\"typ\":\"JWT\"}");
        StringBuilder payload = new StringBuilder("{\"sub\":\"").append(sub).append('"');
        if (email != null) {
            payload.append(",\"email\":\"").append(email).append('"');
        }
        payload.append(",\"username\":\"").append(username).append('"');
        if (groupsJson != null) {
            payload.append(",\"cognito:groups\":").append(groupsJson);
        }
        payload.append('}');
        return header + "." + base64UrlEncode(payload.toString()) + ".mock-signature";
    }

    private static String base64UrlEncode(String input) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(input.getBytes(StandardCharsets.UTF_8));
    }
}
