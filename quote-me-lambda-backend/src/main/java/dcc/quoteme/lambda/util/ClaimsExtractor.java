package dcc.quoteme.lambda.util;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.auth0.jwt.JWT;
import com.auth0.jwt.interfaces.DecodedJWT;
import dcc.quoteme.lambda.model.UserClaims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Reads the caller's Cognito claims from the authorizer context, falling back to decoding the
 * bearer token. Signatures are not checked here; API Gateway has already verified the token.
 */
public final class ClaimsExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ClaimsExtractor.class);

    private ClaimsExtractor() {
    }

    public static UserClaims fromEvent(APIGatewayProxyRequestEvent event) {
        Map<String, Object> claims = authorizerClaims(event);
        if (claims != null) {
            return new UserClaims(
                    asString(claims.getOrDefault("cognito:username", claims.get("username")), "unknown"),
                    asString(claims.get("email"), ""),
                    asString(claims.get("sub"), ""),
                    parseGroups(claims.get("cognito:groups")));
        }

        String token = bearerToken(event);
        if (token == null) {
            return UserClaims.anonymous();
        }

        try {
            DecodedJWT jwt = JWT.decode(token);
            // Access tokens carry "username", ID tokens "cognito:username"
            String username = jwt.getClaim("username").asString();
            if (username == null || username.isEmpty()) {
                username = jwt.getClaim("cognito:username").asString();
            }
            List<String> groups = jwt.getClaim("cognito:groups").asList(String.class);
            return new UserClaims(
                    username != null ? username : "unknown",
                    asString(jwt.getClaim("email").asString(), ""),
                    asString(jwt.getSubject(), ""),
                    groups);
        } catch (Exception e) {
            logger.warn("Could not decode authorization token: {}", e.getMessage());
            return UserClaims.anonymous();
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> authorizerClaims(APIGatewayProxyRequestEvent event) {
        APIGatewayProxyRequestEvent.ProxyRequestContext requestContext = event.getRequestContext();
        if (requestContext == null || requestContext.getAuthorizer() == null) {
            return null;
        }
        Object claims = requestContext.getAuthorizer().get("claims");
        return claims instanceof Map ? (Map<String, Object>) claims : null;
    }

    private static String bearerToken(APIGatewayProxyRequestEvent event) {
        Map<String, String> headers = event.getHeaders();
        if (headers == null) {
            return null;
        }

        // API Gateway may lowercase header names
        String authHeader = headers.get("authorization");
        if (authHeader == null) {
            authHeader = headers.get("Authorization");
        }
        if (authHeader == null || authHeader.isEmpty()) {
            return null;
        }
        return authHeader.startsWith("Bearer ") ? authHeader.substring(7) : authHeader;
    }

    /**
     * The authorizer hands groups over as a list, a comma separated string or a bracketed
     * string such as "[Admins Users]".
     */
    static List<String> parseGroups(Object rawGroups) {
        List<String> groups = new ArrayList<>();
        if (rawGroups instanceof Collection) {
            for (Object group : (Collection<?>) rawGroups) {
                if (group != null) {
                    groups.add(group.toString().trim());
                }
            }
        } else if (rawGroups instanceof String) {
            String value = ((String) rawGroups).replace("[", "").replace("]", "");
            for (String group : value.split("[,\\s]+")) {
                if (!group.isEmpty()) {
                    groups.add(group);
                }
            }
        }
        return groups;
    }

    private static String asString(Object value, String defaultValue) {
        return value != null ? value.toString() : defaultValue;
    }
}
