package dcc.quoteme.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import dcc.quoteme.lambda.client.CognitoTokenClient;
import dcc.quoteme.lambda.model.TokenResponse;
import dcc.quoteme.lambda.service.OAuthService;
import dcc.quoteme.lambda.template.OAuthPageRenderer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class OAuthCallbackHandlerTest {
    @Mock
    CognitoTokenClient tokenClientMock;

    @Mock
    OAuthService oAuthServiceMock;

    OAuthCallbackHandler handler;
    Context context;

    @BeforeEach
    void setUp() {
        handler = new OAuthCallbackHandler(tokenClientMock, oAuthServiceMock, new OAuthPageRenderer("https://quote-me.anystupididea.com"));
        context = Mockito.mock(Context.class);
    }

    private static APIGatewayProxyRequestEvent callback(Map<String, String> query) {
        return TestEvents.event("GET", "/auth/callback").withQueryStringParameters(query);
    }

    private static TokenResponse tokens(String accessToken, String idToken) {
        TokenResponse tokens = new TokenResponse();
        tokens.setAccessToken(accessToken);
        tokens.setIdToken(idToken);
        return tokens;
    }

    @Nested
    class CallbackTests {
        @Test
        public void providerError_ShouldShowDescription() {
            APIGatewayProxyResponseEvent response = handler.handleRequest(
                    callback(Map.of("error", "access_denied", "error_description", "User cancelled")), context);

            Assertions.assertEquals(400, response.getStatusCode());
            Assertions.assertTrue(response.getBody().contains("User cancelled"));
            Assertions.assertEquals("no-cache, no-store, must-revalidate", response.getHeaders().get("Cache-Control"));
            verifyNoInteractions(tokenClientMock);
        }

        @Test
        public void missingCode_ShouldReturnBadRequest() {
            APIGatewayProxyResponseEvent response = handler.handleRequest(callback(Map.of("state", "abc")), context);

            Assertions.assertEquals(400, response.getStatusCode());
            Assertions.assertTrue(response.getBody().contains("No authorization code received"));
        }

        @Test
        public void tokenEndpointError_ShouldReturnBadRequest() {
            when(tokenClientMock.exchangeCode("code-1")).thenReturn(TokenResponse.failure("invalid_grant", "Code expired"));

            APIGatewayProxyResponseEvent response = handler.handleRequest(callback(Map.of("code", "code-1")), context);

            Assertions.assertEquals(400, response.getStatusCode());
            Assertions.assertTrue(response.getBody().contains("Code expired"));
            verifyNoInteractions(oAuthServiceMock);
        }

        @Test
        public void missingIdToken_ShouldReturnBadRequest() {
            when(tokenClientMock.exchangeCode("code-1")).thenReturn(tokens("access", null));

            APIGatewayProxyResponseEvent response = handler.handleRequest(callback(Map.of("code", "code-1")), context);

            Assertions.assertEquals(400, response.getStatusCode());
            Assertions.assertTrue(response.getBody().contains("Failed to obtain authentication tokens"));
        }

        @Test
        public void success_MobileBrowser_ShouldDeepLinkWithSuccessKey() {
            // Arrange
            when(tokenClientMock.exchangeCode("code-1")).thenReturn(tokens("access", "id-token"));
            when(oAuthServiceMock.recordSuccess("id-token")).thenReturn("key-123");
            APIGatewayProxyRequestEvent event = callback(Map.of("code", "code-1"));
            event.getHeaders().put("User-Agent", "Mozilla/5.0 (iPhone; CPU iPhone OS 17_0 like Mac OS X)");

            // Act
            APIGatewayProxyResponseEvent response = handler.handleRequest(event, context);

            // Assert
            Assertions.assertEquals(200, response.getStatusCode());
            Assertions.assertTrue(response.getBody().contains("quoteme://auth-success?success_key=key-123"));
            Assertions.assertEquals("text/html", response.getHeaders().get("Content-Type"));
        }

        @Test
        public void unexpectedFailure_ShouldShowGenericError() {
            when(tokenClientMock.exchangeCode(anyString())).thenThrow(new RuntimeException("connection reset"));

            APIGatewayProxyResponseEvent response = handler.handleRequest(callback(Map.of("code", "code-1")), context);

            Assertions.assertEquals(500, response.getStatusCode());
            Assertions.assertTrue(response.getBody().contains("An unexpected error occurred"));
            Assertions.assertFalse(response.getBody().contains("connection reset"));
        }
    }

    @Test
    public void authCheck_ShouldReturnConsumedFlag() {
        when(oAuthServiceMock.consumeSuccess("key-123")).thenReturn(Map.of("success", true, "username", "testuser"));
        APIGatewayProxyRequestEvent event = TestEvents.event("GET", "/auth/check")
                .withQueryStringParameters(Map.of("success_key", "key-123"));

        APIGatewayProxyResponseEvent response = handler.handleRequest(event, context);

        Assertions.assertEquals(200, response.getStatusCode());
        Assertions.assertTrue(response.getBody().contains("\"username\":\"testuser\""));
    }

    @Test
    public void isMobile_ShouldMatchCommonAgents() {
        Assertions.assertTrue(OAuthCallbackHandler.isMobile("Mozilla/5.0 (Linux; Android 14)"));
        Assertions.assertTrue(OAuthCallbackHandler.isMobile("Mozilla/5.0 (iPad; CPU OS 17_0)"));
        Assertions.assertFalse(OAuthCallbackHandler.isMobile("Mozilla/5.0 (Macintosh; Intel Mac OS X 14_0)"));
        Assertions.assertFalse(OAuthCallbackHandler.isMobile(null));
    }
}
