package dcc.quoteme.lambda.client;

import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;
import dcc.quoteme.lambda.model.TokenResponse;
import org.apache.http.HttpStatus;
import org.apache.http.NameValuePair;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.entity.UrlEncodedFormEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.message.BasicNameValuePair;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Exchanges an authorization code at the Cognito hosted-UI token endpoint.
 */
public class CognitoTokenClient {
    private static final Logger logger = LoggerFactory.getLogger(CognitoTokenClient.class);
    private static final Gson gson = new Gson();
    private static final int TIMEOUT_MILLIS = 10_000;

    private final String cognitoDomain;
    private final String clientId;
    private final String redirectUri;

    public CognitoTokenClient(String cognitoDomain, String clientId, String redirectUri) {
        this.cognitoDomain = cognitoDomain;
        this.clientId = clientId;
        this.redirectUri = redirectUri;
    }

    /**
     * Never throws: transport failures come back as a {@code token_exchange_failed} error response.
     */
    public TokenResponse exchangeCode(String code) {
        String tokenUrl = "https://" + cognitoDomain + "/oauth2/token";
        logger.info("Exchanging code for tokens at {}", tokenUrl);

        HttpPost request = new HttpPost(tokenUrl);
        request.setConfig(RequestConfig.custom()
                .setConnectTimeout(TIMEOUT_MILLIS)
                .setSocketTimeout(TIMEOUT_MILLIS)
                .setConnectionRequestTimeout(TIMEOUT_MILLIS)
                .build());
        List<NameValuePair> form = List.of(
                new BasicNameValuePair("grant_type", "authorization_code"),
                new BasicNameValuePair("code", code),
                new BasicNameValuePair("client_id", clientId),
                new BasicNameValuePair("redirect_uri", redirectUri));
        request.setEntity(new UrlEncodedFormEntity(form, StandardCharsets.UTF_8));

        try (CloseableHttpClient httpClient = HttpClients.createDefault(); CloseableHttpResponse response = httpClient.execute(request)) {
            String responseBody = response.getEntity() != null ? EntityUtils.toString(response.getEntity()) : "";
            TokenResponse tokens = gson.fromJson(responseBody, TokenResponse.class);
            int status = response.getStatusLine().getStatusCode();

            if (tokens == null) {
                return TokenResponse.failure("token_exchange_failed", "Empty response with status " + status);
            }
            if (status != HttpStatus.SC_OK) {
                logger.error("Token exchange failed with status {}: {}", status, tokens.getError());
                return tokens.hasError() ? tokens : TokenResponse.failure("token_exchange_failed", "HTTP " + status);
            }
            logger.info("Token exchange successful");
            return tokens;
        } catch (JsonSyntaxException e) {
            logger.error("Token endpoint returned invalid JSON: {}", e.getMessage());
            return TokenResponse.failure("token_exchange_failed", e.getMessage());
        } catch (Exception e) {
            logger.error("Token exchange request failed: {}", e.getMessage());
            return TokenResponse.failure("token_exchange_failed", e.getMessage());
        }
    }
}
