package dcc.quoteme.lambda.client;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Sends messages through the Firebase Cloud Messaging HTTP v1 API, authenticated with the
 * service-account credentials held in {@code FCM_SERVICE_ACCOUNT_JSON}.
 */
public class FcmClient {
    private static final String SEND_URL = "https://fcm.googleapis.com/v1/projects/%s/messages:send";
    private static final String MESSAGING_SCOPE = "https://www.googleapis.com/auth/firebase.messaging";
    private static final int TIMEOUT_MILLIS = 10_000;
    private static final Gson gson = new Gson();

    private final String serviceAccountJson;
    private GoogleCredentials credentials;
    private String projectId;

    public FcmClient(String serviceAccountJson) {
        this.serviceAccountJson = serviceAccountJson;
    }

    /**
     * Posts one {@code message} object. Any non-200 answer is reported as an IOException carrying
     * the response body.
     */
    public void send(JsonObject message) throws IOException {
        JsonObject envelope = new JsonObject();
        envelope.add("message", message);

        HttpPost request = new HttpPost(String.format(SEND_URL, projectId()));
        request.setConfig(RequestConfig.custom()
                .setConnectTimeout(TIMEOUT_MILLIS)
                .setSocketTimeout(TIMEOUT_MILLIS)
                .build());
        request.setHeader("Authorization", "Bearer " + accessToken());
        request.setEntity(new StringEntity(gson.toJson(envelope), ContentType.APPLICATION_JSON));

        try (CloseableHttpClient httpClient = HttpClients.createDefault(); CloseableHttpResponse response = httpClient.execute(request)) {
            String responseBody = response.getEntity() != null ? EntityUtils.toString(response.getEntity()) : "";
            if (response.getStatusLine().getStatusCode() != HttpStatus.SC_OK) {
                throw new IOException(responseBody);
            }
        }
    }

    private synchronized String accessToken() throws IOException {
        if (credentials == null) {
            credentials = GoogleCredentials
                    .fromStream(new ByteArrayInputStream(requireConfig().getBytes(StandardCharsets.UTF_8)))
                    .createScoped(List.of(MESSAGING_SCOPE));
        }
        credentials.refreshIfExpired();
        return credentials.getAccessToken().getTokenValue();
    }

    private synchronized String projectId() {
        if (projectId == null) {
            JsonObject account = JsonParser.parseString(requireConfig()).getAsJsonObject();
            projectId = account.get("project_id").getAsString();
        }
        return projectId;
    }

    private String requireConfig() {
        if (serviceAccountJson == null || serviceAccountJson.isEmpty()) {
            throw new IllegalStateException("FCM_SERVICE_ACCOUNT_JSON not configured");
        }
        return serviceAccountJson;
    }
}
