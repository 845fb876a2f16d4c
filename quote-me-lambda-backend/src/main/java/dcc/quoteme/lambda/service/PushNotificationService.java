package dcc.quoteme.lambda.service;

import com.google.gson.JsonObject;
import dcc.quoteme.lambda.client.FcmClient;
import dcc.quoteme.lambda.model.PushResult;
import dcc.quoteme.lambda.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class PushNotificationService {
    private static final Logger logger = LoggerFactory.getLogger(PushNotificationService.class);
    static final int MAX_BODY_LENGTH = 100;

    private final FcmClient fcmClient;

    public PushNotificationService(FcmClient fcmClient) {
        this.fcmClient = fcmClient;
    }

    /**
     * Pushes the quote to each platform token. A failing platform is recorded and the others are
     * still attempted.
     */
    public PushResult sendToDevices(Map<String, String> fcmTokens, Quote quote, String title, String type) {
        int sent = 0;
        List<String> errors = new ArrayList<>();

        for (Map.Entry<String, String> entry : fcmTokens.entrySet()) {
            String platform = entry.getKey();
            String token = entry.getValue();
            if (token == null || token.isEmpty()) {
                continue;
            }

            try {
                fcmClient.send(buildMessage(token, quote, title, type));
                sent++;
                logger.info("Notification sent successfully to {}", platform);
            } catch (Exception e) {
                String error = "Error sending to " + platform + ": " + e.getMessage();
                errors.add(error);
                logger.error(error);
            }
        }
        return new PushResult(sent, errors);
    }

    static JsonObject buildMessage(String token, Quote quote, String title, String type) {
        JsonObject notification = new JsonObject();
        notification.addProperty("title", title);
        notification.addProperty("body", truncate(quote.getQuote()));

        JsonObject data = new JsonObject();
        data.addProperty("quoteId", quote.getId() != null ? quote.getId() : "");
        data.addProperty("author", quote.getAuthor() != null ? quote.getAuthor() : "");
        data.addProperty("fullQuote", quote.getQuote());
        data.addProperty("type", type);

        JsonObject androidNotification = new JsonObject();
        androidNotification.addProperty("click_action", "FLUTTER_NOTIFICATION_CLICK");
        androidNotification.addProperty("channel_id", "daily_nuggets");
        JsonObject android = new JsonObject();
        android.add("notification", androidNotification);

        JsonObject aps = new JsonObject();
        aps.addProperty("category", "DAILY_NUGGET");
        JsonObject payload = new JsonObject();
        payload.add("aps", aps);
        JsonObject apns = new JsonObject();
        apns.add("payload", payload);

        JsonObject message = new JsonObject();
        message.addProperty("token", token);
        message.add("notification", notification);
        message.add("data", data);
        message.add("android", android);
        message.add("apns", apns);
        return message;
    }

    static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_BODY_LENGTH ? text.substring(0, MAX_BODY_LENGTH) + "..." : text;
    }
}
