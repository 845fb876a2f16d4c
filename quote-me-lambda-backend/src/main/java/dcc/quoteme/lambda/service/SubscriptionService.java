package dcc.quoteme.lambda.service;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import dcc.quoteme.lambda.exception.NotFoundException;
import dcc.quoteme.lambda.model.NotificationPreferences;
import dcc.quoteme.lambda.model.Subscription;
import dcc.quoteme.lambda.repository.SubscriptionRepository;
import dcc.quoteme.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SubscriptionService {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionService.class);

    private final SubscriptionRepository subscriptionRepository;
    private final TimeProvider timeProvider;

    public SubscriptionService(SubscriptionRepository subscriptionRepository, TimeProvider timeProvider) {
        this.subscriptionRepository = subscriptionRepository;
        this.timeProvider = timeProvider;
    }

    public Subscription getSubscription(String email) {
        Subscription subscription = subscriptionRepository.findByEmail(email);
        if (subscription == null) {
            throw new NotFoundException("No subscription found");
        }
        return subscription;
    }

    /**
     * Creates or replaces the caller's subscription. Missing fields take their defaults; the
     * original {@code created_at} survives updates.
     */
    public Subscription updateSubscription(String email, JsonObject body) {
        String timestamp = timeProvider.now().toString();

        Subscription subscription = new Subscription(
                email,
                booleanOrDefault(body, "is_subscribed", false),
                stringOrDefault(body, "delivery_method", Subscription.DELIVERY_EMAIL),
                stringOrDefault(body, "timezone", Subscription.DEFAULT_TIMEZONE),
                parsePreferences(body.get("notification_preferences")));
        subscription.setUpdatedAt(timestamp);

        Subscription existing = subscriptionRepository.findByEmail(email);
        subscription.setCreatedAt(existing != null && existing.getCreatedAt() != null ? existing.getCreatedAt() : timestamp);

        subscriptionRepository.save(subscription);
        logger.info("Subscription updated for {}: subscribed={}, timezone={}, deliveryHour={}", email,
                subscription.isSubscribed(), subscription.getTimezone(), subscription.getNotificationPreferences().getDeliveryHour());
        return subscription;
    }

    public void deleteSubscription(String email) {
        subscriptionRepository.delete(email);
        logger.info("Subscription deleted for {}", email);
    }

    /**
     * Every subscription, newest first.
     */
    public List<Subscription> listAll() {
        List<Subscription> subscriptions = subscriptionRepository.findAll();
        subscriptions.sort(Comparator.comparing(
                (Subscription s) -> s.getCreatedAt() != null ? s.getCreatedAt() : "").reversed());
        logger.info("Retrieved {} total subscribers", subscriptions.size());
        return subscriptions;
    }

    private static NotificationPreferences parsePreferences(JsonElement raw) {
        NotificationPreferences preferences = new NotificationPreferences();
        if (raw == null || !raw.isJsonObject()) {
            return preferences;
        }

        JsonObject object = raw.getAsJsonObject();
        JsonElement deliveryHour = object.get("deliveryHour");
        if (deliveryHour != null && deliveryHour.isJsonPrimitive() && deliveryHour.getAsJsonPrimitive().isNumber()) {
            int hour = deliveryHour.getAsInt();
            if (hour < 0 || hour > 23) {
                throw new IllegalArgumentException("deliveryHour must be between 0 and 23");
            }
            preferences.setDeliveryHour(hour);
        }

        JsonElement fcmTokens = object.get("fcmTokens");
        if (fcmTokens != null && fcmTokens.isJsonObject()) {
            Map<String, String> tokens = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : fcmTokens.getAsJsonObject().entrySet()) {
                if (entry.getValue().isJsonPrimitive()) {
                    tokens.put(entry.getKey(), entry.getValue().getAsString());
                }
            }
            preferences.setFcmTokens(tokens);
        }
        return preferences;
    }

    private static boolean booleanOrDefault(JsonObject body, String field, boolean defaultValue) {
        JsonElement value = body.get(field);
        return value != null && value.isJsonPrimitive() ? value.getAsBoolean() : defaultValue;
    }

    private static String stringOrDefault(JsonObject body, String field, String defaultValue) {
        JsonElement value = body.get(field);
        if (value == null || !value.isJsonPrimitive() || value.getAsString().isEmpty()) {
            return defaultValue;
        }
        return value.getAsString();
    }
}
