package dcc.quoteme.lambda.mapper;

import dcc.quoteme.lambda.model.NotificationPreferences;
import dcc.quoteme.lambda.model.Subscription;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

public class SubscriptionItemMapper {
    private SubscriptionItemMapper() {
    }

    public static Subscription toSubscription(Map<String, AttributeValue> item) {
        Subscription subscription = new Subscription();
        subscription.setEmail(QuoteItemMapper.string(item, "email"));

        AttributeValue subscribed = item.get("is_subscribed");
        subscription.setSubscribed(subscribed != null && Boolean.TRUE.equals(subscribed.bool()));

        String deliveryMethod = QuoteItemMapper.string(item, "delivery_method");
        subscription.setDeliveryMethod(deliveryMethod != null ? deliveryMethod : Subscription.DELIVERY_EMAIL);
        String timezone = QuoteItemMapper.string(item, "timezone");
        subscription.setTimezone(timezone != null ? timezone : Subscription.DEFAULT_TIMEZONE);

        subscription.setNotificationPreferences(toPreferences(item.get("notificationPreferences")));
        subscription.setCreatedAt(QuoteItemMapper.string(item, "created_at"));
        subscription.setUpdatedAt(QuoteItemMapper.string(item, "updated_at"));
        return subscription;
    }

    public static Map<String, AttributeValue> toItem(Subscription subscription) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put("email", AttributeValue.builder().s(subscription.getEmail()).build());
        item.put("is_subscribed", AttributeValue.builder().bool(subscription.isSubscribed()).build());
        item.put("delivery_method", AttributeValue.builder().s(subscription.getDeliveryMethod()).build());
        item.put("timezone", AttributeValue.builder().s(subscription.getTimezone()).build());
        item.put("notificationPreferences", fromPreferences(subscription.getNotificationPreferences()));
        if (subscription.getCreatedAt() != null) {
            item.put("created_at", AttributeValue.builder().s(subscription.getCreatedAt()).build());
        }
        if (subscription.getUpdatedAt() != null) {
            item.put("updated_at", AttributeValue.builder().s(subscription.getUpdatedAt()).build());
        }
        return item;
    }

    private static NotificationPreferences toPreferences(AttributeValue value) {
        NotificationPreferences preferences = new NotificationPreferences();
        if (value == null || !value.hasM()) {
            return preferences;
        }

        AttributeValue deliveryHour = value.m().get("deliveryHour");
        if (deliveryHour != null && deliveryHour.n() != null) {
            preferences.setDeliveryHour(new BigDecimal(deliveryHour.n()).intValue());
        }

        AttributeValue fcmTokens = value.m().get("fcmTokens");
        if (fcmTokens != null && fcmTokens.hasM()) {
            Map<String, String> tokens = new LinkedHashMap<>();
            fcmTokens.m().forEach((platform, token) -> {
                if (token.s() != null && !token.s().isEmpty()) {
                    tokens.put(platform, token.s());
                }
            });
            preferences.setFcmTokens(tokens);
        }
        return preferences;
    }

    private static AttributeValue fromPreferences(NotificationPreferences preferences) {
        NotificationPreferences source = preferences != null ? preferences : new NotificationPreferences();
        Map<String, AttributeValue> tokens = new HashMap<>();
        source.getFcmTokens().forEach((platform, token) -> tokens.put(platform, AttributeValue.builder().s(token).build()));

        Map<String, AttributeValue> map = new HashMap<>();
        map.put("deliveryHour", AttributeValue.builder().n(String.valueOf(source.getDeliveryHour())).build());
        map.put("fcmTokens", AttributeValue.builder().m(tokens).build());
        return AttributeValue.builder().m(map).build();
    }
}
