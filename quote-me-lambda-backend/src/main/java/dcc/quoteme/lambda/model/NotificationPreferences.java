package dcc.quoteme.lambda.model;

import java.util.LinkedHashMap;
import java.util.Map;

public class NotificationPreferences {
    public static final int DEFAULT_DELIVERY_HOUR = 8;

    private int deliveryHour = DEFAULT_DELIVERY_HOUR;
    // platform -> FCM registration token
    private Map<String, String> fcmTokens = new LinkedHashMap<>();

    public NotificationPreferences() {
    }

    public NotificationPreferences(int deliveryHour, Map<String, String> fcmTokens) {
        this.deliveryHour = deliveryHour;
        this.fcmTokens = fcmTokens != null ? new LinkedHashMap<>(fcmTokens) : new LinkedHashMap<>();
    }

    public int getDeliveryHour() {
        return deliveryHour;
    }

    public void setDeliveryHour(int deliveryHour) {
        this.deliveryHour = deliveryHour;
    }

    public Map<String, String> getFcmTokens() {
        return fcmTokens;
    }

    public void setFcmTokens(Map<String, String> fcmTokens) {
        this.fcmTokens = fcmTokens != null ? new LinkedHashMap<>(fcmTokens) : new LinkedHashMap<>();
    }
}
