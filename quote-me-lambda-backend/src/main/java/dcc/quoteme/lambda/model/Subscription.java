package dcc.quoteme.lambda.model;

import com.google.gson.annotations.SerializedName;

public class Subscription {
    public static final String DELIVERY_EMAIL = "email";
    public static final String DEFAULT_TIMEZONE = "America/New_York";

    private String email;
    @SerializedName("is_subscribed")
    private boolean subscribed;
    @SerializedName("delivery_method")
    private String deliveryMethod = DELIVERY_EMAIL;
    private String timezone = DEFAULT_TIMEZONE;
    private NotificationPreferences notificationPreferences = new NotificationPreferences();
    @SerializedName("created_at")
    private String createdAt;
    @SerializedName("updated_at")
    private String updatedAt;

    public Subscription() {
    }

    public Subscription(String email, boolean subscribed, String deliveryMethod, String timezone,
                        NotificationPreferences notificationPreferences) {
        this.email = email;
        this.subscribed = subscribed;
        this.deliveryMethod = deliveryMethod;
        this.timezone = timezone;
        this.notificationPreferences = notificationPreferences != null ? notificationPreferences : new NotificationPreferences();
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public boolean isSubscribed() {
        return subscribed;
    }

    public void setSubscribed(boolean subscribed) {
        this.subscribed = subscribed;
    }

    public String getDeliveryMethod() {
        return deliveryMethod;
    }

    public void setDeliveryMethod(String deliveryMethod) {
        this.deliveryMethod = deliveryMethod;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public NotificationPreferences getNotificationPreferences() {
        return notificationPreferences;
    }

    public void setNotificationPreferences(NotificationPreferences notificationPreferences) {
        this.notificationPreferences = notificationPreferences;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(String updatedAt) {
        this.updatedAt = updatedAt;
    }
}
