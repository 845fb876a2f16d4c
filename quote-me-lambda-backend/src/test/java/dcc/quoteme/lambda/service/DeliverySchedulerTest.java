package dcc.quoteme.lambda.service;

import dcc.quoteme.lambda.model.NotificationPreferences;
import dcc.quoteme.lambda.model.Subscription;
import dcc.quoteme.lambda.util.MockTimeProvider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class DeliverySchedulerTest {
    static final LocalDate SUMMER = LocalDate.of(2024, 7, 15);
    static final LocalDate WINTER = LocalDate.of(2024, 1, 15);

    private static Subscription subscriber(String email, String timezone, int deliveryHour) {
        return new Subscription(email, true, Subscription.DELIVERY_EMAIL, timezone,
                new NotificationPreferences(deliveryHour, Map.of()));
    }

    @Test
    public void localHour_NewYork_ShouldFollowDaylightSavingTime() {
        Assertions.assertEquals(8, DeliveryScheduler.localHour("America/New_York", 12, SUMMER));
        Assertions.assertEquals(7, DeliveryScheduler.localHour("America/New_York", 12, WINTER));
    }

    @Test
    public void localHour_HalfHourOffset_ShouldTruncateToHour() {
        // 02:00 UTC is 07:30 in India
        Assertions.assertEquals(7, DeliveryScheduler.localHour("Asia/Kolkata", 2, WINTER));
    }

    @Test
    public void localHour_WrapsPastMidnight() {
        Assertions.assertEquals(9, DeliveryScheduler.localHour("Asia/Tokyo", 0, WINTER));
        Assertions.assertEquals(16, DeliveryScheduler.localHour("America/Los_Angeles", 0, WINTER));
    }

    @Test
    public void zoneOf_UnknownOrMissing_ShouldFallBackToNewYork() {
        Assertions.assertEquals(DeliveryScheduler.FALLBACK_ZONE, DeliveryScheduler.zoneOf("Mars/Olympus_Mons"));
        Assertions.assertEquals(DeliveryScheduler.FALLBACK_ZONE, DeliveryScheduler.zoneOf(null));
        Assertions.assertEquals("Europe/Amsterdam", DeliveryScheduler.zoneOf("Europe/Amsterdam").getId());
    }

    @Test
    public void dueAt_ShouldSelectSubscribersWhoseLocalHourMatches() {
        // Arrange
        DeliveryScheduler scheduler = new DeliveryScheduler(new MockTimeProvider(Instant.parse("2024-07-15T12:00:00Z")));
        List<Subscription> subscribers = List.of(
                subscriber("ny@example.com", "America/New_York", 8),
                subscriber("ams@example.com", "Europe/Amsterdam", 14),
                subscriber("late@example.com", "America/New_York", 9),
                subscriber("unknown@example.com", "Nowhere/Special", 8));

        // Act
        List<Subscription> due = scheduler.dueAt(subscribers, 12);

        // Assert
        Assertions.assertEquals(List.of("ny@example.com", "ams@example.com", "unknown@example.com"),
                due.stream().map(Subscription::getEmail).collect(Collectors.toList()));
    }
}
