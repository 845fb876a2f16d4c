package dcc.quoteme.lambda.service;

import dcc.quoteme.lambda.exception.NotFoundException;
import dcc.quoteme.lambda.model.*;
import dcc.quoteme.lambda.repository.SubscriptionRepository;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class DailyDeliveryServiceTest {
    static final Quote QUOTE = new Quote("q1", "Be yourself; everyone else is already taken.", "Oscar Wilde");

    @Mock
    SubscriptionRepository subscriptionRepositoryMock;

    @Mock
    DailyQuoteService dailyQuoteServiceMock;

    @Mock
    EmailService emailServiceMock;

    @Mock
    PushNotificationService pushNotificationServiceMock;

    @Mock
    DeliveryScheduler deliverySchedulerMock;

    DailyDeliveryService service;

    @BeforeEach
    void setUp() {
        service = new DailyDeliveryService(subscriptionRepositoryMock, dailyQuoteServiceMock, emailServiceMock,
                pushNotificationServiceMock, deliverySchedulerMock);
    }

    private static Subscription subscriber(String email, Map<String, String> tokens) {
        return new Subscription(email, true, Subscription.DELIVERY_EMAIL, Subscription.DEFAULT_TIMEZONE,
                new NotificationPreferences(8, tokens));
    }

    @Nested
    @MockitoSettings(strictness = Strictness.LENIENT)
    class DeliverTests {
        @Test
        public void deliver_OneRecipientFails_ShouldCountAndContinue() {
            // Arrange
            List<Subscription> active = List.of(subscriber("a@example.com", Map.of()), subscriber("b@example.com", Map.of()),
                    subscriber("c@example.com", Map.of()));
            when(subscriptionRepositoryMock.findActiveEmailSubscribers()).thenReturn(active);
            when(deliverySchedulerMock.dueAt(active, 12)).thenReturn(active);
            when(dailyQuoteServiceMock.pickQuote()).thenReturn(QUOTE);
            doThrow(new RuntimeException("Failed to send email to b@example.com"))
                    .when(emailServiceMock).sendDailyNugget("b@example.com", QUOTE);

            // Act
            DeliveryResult result = service.deliver(12);

            // Assert
            Assertions.assertEquals(12, result.getHourUtc());
            Assertions.assertEquals(2, result.getSent());
            Assertions.assertEquals(1, result.getFailed());
            verify(emailServiceMock).sendDailyNugget("c@example.com", QUOTE);
        }

        @Test
        public void deliver_NoQuote_ShouldFail() {
            when(subscriptionRepositoryMock.findActiveEmailSubscribers()).thenReturn(List.of());
            when(deliverySchedulerMock.dueAt(List.of(), 3)).thenReturn(List.of());
            when(dailyQuoteServiceMock.pickQuote()).thenReturn(null);

            IllegalStateException e = Assertions.assertThrows(IllegalStateException.class, () -> service.deliver(3));

            Assertions.assertEquals("No quote available", e.getMessage());
            verifyNoInteractions(emailServiceMock);
        }
    }

    @Nested
    class TestSendTests {
        @Test
        public void sendTestEmail_ShouldSendRandomQuote() {
            when(dailyQuoteServiceMock.pickQuote()).thenReturn(QUOTE);

            Quote sent = service.sendTestEmail("a@example.com");

            Assertions.assertSame(QUOTE, sent);
            verify(emailServiceMock).sendDailyNugget("a@example.com", QUOTE);
        }

        @Test
        public void sendTestNotification_NoSubscription_ShouldThrowNotFound() {
            when(subscriptionRepositoryMock.findByEmail("a@example.com")).thenReturn(null);

            NotFoundException e = Assertions.assertThrows(NotFoundException.class,
                    () -> service.sendTestNotification("a@example.com"));

            Assertions.assertEquals("No subscription found", e.getMessage());
        }

        @Test
        public void sendTestNotification_NoTokens_ShouldThrowNotFound() {
            when(subscriptionRepositoryMock.findByEmail("a@example.com")).thenReturn(subscriber("a@example.com", Map.of()));

            NotFoundException e = Assertions.assertThrows(NotFoundException.class,
                    () -> service.sendTestNotification("a@example.com"));

            Assertions.assertEquals("No FCM token found. Please enable push notifications first.", e.getMessage());
            verify(pushNotificationServiceMock, never()).sendToDevices(any(), any(), anyString(), anyString());
        }

        @Test
        public void sendTestNotification_WithTokens_ShouldPushToDevices() {
            // Arrange
            Map<String, String> tokens = Map.of("ios", "ios-token");
            when(subscriptionRepositoryMock.findByEmail("a@example.com")).thenReturn(subscriber("a@example.com", tokens));
            when(dailyQuoteServiceMock.pickQuote()).thenReturn(QUOTE);
            when(pushNotificationServiceMock.sendToDevices(tokens, QUOTE, "Test Daily Nugget", "test_notification"))
                    .thenReturn(new PushResult(1, List.of()));

            // Act
            DailyDeliveryService.TestNotification notification = service.sendTestNotification("a@example.com");

            // Assert
            Assertions.assertSame(QUOTE, notification.getQuote());
            Assertions.assertEquals(1, notification.getResult().getSent());
        }
    }
}
