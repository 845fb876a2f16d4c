package dcc.quoteme.lambda.service;

import dcc.quoteme.lambda.exception.NotFoundException;
import dcc.quoteme.lambda.model.DeliveryResult;
import dcc.quoteme.lambda.model.PushResult;
import dcc.quoteme.lambda.model.Quote;
import dcc.quoteme.lambda.model.Subscription;
import dcc.quoteme.lambda.repository.SubscriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Sends the Daily Nugget, either for a scheduled UTC hour or on demand as a test.
 */
public class DailyDeliveryService {
    private static final Logger logger = LoggerFactory.getLogger(DailyDeliveryService.class);

    private final SubscriptionRepository subscriptionRepository;
    private final DailyQuoteService dailyQuoteService;
    private final EmailService emailService;
    private final PushNotificationService pushNotificationService;
    private final DeliveryScheduler deliveryScheduler;

    public DailyDeliveryService(SubscriptionRepository subscriptionRepository, DailyQuoteService dailyQuoteService,
                                EmailService emailService, PushNotificationService pushNotificationService,
                                DeliveryScheduler deliveryScheduler) {
        this.subscriptionRepository = subscriptionRepository;
        this.dailyQuoteService = dailyQuoteService;
        this.emailService = emailService;
        this.pushNotificationService = pushNotificationService;
        this.deliveryScheduler = deliveryScheduler;
    }

    /**
     * Emails one random quote to every active subscriber whose local delivery hour matches
     * {@code hourUtc}. A failing recipient is counted and the batch continues.
     *
     * @throws IllegalStateException when no quote is available
     */
    public DeliveryResult deliver(int hourUtc) {
        logger.info("Processing daily delivery for UTC hour: {}", hourUtc);

        List<Subscription> due = deliveryScheduler.dueAt(subscriptionRepository.findActiveEmailSubscribers(), hourUtc);
        logger.info("Found {} to email at UTC hour {}", due.size(), hourUtc);

        Quote quote = dailyQuoteService.pickQuote();
        if (quote == null) {
            throw new IllegalStateException("No quote available");
        }

        int sent = 0;
        int failed = 0;
        for (Subscription subscriber : due) {
            try {
                emailService.sendDailyNugget(subscriber.getEmail(), quote);
                sent++;
            } catch (Exception e) {
                logger.error("Failed to send email to {}: {}", subscriber.getEmail(), e.getMessage());
                failed++;
            }
        }

        logger.info("Daily delivery complete: {} sent, {} failed", sent, failed);
        return new DeliveryResult(hourUtc, sent, failed);
    }

    public Quote sendTestEmail(String email) {
        Quote quote = dailyQuoteService.pickQuote();
        if (quote == null) {
            throw new NotFoundException("No quotes available");
        }
        emailService.sendDailyNugget(email, quote);
        return quote;
    }

    public TestNotification sendTestNotification(String email) {
        Subscription subscription = subscriptionRepository.findByEmail(email);
        if (subscription == null) {
            throw new NotFoundException("No subscription found");
        }

        Map<String, String> tokens = subscription.getNotificationPreferences() != null
                ? subscription.getNotificationPreferences().getFcmTokens()
                : Map.of();
        if (tokens == null || tokens.isEmpty()) {
            throw new NotFoundException("No FCM token found. Please enable push notifications first.");
        }

        Quote quote = dailyQuoteService.pickQuote();
        if (quote == null) {
            throw new NotFoundException("No quotes available");
        }

        PushResult result = pushNotificationService.sendToDevices(tokens, quote, "Test Daily Nugget", "test_notification");
        return new TestNotification(quote, result);
    }

    public static class TestNotification {
        private final Quote quote;
        private final PushResult result;

        TestNotification(Quote quote, PushResult result) {
            this.quote = quote;
            this.result = result;
        }

        public Quote getQuote() {
            return quote;
        }

        public PushResult getResult() {
            return result;
        }
    }
}
