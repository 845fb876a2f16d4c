package dcc.quoteme.lambda;

import dcc.quoteme.lambda.client.FcmClient;
import dcc.quoteme.lambda.repository.QuoteRepository;
import dcc.quoteme.lambda.repository.SubscriptionRepository;
import dcc.quoteme.lambda.service.*;
import dcc.quoteme.lambda.template.DailyNuggetEmailRenderer;
import dcc.quoteme.lambda.util.EnvConfig;
import dcc.quoteme.lambda.util.SystemTimeProvider;
import dcc.quoteme.lambda.util.TimeProvider;
import software.amazon.awssdk.services.ses.SesClient;

import java.util.Random;

/**
 * Production object graph shared by the Daily Nuggets API and the scheduled delivery.
 */
final class DailyNuggetsWiring {
    private DailyNuggetsWiring() {
    }

    static SubscriptionService subscriptionService() {
        return new SubscriptionService(new SubscriptionRepository(), new SystemTimeProvider());
    }

    static DailyDeliveryService dailyDeliveryService() {
        TimeProvider timeProvider = new SystemTimeProvider();
        String webAppUrl = EnvConfig.get(EnvConfig.WEB_APP_URL, EnvConfig.DEFAULT_WEB_APP_URL);

        EmailService emailService = new EmailService(SesClient.create(),
                EnvConfig.get(EnvConfig.SENDER_EMAIL, EnvConfig.DEFAULT_SENDER_EMAIL),
                new DailyNuggetEmailRenderer(webAppUrl), timeProvider);
        PushNotificationService pushService = new PushNotificationService(
                new FcmClient(EnvConfig.get(EnvConfig.FCM_SERVICE_ACCOUNT_JSON)));

        return new DailyDeliveryService(new SubscriptionRepository(),
                new DailyQuoteService(new QuoteRepository(), new Random()),
                emailService, pushService, new DeliveryScheduler(timeProvider));
    }
}
