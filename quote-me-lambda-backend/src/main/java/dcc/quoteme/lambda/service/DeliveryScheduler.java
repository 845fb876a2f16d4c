package dcc.quoteme.lambda.service;

import dcc.quoteme.lambda.model.NotificationPreferences;
import dcc.quoteme.lambda.model.Subscription;
import dcc.quoteme.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the subscribers whose preferred local delivery hour falls on a given UTC hour. Offsets
 * come from the IANA zone rules for today's date, so daylight saving time is honoured.
 */
public class DeliveryScheduler {
    private static final Logger logger = LoggerFactory.getLogger(DeliveryScheduler.class);
    static final ZoneId FALLBACK_ZONE = ZoneId.of(Subscription.DEFAULT_TIMEZONE);

    private final TimeProvider timeProvider;

    public DeliveryScheduler(TimeProvider timeProvider) {
        this.timeProvider = timeProvider;
    }

    public List<Subscription> dueAt(List<Subscription> subscribers, int hourUtc) {
        LocalDate today = LocalDate.ofInstant(timeProvider.now(), ZoneOffset.UTC);

        List<Subscription> due = new ArrayList<>();
        for (Subscription subscriber : subscribers) {
            NotificationPreferences preferences = subscriber.getNotificationPreferences();
            int deliveryHour = preferences != null ? preferences.getDeliveryHour() : NotificationPreferences.DEFAULT_DELIVERY_HOUR;
            int localHour = localHour(subscriber.getTimezone(), hourUtc, today);

            if (localHour == deliveryHour) {
                logger.info("Will send to {} - {} local hour {} matches preference", subscriber.getEmail(), subscriber.getTimezone(), localHour);
                due.add(subscriber);
            } else {
                logger.debug("Skipping {} - {} local hour {} != preference {}", subscriber.getEmail(), subscriber.getTimezone(), localHour, deliveryHour);
            }
        }
        return due;
    }

    static int localHour(String timezone, int hourUtc, LocalDate date) {
        ZonedDateTime utc = date.atTime(Math.floorMod(hourUtc, 24), 0).atZone(ZoneOffset.UTC);
        return utc.withZoneSameInstant(zoneOf(timezone)).getHour();
    }

    static ZoneId zoneOf(String timezone) {
        if (timezone == null || timezone.isEmpty()) {
            return FALLBACK_ZONE;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            logger.warn("Unknown timezone '{}', using {}", timezone, FALLBACK_ZONE);
            return FALLBACK_ZONE;
        }
    }
}
