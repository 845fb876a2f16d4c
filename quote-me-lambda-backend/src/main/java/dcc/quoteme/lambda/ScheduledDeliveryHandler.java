package dcc.quoteme.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.ScheduledEvent;
import dcc.quoteme.lambda.model.DeliveryResult;
import dcc.quoteme.lambda.service.DailyDeliveryService;
import dcc.quoteme.lambda.util.ApiResponses;
import org.apache.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hourly EventBridge target. The rule passes the UTC hour it fires for as {@code detail.hour_utc}.
 */
public class ScheduledDeliveryHandler implements RequestHandler<ScheduledEvent, Map<String, Object>> {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledDeliveryHandler.class);

    private final DailyDeliveryService dailyDeliveryService;

    public ScheduledDeliveryHandler() {
        this(DailyNuggetsWiring.dailyDeliveryService());
    }

    public ScheduledDeliveryHandler(DailyDeliveryService dailyDeliveryService) {
        this.dailyDeliveryService = dailyDeliveryService;
    }

    @Override
    public Map<String, Object> handleRequest(ScheduledEvent event, Context context) {
        try {
            int hourUtc = hourUtc(event.getDetail());
            DeliveryResult result = dailyDeliveryService.deliver(hourUtc);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message", "Daily delivery complete for UTC hour " + result.getHourUtc());
            body.put("sent", result.getSent());
            body.put("failed", result.getFailed());
            return result(HttpStatus.SC_OK, body);
        } catch (Exception e) {
            logger.error("Error in scheduled delivery", e);
            return result(HttpStatus.SC_INTERNAL_SERVER_ERROR, Map.of("error", e.getMessage() != null ? e.getMessage() : "Delivery failed"));
        }
    }

    static int hourUtc(Map<String, Object> detail) {
        Object raw = detail != null ? detail.get("hour_utc") : null;
        if (raw == null) {
            return 0;
        }
        int hour = raw instanceof Number ? ((Number) raw).intValue() : Integer.parseInt(raw.toString().trim());
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour_utc out of range: " + hour);
        }
        return hour;
    }

    private static Map<String, Object> result(int statusCode, Map<String, Object> body) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("statusCode", statusCode);
        response.put("body", ApiResponses.gson().toJson(body));
        return response;
    }
}
