package dcc.quoteme.lambda.util;

import org.slf4j.Logger;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes audit events as single-line JSON so they can be queried in CloudWatch Logs Insights.
 */
public final class AuditLogger {
    private AuditLogger() {
    }

    public static void success(Logger logger, String event, String action, String requestingUser, Map<String, Object> details) {
        log(logger, "INFO", event, action, "success", requestingUser, null, details);
    }

    public static void failure(Logger logger, String event, String action, String requestingUser,
                               String errorMessage, String errorCode) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (errorCode != null) {
            details.put("errorCode", errorCode);
        }
        log(logger, "ERROR", event, action, "failure", requestingUser, errorMessage, details);
    }

    public static void log(Logger logger, String level, String event, String action, String result,
                           String requestingUser, String errorMessage, Map<String, Object> details) {
        Map<String, Object> auditLog = new LinkedHashMap<>();
        auditLog.put("timestamp", Instant.now().toString());
        auditLog.put("level", level);
        auditLog.put("event", event);
        auditLog.put("action", action);
        auditLog.put("result", result);

        if (requestingUser != null) {
            auditLog.put("requestingUser", requestingUser);
        }
        if (details != null) {
            auditLog.putAll(details);
        }
        if (errorMessage != null) {
            auditLog.put("errorMessage", errorMessage);
        }

        String jsonLog = ApiResponses.gson().toJson(auditLog);
        switch (level) {
            case "ERROR" -> logger.error("AUDIT: {}", jsonLog);
            case "WARN" -> logger.warn("AUDIT: {}", jsonLog);
            default -> logger.info("AUDIT: {}", jsonLog);
        }
    }
}
