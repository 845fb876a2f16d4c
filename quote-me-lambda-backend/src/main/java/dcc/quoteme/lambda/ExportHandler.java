package dcc.quoteme.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.google.gson.JsonObject;
import com.google.gson.JsonSyntaxException;
import dcc.quoteme.lambda.model.ExportResult;
import dcc.quoteme.lambda.model.ExportStatistics;
import dcc.quoteme.lambda.model.Quote;
import dcc.quoteme.lambda.model.UserClaims;
import dcc.quoteme.lambda.repository.QuoteRepository;
import dcc.quoteme.lambda.service.ExportService;
import dcc.quoteme.lambda.util.AuditLogger;
import dcc.quoteme.lambda.util.ClaimsExtractor;
import dcc.quoteme.lambda.util.EnvConfig;
import dcc.quoteme.lambda.util.SystemTimeProvider;
import org.apache.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dcc.quoteme.lambda.util.ApiResponses.json;
import static dcc.quoteme.lambda.util.ApiResponses.options;
import static dcc.quoteme.lambda.util.RequestUtil.header;
import static dcc.quoteme.lambda.util.RequestUtil.jsonBody;
import static dcc.quoteme.lambda.util.RequestUtil.stringField;

/**
 * Exports the quote collection either to a gzip file in S3 behind a pre-signed link or straight
 * into the response for clipboard and download use.
 */
public class ExportHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {
    private static final Logger logger = LoggerFactory.getLogger(ExportHandler.class);

    static final Set<String> ALLOWED_ORIGINS = Set.of(
            "https://quote-me.anystupididea.com",
            "https://dcc.anystupididea.com",
            "http://localhost:3000",
            "http://127.0.0.1:3000");
    static final String DESTINATION_S3 = "s3";
    static final Set<String> INLINE_DESTINATIONS = Set.of("clipboard", "download");

    private final ExportService exportService;

    public ExportHandler() {
        this(new ExportService(new QuoteRepository(), S3Client.create(), S3Presigner.create(),
                EnvConfig.get(EnvConfig.EXPORT_BUCKET, EnvConfig.DEFAULT_EXPORT_BUCKET), new SystemTimeProvider()));
    }

    public ExportHandler(ExportService exportService) {
        this.exportService = exportService;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent event, Context context) {
        Map<String, String> corsHeaders = corsHeaders(header(event, "Origin"));
        if ("OPTIONS".equals(event.getHttpMethod())) {
            return options(corsHeaders);
        }

        UserClaims claims = ClaimsExtractor.fromEvent(event);
        String userEmail = claims.hasEmail() ? claims.getEmail() : "unknown";

        try {
            JsonObject body = jsonBody(event);
            String exportType = defaultIfBlank(stringField(body, "type"), "quotes");
            String format = defaultIfBlank(stringField(body, "format"), ExportService.FORMAT_JSON);
            String destination = defaultIfBlank(stringField(body, "destination"), DESTINATION_S3);
            logger.info("Export request: type={}, format={}, destination={}, user={}", exportType, format, destination, userEmail);

            if (!ExportService.FORMAT_JSON.equals(format) && !ExportService.FORMAT_CSV.equals(format)) {
                return failure(HttpStatus.SC_BAD_REQUEST, "Invalid format: " + format, null, corsHeaders);
            }
            if (!DESTINATION_S3.equals(destination) && !INLINE_DESTINATIONS.contains(destination)) {
                return failure(HttpStatus.SC_BAD_REQUEST, "Invalid destination: " + destination, null, corsHeaders);
            }

            List<Quote> quotes = exportService.loadQuotes();
            ExportStatistics statistics = ExportService.statistics(quotes);
            Map<String, Object> exportData = exportService.buildExportData(quotes, statistics, userEmail, format, exportType);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            if (DESTINATION_S3.equals(destination)) {
                ExportResult result = exportService.exportToS3(exportData, quotes, userEmail, exportType, format);

                Map<String, Object> size = new LinkedHashMap<>();
                size.put("original", result.getOriginalSize());
                size.put("compressed", result.getCompressedSize());

                response.put("message", "Export completed successfully");
                response.put("download_url", result.getUrl());
                response.put("s3_key", result.getKey());
                response.put("expires_in", result.getExpiresIn());
                response.put("size", size);
            } else {
                response.put("destination", destination);
                response.put("data", exportData);
            }
            response.put("statistics", statistics);

            AuditLogger.success(logger, "export", "export_quotes", userEmail,
                    Map.of("destination", destination, "format", format, "quoteCount", quotes.size()));
            return json(HttpStatus.SC_OK, response, corsHeaders);
        } catch (JsonSyntaxException e) {
            return failure(HttpStatus.SC_BAD_REQUEST, "Invalid JSON in request body", null, corsHeaders);
        } catch (Exception e) {
            logger.error("Export error", e);
            AuditLogger.failure(logger, "export", "export_quotes", userEmail, e.getMessage(), "EXPORT_FAILED");
            return failure(HttpStatus.SC_INTERNAL_SERVER_ERROR, "Export failed", e.getMessage(), corsHeaders);
        }
    }

    static Map<String, String> corsHeaders(String origin) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Access-Control-Allow-Origin", origin != null && ALLOWED_ORIGINS.contains(origin) ? origin : "*");
        headers.put("Access-Control-Allow-Headers", "Content-Type,Authorization");
        headers.put("Access-Control-Allow-Methods", "OPTIONS,POST,GET");
        headers.put("Access-Control-Allow-Credentials", "true");
        return headers;
    }

    private static APIGatewayProxyResponseEvent failure(int statusCode, String message, String error, Map<String, String> corsHeaders) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", message);
        if (error != null) {
            body.put("error", error);
        }
        return json(statusCode, body, corsHeaders);
    }

    private static String defaultIfBlank(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
