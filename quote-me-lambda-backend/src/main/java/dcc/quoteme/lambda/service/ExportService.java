package dcc.quoteme.lambda.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import dcc.quoteme.lambda.model.ExportResult;
import dcc.quoteme.lambda.model.ExportStatistics;
import dcc.quoteme.lambda.model.Quote;
import dcc.quoteme.lambda.repository.QuoteRepository;
import dcc.quoteme.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.zip.GZIPOutputStream;

/**
 * Exports every quote as gzip-compressed JSON or CSV to S3 and hands out a pre-signed link.
 */
public class ExportService {
    private static final Logger logger = LoggerFactory.getLogger(ExportService.class);

    public static final String FORMAT_JSON = "json";
    public static final String FORMAT_CSV = "csv";
    static final Duration LINK_VALIDITY = Duration.ofHours(48);
    static final String CSV_HEADER = "id,quote,author,tags,created_date,created_by";
    private static final DateTimeFormatter KEY_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final QuoteRepository quoteRepository;
    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final String bucketName;
    private final TimeProvider timeProvider;
    private final ObjectMapper objectMapper;

    public ExportService(QuoteRepository quoteRepository, S3Client s3Client, S3Presigner s3Presigner,
                         String bucketName, TimeProvider timeProvider) {
        this.quoteRepository = quoteRepository;
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.bucketName = bucketName;
        this.timeProvider = timeProvider;
        this.objectMapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Every stored quote, newest first.
     */
    public List<Quote> loadQuotes() {
        List<Quote> quotes = new ArrayList<>();
        for (Quote quote : quoteRepository.scanAll()) {
            if (quote.qualifiesAsQuote()) {
                quotes.add(quote);
            }
        }
        quotes.sort(Comparator.comparing((Quote q) -> q.getCreatedAt() != null ? q.getCreatedAt() : "").reversed());
        logger.info("Loaded {} quotes for export", quotes.size());
        return quotes;
    }

    public static ExportStatistics statistics(List<Quote> quotes) {
        Set<String> authors = new TreeSet<>();
        Set<String> tags = new TreeSet<>();
        for (Quote quote : quotes) {
            if (quote.getAuthor() != null) {
                authors.add(quote.getAuthor());
            }
            tags.addAll(quote.getTags());
        }
        return new ExportStatistics(quotes.size(), new ArrayList<>(authors), new ArrayList<>(tags));
    }

    public Map<String, Object> buildExportData(List<Quote> quotes, ExportStatistics statistics,
                                               String userEmail, String format, String exportType) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", timeProvider.now().toString());
        metadata.put("user", userEmail);
        metadata.put("format", format);
        metadata.put("type", exportType);
        metadata.put("total_quotes", statistics.getTotalQuotes());
        metadata.put("unique_authors", statistics.getUniqueAuthors());
        metadata.put("unique_tags", statistics.getUniqueTags());
        metadata.put("authors", statistics.getAuthors());
        metadata.put("tags", statistics.getTags());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("export_metadata", metadata);
        data.put("quotes", quotes);
        return data;
    }

    public ExportResult exportToS3(Map<String, Object> exportData, List<Quote> quotes,
                                   String userEmail, String exportType, String format) {
        String timestamp = KEY_TIMESTAMP.format(timeProvider.now());
        String extension = (FORMAT_CSV.equals(format) ? FORMAT_CSV : FORMAT_JSON) + ".gz";
        String key = "exports/" + userEmail + "/" + timestamp + "/" + exportType + "." + extension;

        try {
            String content = FORMAT_CSV.equals(format) ? renderCsv(quotes) : objectMapper.writeValueAsString(exportData);
            byte[] raw = content.getBytes(StandardCharsets.UTF_8);
            byte[] compressed = gzip(raw);

            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("user-email", userEmail);
            metadata.put("export-type", exportType);
            metadata.put("format", format);
            metadata.put("timestamp", timestamp);
            metadata.put("original-size", String.valueOf(raw.length));
            metadata.put("compressed-size", String.valueOf(compressed.length));

            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucketName)
                            .key(key)
                            .contentType("application/gzip")
                            .metadata(metadata)
                            .build(),
                    RequestBody.fromBytes(compressed));

            GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                    .signatureDuration(LINK_VALIDITY)
                    .getObjectRequest(GetObjectRequest.builder()
                            .bucket(bucketName)
                            .key(key)
                            .responseContentDisposition("attachment; filename=\"" + exportType + "_" + timestamp + "." + extension + "\"")
                            .build())
                    .build();
            String url = s3Presigner.presignGetObject(presignRequest).url().toString();

            logger.info("Exported {} quotes to s3://{}/{} ({} -> {} bytes)", quotes.size(), bucketName, key, raw.length, compressed.length);
            return new ExportResult(url, key, "48 hours", raw.length, compressed.length, format);
        } catch (Exception e) {
            logger.error("Failed to export to S3", e);
            throw new RuntimeException("Failed to export to S3: " + e.getMessage(), e);
        }
    }

    static String renderCsv(List<Quote> quotes) {
        StringBuilder csv = new StringBuilder(CSV_HEADER).append("\r\n");
        for (Quote quote : quotes) {
            csv.append(csvField(quote.getId())).append(',')
                    .append(csvField(quote.getQuote())).append(',')
                    .append(csvField(quote.getAuthor())).append(',')
                    .append(csvField(String.join(", ", quote.getTags()))).append(',')
                    .append(csvField(quote.getCreatedAt())).append(',')
                    .append(csvField(quote.getCreatedBy())).append("\r\n");
        }
        return csv.toString();
    }

    private static String csvField(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private static byte[] gzip(byte[] content) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            gzip.write(content);
        }
        return buffer.toByteArray();
    }
}
