package dcc.quoteme.lambda.service;

import dcc.quoteme.lambda.model.ExportResult;
import dcc.quoteme.lambda.model.ExportStatistics;
import dcc.quoteme.lambda.model.Quote;
import dcc.quoteme.lambda.repository.ItemScan;
import dcc.quoteme.lambda.repository.QuoteRepository;
import dcc.quoteme.lambda.repository.TestScans;
import dcc.quoteme.lambda.util.MockTimeProvider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class ExportServiceTest {
    static final String EMAIL = "admin@example.com";

    @Mock
    QuoteRepository quoteRepositoryMock;

    @Mock
    S3Client s3ClientMock;

    @Mock
    S3Presigner s3PresignerMock;

    @Mock
    PresignedGetObjectRequest presignedRequestMock;

    ExportService exportService;

    @BeforeEach
    void setUp() {
        exportService = new ExportService(quoteRepositoryMock, s3ClientMock, s3PresignerMock, "exports-bucket",
                new MockTimeProvider(Instant.parse("2024-05-01T12:30:45Z")));
    }

    private static List<Quote> quotes() {
        Quote first = new Quote("q1", "Be yourself", "Oscar Wilde", List.of("Life", "Wisdom"));
        first.setCreatedAt("2024-01-01T00:00:00Z");
        first.setCreatedBy("admin");
        Quote second = new Quote("q2", "Well, \"hello\"", "Anonymous", List.of("Humor"));
        second.setCreatedAt("2024-02-01T00:00:00Z");
        return List.of(first, second);
    }

    private static String gunzip(RequestBody body) throws IOException {
        try (InputStream in = new GZIPInputStream(body.contentStreamProvider().newStream())) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Nested
    class LoadTests {
        @Test
        public void loadQuotes_ShouldExcludeSentinelsAndSortNewestFirst() {
            List<Quote> stored = new java.util.ArrayList<>(quotes());
            stored.add(new Quote(Quote.TAGS_METADATA_ID, null, null, List.of("Life")));
            ItemScan<Quote> scan = TestScans.of(stored);
            when(quoteRepositoryMock.scanAll()).thenReturn(scan);

            List<Quote> loaded = exportService.loadQuotes();

            Assertions.assertEquals(List.of("q2", "q1"), loaded.stream().map(Quote::getId).collect(Collectors.toList()));
        }

        @Test
        public void statistics_ShouldCountDistinctSortedAuthorsAndTags() {
            ExportStatistics statistics = ExportService.statistics(quotes());

            Assertions.assertEquals(2, statistics.getTotalQuotes());
            Assertions.assertEquals(List.of("Anonymous", "Oscar Wilde"), statistics.getAuthors());
            Assertions.assertEquals(List.of("Humor", "Life", "Wisdom"), statistics.getTags());
            Assertions.assertEquals(3, statistics.getUniqueTags());
        }

        @Test
        @SuppressWarnings("unchecked")
        public void buildExportData_ShouldIncludeMetadata() {
            Map<String, Object> data = exportService.buildExportData(quotes(), ExportService.statistics(quotes()), EMAIL, "json", "quotes");

            Map<String, Object> metadata = (Map<String, Object>) data.get("export_metadata");
            Assertions.assertEquals("2024-05-01T12:30:45Z", metadata.get("timestamp"));
            Assertions.assertEquals(EMAIL, metadata.get("user"));
            Assertions.assertEquals(2, metadata.get("unique_authors"));
            Assertions.assertEquals(2, ((List<Quote>) data.get("quotes")).size());
        }
    }

    @Nested
    class CsvTests {
        @Test
        public void renderCsv_ShouldQuoteFieldsWithCommasAndQuotes() {
            String csv = ExportService.renderCsv(quotes());

            String[] lines = csv.split("\r\n");
            Assertions.assertEquals("id,quote,author,tags,created_date,created_by", lines[0]);
            Assertions.assertEquals("q1,Be yourself,Oscar Wilde,\"Life, Wisdom\",2024-01-01T00:00:00Z,admin", lines[1]);
            Assertions.assertEquals("q2,\"Well, \"\"hello\"\"\",Anonymous,Humor,2024-02-01T00:00:00Z,", lines[2]);
        }
    }

    @Nested
    class S3Tests {
        @Test
        public void exportToS3_Json_ShouldUploadGzipAndPresignForFortyEightHours() throws Exception {
            // Arrange
            when(s3PresignerMock.presignGetObject(any(GetObjectPresignRequest.class))).thenReturn(presignedRequestMock);
            when(presignedRequestMock.url()).thenReturn(new URL("https://exports-bucket.s3.amazonaws.com/signed"));
            Map<String, Object> data = exportService.buildExportData(quotes(), ExportService.statistics(quotes()), EMAIL, "json", "quotes");

            // Act
            ExportResult result = exportService.exportToS3(data, quotes(), EMAIL, "quotes", "json");

            // Assert
            String expectedKey = "exports/admin@example.com/20240501_123045/quotes.json.gz";
            Assertions.assertEquals(expectedKey, result.getKey());
            Assertions.assertEquals("https://exports-bucket.s3.amazonaws.com/signed", result.getUrl());
            Assertions.assertEquals("48 hours", result.getExpiresIn());

            ArgumentCaptor<PutObjectRequest> putCaptor = ArgumentCaptor.forClass(PutObjectRequest.class);
            ArgumentCaptor<RequestBody> bodyCaptor = ArgumentCaptor.forClass(RequestBody.class);
            verify(s3ClientMock).putObject(putCaptor.capture(), bodyCaptor.capture());
            Assertions.assertEquals("exports-bucket", putCaptor.getValue().bucket());
            Assertions.assertEquals(expectedKey, putCaptor.getValue().key());
            Assertions.assertEquals(EMAIL, putCaptor.getValue().metadata().get("user-email"));
            Assertions.assertEquals(String.valueOf(result.getCompressedSize()), putCaptor.getValue().metadata().get("compressed-size"));

            String json = gunzip(bodyCaptor.getValue());
            Assertions.assertTrue(json.contains("\"export_metadata\""));
            Assertions.assertTrue(json.contains("\"created_at\" : \"2024-01-01T00:00:00Z\""));
            Assertions.assertEquals(json.getBytes(StandardCharsets.UTF_8).length, result.getOriginalSize());

            ArgumentCaptor<GetObjectPresignRequest> presignCaptor = ArgumentCaptor.forClass(GetObjectPresignRequest.class);
            verify(s3PresignerMock).presignGetObject(presignCaptor.capture());
            Assertions.assertEquals(Duration.ofHours(48), presignCaptor.getValue().signatureDuration());
            Assertions.assertTrue(presignCaptor.getValue().getObjectRequest().responseContentDisposition().startsWith("attachment;"));
        }

        @Test
        public void exportToS3_Csv_ShouldUseCsvExtension() throws Exception {
            when(s3PresignerMock.presignGetObject(any(GetObjectPresignRequest.class))).thenReturn(presignedRequestMock);
            when(presignedRequestMock.url()).thenReturn(new URL("https://exports-bucket.s3.amazonaws.com/signed"));

            ExportResult result = exportService.exportToS3(Map.of(), quotes(), EMAIL, "quotes", "csv");

            Assertions.assertTrue(result.getKey().endsWith("/quotes.csv.gz"));
            ArgumentCaptor<RequestBody> bodyCaptor = ArgumentCaptor.forClass(RequestBody.class);
            verify(s3ClientMock).putObject(any(PutObjectRequest.class), bodyCaptor.capture());
            Assertions.assertTrue(gunzip(bodyCaptor.getValue()).startsWith("id,quote,author,tags,created_date,created_by\r\n"));
        }

        @Test
        public void exportToS3_UploadFails_ShouldWrapError() {
            when(s3ClientMock.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                    .thenThrow(S3Exception.builder().message("Access Denied").build());

            RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                    () -> exportService.exportToS3(Map.of(), quotes(), EMAIL, "quotes", "json"));

            Assertions.assertTrue(e.getMessage().startsWith("Failed to export to S3: "));
            verifyNoInteractions(s3PresignerMock);
        }
    }
}
