package dcc.quoteme.lambda.repository;

import dcc.quoteme.lambda.model.OAuthSuccessFlag;
import dcc.quoteme.lambda.model.Quote;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class QuoteRepositoryTest {

    @Mock
    DynamoDbClient dynamoDbMock;

    QuoteRepository repository;

    @BeforeEach
    void setUp() {
        repository = new QuoteRepository(dynamoDbMock, "quotes");
    }

    private static Map<String, AttributeValue> quoteItem(String id, String text, String author) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put("id", AttributeValue.builder().s(id).build());
        item.put("quote", AttributeValue.builder().s(text).build());
        item.put("author", AttributeValue.builder().s(author).build());
        item.put("tags", AttributeValue.builder().ss("Wisdom", "Life").build());
        return item;
    }

    @Nested
    class ReadTests {
        @Test
        public void findById_Missing_ShouldReturnNull() {
            when(dynamoDbMock.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

            Assertions.assertNull(repository.findById("nope"));
        }

        @Test
        public void findById_Present_ShouldMapStringSetTags() {
            when(dynamoDbMock.getItem(any(GetItemRequest.class)))
                    .thenReturn(GetItemResponse.builder().item(quoteItem("q1", "Be yourself", "Oscar Wilde")).build());

            Quote quote = repository.findById("q1");

            Assertions.assertEquals("Be yourself", quote.getQuote());
            Assertions.assertEquals(List.of("Wisdom", "Life"), quote.getTags());
        }

        @Test
        public void sampleQuotes_ShouldExcludeSentinelsAndLimitScan() {
            // Arrange
            Map<String, AttributeValue> metadata = new HashMap<>();
            metadata.put("id", AttributeValue.builder().s(Quote.TAGS_METADATA_ID).build());
            Map<String, AttributeValue> job = quoteItem("job-1", "pending", "system");
            job.put("type", AttributeValue.builder().s(Quote.IMAGE_GENERATION_JOB_TYPE).build());
            when(dynamoDbMock.scan(any(ScanRequest.class))).thenReturn(ScanResponse.builder()
                    .items(List.of(metadata, job, quoteItem("q1", "Be yourself", "Oscar Wilde")))
                    .build());

            // Act
            List<Quote> quotes = repository.sampleQuotes(1000);

            // Assert
            Assertions.assertEquals(1, quotes.size());
            Assertions.assertEquals("q1", quotes.get(0).getId());
            ArgumentCaptor<ScanRequest> captor = ArgumentCaptor.forClass(ScanRequest.class);
            verify(dynamoDbMock).scan(captor.capture());
            Assertions.assertEquals(1000, captor.getValue().limit());
        }

        @Test
        public void getTagsMetadata_ShouldReadListAttribute() {
            Map<String, AttributeValue> item = new HashMap<>();
            item.put("id", AttributeValue.builder().s(Quote.TAGS_METADATA_ID).build());
            item.put("tags", AttributeValue.builder().l(
                    AttributeValue.builder().s("Humor").build(),
                    AttributeValue.builder().s("Life").build()).build());
            when(dynamoDbMock.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().item(item).build());

            Assertions.assertEquals(List.of("Humor", "Life"), repository.getTagsMetadata());
        }
    }

    @Nested
    class WriteTests {
        @Test
        public void save_ShouldWriteTagsAsList() {
            Quote quote = new Quote("q1", "Be yourself", "Oscar Wilde", List.of("Life"));
            quote.setCreatedAt("2024-01-01T00:00:00Z");

            repository.save(quote);

            ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
            verify(dynamoDbMock).putItem(captor.capture());
            Map<String, AttributeValue> item = captor.getValue().item();
            Assertions.assertEquals("quotes", captor.getValue().tableName());
            Assertions.assertEquals("Life", item.get("tags").l().get(0).s());
            Assertions.assertEquals("2024-01-01T00:00:00Z", item.get("created_at").s());
            Assertions.assertFalse(item.containsKey("image_url"));
        }

        @Test
        public void updateImageUrl_ShouldSetUrlAndTimestamp() {
            repository.updateImageUrl("q1", "https://img/1.png", "2024-02-02T00:00:00Z");

            ArgumentCaptor<UpdateItemRequest> captor = ArgumentCaptor.forClass(UpdateItemRequest.class);
            verify(dynamoDbMock).updateItem(captor.capture());
            Assertions.assertEquals("SET image_url = :url, updated_at = :updated", captor.getValue().updateExpression());
            Assertions.assertEquals("https://img/1.png", captor.getValue().expressionAttributeValues().get(":url").s());
        }

        @Test
        public void saveOAuthSuccessFlag_ShouldExpireAfterFiveMinutes() {
            OAuthSuccessFlag flag = new OAuthSuccessFlag("oauth_success_1700000000_12345678",
                    OAuthSuccessFlag.TOKEN_TYPE, "user@example.com", "sub-12345678");

            repository.saveOAuthSuccessFlag(flag, 1_700_000_000L);

            ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
            verify(dynamoDbMock).putItem(captor.capture());
            Map<String, AttributeValue> item = captor.getValue().item();
            Assertions.assertEquals("1700000300", item.get("ttl").n());
            Assertions.assertEquals("oauth_success", item.get("token_type").s());
        }
    }
}
