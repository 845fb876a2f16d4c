package dcc.quoteme.lambda.repository;

import dcc.quoteme.lambda.mapper.QuoteItemMapper;
import dcc.quoteme.lambda.model.OAuthSuccessFlag;
import dcc.quoteme.lambda.model.Quote;
import dcc.quoteme.lambda.util.EnvConfig;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class QuoteRepository {
    private final DynamoDbClient dynamoDb;
    private final String tableName;

    public QuoteRepository() {
        this(DynamoDbClient.create(), EnvConfig.get(EnvConfig.QUOTES_TABLE_NAME, EnvConfig.DEFAULT_QUOTES_TABLE));
    }

    public QuoteRepository(DynamoDbClient dynamoDb, String tableName) {
        this.dynamoDb = dynamoDb;
        this.tableName = tableName;
    }

    /**
     * Every item in the quotes table, sentinels included. Callers filter with
     * {@link Quote#qualifiesAsQuote()}.
     */
    public ItemScan<Quote> scanAll() {
        return new ItemScan<>(dynamoDb, ScanRequest.builder().tableName(tableName).build(), QuoteItemMapper::toQuote);
    }

    /**
     * A single scan page of at most {@code limit} items, restricted to real quotes.
     */
    public List<Quote> sampleQuotes(int limit) {
        ScanResponse response = dynamoDb.scan(ScanRequest.builder()
                .tableName(tableName)
                .limit(limit)
                .build());

        return response.items().stream()
                .map(QuoteItemMapper::toQuote)
                .filter(Quote::qualifiesAsQuote)
                .collect(Collectors.toList());
    }

    public Quote findById(String id) {
        GetItemResponse response = dynamoDb.getItem(GetItemRequest.builder()
                .tableName(tableName)
                .key(keyOf(id))
                .build());
        if (!response.hasItem() || response.item().isEmpty()) {
            return null;
        }
        return QuoteItemMapper.toQuote(response.item());
    }

    public void save(Quote quote) {
        dynamoDb.putItem(PutItemRequest.builder()
                .tableName(tableName)
                .item(QuoteItemMapper.toItem(quote))
                .build());
    }

    public void delete(String id) {
        dynamoDb.deleteItem(DeleteItemRequest.builder()
                .tableName(tableName)
                .key(keyOf(id))
                .build());
    }

    public void updateImageUrl(String id, String imageUrl, String updatedAt) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":url", AttributeValue.builder().s(imageUrl).build());
        values.put(":updated", AttributeValue.builder().s(updatedAt).build());

        dynamoDb.updateItem(UpdateItemRequest.builder()
                .tableName(tableName)
                .key(keyOf(id))
                .updateExpression("SET image_url = :url, updated_at = :updated")
                .expressionAttributeValues(values)
                .build());
    }

    public List<String> getTagsMetadata() {
        GetItemResponse response = dynamoDb.getItem(GetItemRequest.builder()
                .tableName(tableName)
                .key(keyOf(Quote.TAGS_METADATA_ID))
                .build());
        if (!response.hasItem()) {
            return new ArrayList<>();
        }
        return QuoteItemMapper.stringList(response.item().get("tags"));
    }

    public void saveTagsMetadata(List<String> tags, String updatedAt) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put("id", AttributeValue.builder().s(Quote.TAGS_METADATA_ID).build());
        item.put("tags", QuoteItemMapper.tagList(tags));
        item.put("updated_at", AttributeValue.builder().s(updatedAt).build());

        dynamoDb.putItem(PutItemRequest.builder()
                .tableName(tableName)
                .item(item)
                .build());
    }

    public void saveOAuthSuccessFlag(OAuthSuccessFlag flag, long createdAtEpochSeconds) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put("id", AttributeValue.builder().s(flag.getKey()).build());
        item.put("token_type", AttributeValue.builder().s(flag.getTokenType()).build());
        item.put("user_email", AttributeValue.builder().s(flag.getUserEmail()).build());
        item.put("user_sub", AttributeValue.builder().s(flag.getUserSub()).build());
        item.put("created_at", AttributeValue.builder().n(String.valueOf(createdAtEpochSeconds)).build());
        item.put("ttl", AttributeValue.builder().n(String.valueOf(createdAtEpochSeconds + OAuthSuccessFlag.TTL_SECONDS)).build());

        dynamoDb.putItem(PutItemRequest.builder()
                .tableName(tableName)
                .item(item)
                .build());
    }

    public OAuthSuccessFlag findOAuthSuccessFlag(String key) {
        GetItemResponse response = dynamoDb.getItem(GetItemRequest.builder()
                .tableName(tableName)
                .key(keyOf(key))
                .build());
        if (!response.hasItem() || response.item().isEmpty()) {
            return null;
        }

        Map<String, AttributeValue> item = response.item();
        return new OAuthSuccessFlag(key, stringOrNull(item, "token_type"),
                stringOrNull(item, "user_email"), stringOrNull(item, "user_sub"));
    }

    private static String stringOrNull(Map<String, AttributeValue> item, String name) {
        AttributeValue value = item.get(name);
        return value != null ? value.s() : null;
    }

    private static Map<String, AttributeValue> keyOf(String id) {
        Map<String, AttributeValue> key = new HashMap<>();
        key.put("id", AttributeValue.builder().s(id).build());
        return key;
    }
}
