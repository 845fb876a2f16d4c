package dcc.quoteme.lambda.repository;

import dcc.quoteme.lambda.util.EnvConfig;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The tags table is the registry of known tag names, keyed by {@code tag}.
 */
public class TagRepository {
    private final DynamoDbClient dynamoDb;
    private final String tableName;

    public TagRepository() {
        this(DynamoDbClient.create(), EnvConfig.get(EnvConfig.TAGS_TABLE_NAME, EnvConfig.DEFAULT_TAGS_TABLE));
    }

    public TagRepository(DynamoDbClient dynamoDb, String tableName) {
        this.dynamoDb = dynamoDb;
        this.tableName = tableName;
    }

    public Set<String> findAllTagNames() {
        ItemScan<String> scan = new ItemScan<>(dynamoDb,
                ScanRequest.builder().tableName(tableName).build(),
                item -> item.containsKey("tag") ? item.get("tag").s() : null);

        Set<String> names = new TreeSet<>();
        for (String name : scan) {
            if (name != null && !name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    public boolean exists(String tag) {
        GetItemResponse response = dynamoDb.getItem(GetItemRequest.builder()
                .tableName(tableName)
                .key(keyOf(tag))
                .build());
        return response.hasItem() && !response.item().isEmpty();
    }

    public void save(String tag, String createdAt, String createdBy) {
        dynamoDb.putItem(PutItemRequest.builder()
                .tableName(tableName)
                .item(Map.of(
                        "tag", AttributeValue.builder().s(tag).build(),
                        "created_at", AttributeValue.builder().s(createdAt).build(),
                        "created_by", AttributeValue.builder().s(createdBy).build()))
                .build());
    }

    public void delete(String tag) {
        dynamoDb.deleteItem(DeleteItemRequest.builder()
                .tableName(tableName)
                .key(keyOf(tag))
                .build());
    }

    private static Map<String, AttributeValue> keyOf(String tag) {
        return Map.of("tag", AttributeValue.builder().s(tag).build());
    }
}
