package dcc.quoteme.lambda.repository;

import dcc.quoteme.lambda.mapper.SubscriptionItemMapper;
import dcc.quoteme.lambda.model.Subscription;
import dcc.quoteme.lambda.util.EnvConfig;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class SubscriptionRepository {
    private final DynamoDbClient dynamoDb;
    private final String tableName;

    public SubscriptionRepository() {
        this(DynamoDbClient.create(), EnvConfig.get(EnvConfig.SUBSCRIPTIONS_TABLE_NAME, EnvConfig.DEFAULT_SUBSCRIPTIONS_TABLE));
    }

    public SubscriptionRepository(DynamoDbClient dynamoDb, String tableName) {
        this.dynamoDb = dynamoDb;
        this.tableName = tableName;
    }

    public Subscription findByEmail(String email) {
        GetItemResponse response = dynamoDb.getItem(GetItemRequest.builder()
                .tableName(tableName)
                .key(keyOf(email))
                .build());
        if (!response.hasItem() || response.item().isEmpty()) {
            return null;
        }
        return SubscriptionItemMapper.toSubscription(response.item());
    }

    public void save(Subscription subscription) {
        dynamoDb.putItem(PutItemRequest.builder()
                .tableName(tableName)
                .item(SubscriptionItemMapper.toItem(subscription))
                .build());
    }

    public void delete(String email) {
        dynamoDb.deleteItem(DeleteItemRequest.builder()
                .tableName(tableName)
                .key(keyOf(email))
                .build());
    }

    public List<Subscription> findAll() {
        return drain(ScanRequest.builder().tableName(tableName).build());
    }

    public List<Subscription> findActiveEmailSubscribers() {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":subscribed", AttributeValue.builder().bool(true).build());
        values.put(":method", AttributeValue.builder().s(Subscription.DELIVERY_EMAIL).build());

        return drain(ScanRequest.builder()
                .tableName(tableName)
                .filterExpression("is_subscribed = :subscribed AND delivery_method = :method")
                .expressionAttributeValues(values)
                .build());
    }

    private List<Subscription> drain(ScanRequest request) {
        List<Subscription> subscriptions = new ArrayList<>();
        for (Subscription subscription : new ItemScan<>(dynamoDb, request, SubscriptionItemMapper::toSubscription)) {
            subscriptions.add(subscription);
        }
        return subscriptions;
    }

    private static Map<String, AttributeValue> keyOf(String email) {
        return Map.of("email", AttributeValue.builder().s(email).build());
    }
}
