package dcc.quoteme.lambda.repository;

import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Lazily walks every page of a DynamoDB scan, following {@code LastEvaluatedKey} until the table
 * is exhausted. Pages are fetched on demand and each item is mapped as it is reached.
 * <p>
 * A scan can be iterated only once; a second call to {@link #iterator()} throws
 * {@link IllegalStateException}. Errors from DynamoDB surface from {@code hasNext()}.
 */
public class ItemScan<T> implements Iterable<T> {
    private final DynamoDbClient dynamoDb;
    private final ScanRequest baseRequest;
    private final Function<Map<String, AttributeValue>, T> mapper;
    private boolean consumed;

    public ItemScan(DynamoDbClient dynamoDb, ScanRequest baseRequest, Function<Map<String, AttributeValue>, T> mapper) {
        this.dynamoDb = dynamoDb;
        this.baseRequest = baseRequest;
        this.mapper = mapper;
    }

    @Override
    public synchronized Iterator<T> iterator() {
        if (consumed) {
            throw new IllegalStateException("Scan of " + baseRequest.tableName() + " has already been iterated");
        }
        consumed = true;
        return new PageIterator();
    }

    private class PageIterator implements Iterator<T> {
        private Iterator<Map<String, AttributeValue>> currentPage = Collections.emptyIterator();
        private Map<String, AttributeValue> nextStartKey;
        private boolean lastPageFetched;

        @Override
        public boolean hasNext() {
            while (!currentPage.hasNext()) {
                if (lastPageFetched) {
                    return false;
                }
                fetchNextPage();
            }
            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return mapper.apply(currentPage.next());
        }

        private void fetchNextPage() {
            ScanRequest.Builder request = baseRequest.toBuilder();
            if (nextStartKey != null) {
                request.exclusiveStartKey(nextStartKey);
            }

            ScanResponse response = dynamoDb.scan(request.build());
            currentPage = response.items().iterator();

            if (response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()) {
                nextStartKey = response.lastEvaluatedKey();
            } else {
                lastPageFetched = true;
            }
        }
    }
}
