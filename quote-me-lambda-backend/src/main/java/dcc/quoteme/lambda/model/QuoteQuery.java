package dcc.quoteme.lambda.model;

import java.util.List;
import java.util.Map;

/**
 * Listing parameters shared by the admin list and search routes.
 */
public class QuoteQuery {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 1000;
    public static final List<String> SORT_FIELDS = List.of("quote", "author", "created_at", "updated_at");
    public static final List<String> SORT_ORDERS = List.of("asc", "desc");

    private final int limit;
    private final String sortBy;
    private final String sortOrder;
    private final String lastKey;

    public QuoteQuery(int limit, String sortBy, String sortOrder, String lastKey) {
        if (!SORT_FIELDS.contains(sortBy)) {
            throw new IllegalArgumentException("Invalid sort field");
        }
        if (!SORT_ORDERS.contains(sortOrder)) {
            throw new IllegalArgumentException("Invalid sort order");
        }
        this.limit = Math.max(1, Math.min(limit, MAX_LIMIT));
        this.sortBy = sortBy;
        this.sortOrder = sortOrder;
        this.lastKey = lastKey;
    }

    public static QuoteQuery fromParameters(Map<String, String> parameters) {
        Map<String, String> params = parameters != null ? parameters : Map.of();

        int limit = DEFAULT_LIMIT;
        String rawLimit = params.get("limit");
        if (rawLimit != null && !rawLimit.isEmpty()) {
            try {
                limit = Integer.parseInt(rawLimit);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid limit: " + rawLimit);
            }
        }

        String lastKey = params.get("last_key");
        return new QuoteQuery(limit,
                params.getOrDefault("sort_by", "created_at"),
                params.getOrDefault("sort_order", "desc"),
                lastKey == null || lastKey.isEmpty() ? null : lastKey);
    }

    public int getLimit() {
        return limit;
    }

    public String getSortBy() {
        return sortBy;
    }

    public String getSortOrder() {
        return sortOrder;
    }

    public boolean isDescending() {
        return "desc".equals(sortOrder);
    }

    /**
     * Id of the last quote of the previous page, or null for the first page.
     */
    public String getLastKey() {
        return lastKey;
    }
}
