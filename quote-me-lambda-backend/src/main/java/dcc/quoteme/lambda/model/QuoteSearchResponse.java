package dcc.quoteme.lambda.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;

public class QuoteSearchResponse {
    private final List<Quote> quotes;
    private final int total;
    @SerializedName("has_more")
    private final boolean hasMore;
    @SerializedName("last_key")
    private final String lastKey;

    public QuoteSearchResponse(List<Quote> quotes, int total, boolean hasMore, String lastKey) {
        this.quotes = quotes;
        this.total = total;
        this.hasMore = hasMore;
        this.lastKey = lastKey;
    }

    public List<Quote> getQuotes() {
        return quotes;
    }

    public int getTotal() {
        return total;
    }

    public boolean isHasMore() {
        return hasMore;
    }

    public String getLastKey() {
        return lastKey;
    }
}
