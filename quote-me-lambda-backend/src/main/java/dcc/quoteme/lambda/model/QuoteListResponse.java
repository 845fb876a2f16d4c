package dcc.quoteme.lambda.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;

public class QuoteListResponse {
    private List<Quote> quotes;
    @SerializedName("total_count")
    private int totalCount;
    private int count;
    @SerializedName("has_more")
    private boolean hasMore;
    @SerializedName("last_key")
    private String lastKey;

    public QuoteListResponse() {
    }

    public QuoteListResponse(List<Quote> quotes, int totalCount, boolean hasMore, String lastKey) {
        this.quotes = quotes;
        this.totalCount = totalCount;
        this.count = quotes.size();
        this.hasMore = hasMore;
        this.lastKey = lastKey;
    }

    public List<Quote> getQuotes() {
        return quotes;
    }

    public void setQuotes(List<Quote> quotes) {
        this.quotes = quotes;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public void setTotalCount(int totalCount) {
        this.totalCount = totalCount;
    }

    public int getCount() {
        return count;
    }

    public void setCount(int count) {
        this.count = count;
    }

    public boolean isHasMore() {
        return hasMore;
    }

    public void setHasMore(boolean hasMore) {
        this.hasMore = hasMore;
    }

    public String getLastKey() {
        return lastKey;
    }

    public void setLastKey(String lastKey) {
        this.lastKey = lastKey;
    }
}
