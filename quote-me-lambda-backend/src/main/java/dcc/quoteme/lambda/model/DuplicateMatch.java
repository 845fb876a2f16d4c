package dcc.quoteme.lambda.model;

import com.google.gson.annotations.SerializedName;

/**
 * An existing quote that was judged a near-duplicate of a submitted one.
 */
public class DuplicateMatch {
    private String id;
    private String quote;
    private String author;
    @SerializedName("created_at")
    private String createdAt;
    @SerializedName("match_reason")
    private String matchReason;

    public DuplicateMatch() {
    }

    public DuplicateMatch(String id, String quote, String author, String createdAt, String matchReason) {
        this.id = id;
        this.quote = quote;
        this.author = author;
        this.createdAt = createdAt;
        this.matchReason = matchReason;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getQuote() {
        return quote;
    }

    public void setQuote(String quote) {
        this.quote = quote;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public String getMatchReason() {
        return matchReason;
    }

    public void setMatchReason(String matchReason) {
        this.matchReason = matchReason;
    }
}
