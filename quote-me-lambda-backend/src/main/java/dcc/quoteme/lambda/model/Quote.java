package dcc.quoteme.lambda.model;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class Quote {
    public static final String TAGS_METADATA_ID = "TAGS_METADATA";
    public static final String IMAGE_GENERATION_JOB_TYPE = "image_generation_job";

    private String id;
    private String quote;
    private String author;
    private List<String> tags = new ArrayList<>();
    @SerializedName("created_at")
    private String createdAt;
    @SerializedName("updated_at")
    private String updatedAt;
    @SerializedName("created_by")
    private String createdBy;
    @SerializedName("updated_by")
    private String updatedBy;
    @SerializedName("image_url")
    private String imageUrl;
    private String type;

    public Quote() {
    }

    public Quote(String id, String quote, String author) {
        this(id, quote, author, new ArrayList<>());
    }

    public Quote(String id, String quote, String author, List<String> tags) {
        this.id = id;
        this.quote = quote;
        this.author = author;
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    /**
     * True for rows that carry an actual quote. The quotes table also holds the tags metadata
     * record, image generation jobs and short-lived OAuth flags, none of which qualify.
     */
    public boolean qualifiesAsQuote() {
        if (TAGS_METADATA_ID.equals(id) || IMAGE_GENERATION_JOB_TYPE.equals(type)) {
            return false;
        }
        return quote != null && !quote.isEmpty() && author != null && !author.isEmpty();
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

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(String updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public String getUpdatedBy() {
        return updatedBy;
    }

    public void setUpdatedBy(String updatedBy) {
        this.updatedBy = updatedBy;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Quote other = (Quote) o;
        return Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }
}
