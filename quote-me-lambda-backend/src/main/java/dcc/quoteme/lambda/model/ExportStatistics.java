package dcc.quoteme.lambda.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;

public class ExportStatistics {
    @SerializedName("total_quotes")
    private int totalQuotes;
    @SerializedName("unique_authors")
    private int uniqueAuthors;
    @SerializedName("unique_tags")
    private int uniqueTags;
    private List<String> authors;
    private List<String> tags;

    public ExportStatistics() {
    }

    public ExportStatistics(int totalQuotes, List<String> authors, List<String> tags) {
        this.totalQuotes = totalQuotes;
        this.uniqueAuthors = authors.size();
        this.uniqueTags = tags.size();
        this.authors = authors;
        this.tags = tags;
    }

    public int getTotalQuotes() {
        return totalQuotes;
    }

    public int getUniqueAuthors() {
        return uniqueAuthors;
    }

    public int getUniqueTags() {
        return uniqueTags;
    }

    public List<String> getAuthors() {
        return authors;
    }

    public List<String> getTags() {
        return tags;
    }
}
