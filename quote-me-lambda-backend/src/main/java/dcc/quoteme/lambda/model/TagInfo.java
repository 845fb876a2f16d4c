package dcc.quoteme.lambda.model;

import com.google.gson.annotations.SerializedName;

public class TagInfo {
    private String name;
    // Older clients read "tag"
    private String tag;
    @SerializedName("quote_count")
    private int quoteCount;

    public TagInfo() {
    }

    public TagInfo(String name, int quoteCount) {
        this.name = name;
        this.tag = name;
        this.quoteCount = quoteCount;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
        this.tag = name;
    }

    public String getTag() {
        return tag;
    }

    public int getQuoteCount() {
        return quoteCount;
    }

    public void setQuoteCount(int quoteCount) {
        this.quoteCount = quoteCount;
    }
}
