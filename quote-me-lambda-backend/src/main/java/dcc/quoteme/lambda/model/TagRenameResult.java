package dcc.quoteme.lambda.model;

import java.util.List;

public class TagRenameResult {
    private final String oldTag;
    private final String newTag;
    private final int quotesUpdated;
    private final List<String> allTags;

    public TagRenameResult(String oldTag, String newTag, int quotesUpdated, List<String> allTags) {
        this.oldTag = oldTag;
        this.newTag = newTag;
        this.quotesUpdated = quotesUpdated;
        this.allTags = allTags;
    }

    public String getOldTag() {
        return oldTag;
    }

    public String getNewTag() {
        return newTag;
    }

    public int getQuotesUpdated() {
        return quotesUpdated;
    }

    public List<String> getAllTags() {
        return allTags;
    }
}
