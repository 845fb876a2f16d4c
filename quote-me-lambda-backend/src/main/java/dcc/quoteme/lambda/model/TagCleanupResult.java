package dcc.quoteme.lambda.model;

import java.util.List;

public class TagCleanupResult {
    private final List<String> removedTags;
    private final List<String> remainingTags;
    private final int countRemoved;

    public TagCleanupResult(List<String> removedTags, List<String> remainingTags, int countRemoved) {
        this.removedTags = removedTags;
        this.remainingTags = remainingTags;
        this.countRemoved = countRemoved;
    }

    public List<String> getRemovedTags() {
        return removedTags;
    }

    public List<String> getRemainingTags() {
        return remainingTags;
    }

    /**
     * Tags actually deleted; lower than {@code removedTags.size()} when some deletes failed.
     */
    public int getCountRemoved() {
        return countRemoved;
    }
}
