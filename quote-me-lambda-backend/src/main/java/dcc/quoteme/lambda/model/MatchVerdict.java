package dcc.quoteme.lambda.model;

/**
 * Outcome of comparing a candidate quote against one existing quote.
 */
public final class MatchVerdict {
    public static final String EXACT_MATCH = "exact_match";
    public static final String SIMILAR_QUOTE_SAME_AUTHOR = "similar_quote_same_author";
    public static final String SAME_QUOTE_SIMILAR_AUTHOR = "same_quote_similar_author";
    public static final String BOTH_SIMILAR = "both_similar";

    private static final MatchVerdict NO_MATCH = new MatchVerdict(false, null);

    private final boolean match;
    private final String reason;

    private MatchVerdict(boolean match, String reason) {
        this.match = match;
        this.reason = reason;
    }

    public static MatchVerdict noMatch() {
        return NO_MATCH;
    }

    public static MatchVerdict match(String reason) {
        return new MatchVerdict(true, reason);
    }

    public boolean isMatch() {
        return match;
    }

    /**
     * The match reason including any formatted scores, or null when there is no match.
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return match ? "MatchVerdict{" + reason + "}" : "MatchVerdict{no_match}";
    }
}
