package dcc.quoteme.lambda.model;

/**
 * One-time marker written after a successful OAuth login so the app can confirm the sign-in.
 */
public class OAuthSuccessFlag {
    public static final String TOKEN_TYPE = "oauth_success";
    public static final String KEY_PREFIX = "oauth_success_";
    public static final long TTL_SECONDS = 300;

    private final String key;
    private final String tokenType;
    private final String userEmail;
    private final String userSub;

    public OAuthSuccessFlag(String key, String tokenType, String userEmail, String userSub) {
        this.key = key;
        this.tokenType = tokenType;
        this.userEmail = userEmail;
        this.userSub = userSub;
    }

    public String getKey() {
        return key;
    }

    public String getTokenType() {
        return tokenType;
    }

    public String getUserEmail() {
        return userEmail;
    }

    public String getUserSub() {
        return userSub;
    }
}
