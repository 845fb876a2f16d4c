package dcc.quoteme.lambda.util;

/**
 * Environment variable lookups with defaults.
 */
public final class EnvConfig {
    public static final String QUOTES_TABLE_NAME = "QUOTES_TABLE_NAME";
    public static final String TAGS_TABLE_NAME = "TAGS_TABLE_NAME";
    public static final String SUBSCRIPTIONS_TABLE_NAME = "SUBSCRIPTIONS_TABLE_NAME";
    public static final String EXPORT_BUCKET = "EXPORT_BUCKET";
    public static final String SENDER_EMAIL = "SENDER_EMAIL";
    public static final String CORS_ORIGIN = "CORS_ORIGIN";
    public static final String FCM_SERVICE_ACCOUNT_JSON = "FCM_SERVICE_ACCOUNT_JSON";
    public static final String COGNITO_DOMAIN = "COGNITO_DOMAIN";
    public static final String COGNITO_CLIENT_ID = "COGNITO_CLIENT_ID";
    public static final String OAUTH_REDIRECT_URI = "OAUTH_REDIRECT_URI";
    public static final String WEB_APP_URL = "WEB_APP_URL";

    public static final String DEFAULT_QUOTES_TABLE = "quote-me-quotes";
    public static final String DEFAULT_TAGS_TABLE = "quote-me-tags";
    public static final String DEFAULT_SUBSCRIPTIONS_TABLE = "quote-me-subscriptions";
    public static final String DEFAULT_EXPORT_BUCKET = "quote-me-app-db-exports";
    public static final String DEFAULT_SENDER_EMAIL = "noreply@anystupididea.com";
    public static final String DEFAULT_WEB_APP_URL = "https://quote-me.anystupididea.com";

    private EnvConfig() {
    }

    public static String get(String name, String defaultValue) {
        String value = System.getenv(name);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    public static String get(String name) {
        return get(name, null);
    }
}
