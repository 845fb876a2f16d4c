package dcc.quoteme.lambda.template;

import static org.apache.commons.text.StringEscapeUtils.escapeEcmaScript;
import static org.apache.commons.text.StringEscapeUtils.escapeHtml4;

/**
 * HTML pages shown in the browser at the end of the hosted-UI sign-in.
 */
public class OAuthPageRenderer {
    private static final String STYLE = "<style>\n"
            + "body { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; display: flex; "
            + "justify-content: center; align-items: center; min-height: 100vh; margin: 0; "
            + "background: linear-gradient(135deg, #667eea 0%, #764ba2 100%); }\n"
            + ".container { text-align: center; background: white; padding: 2.5rem; border-radius: 16px; max-width: 420px; margin: 1rem; }\n"
            + ".btn { display: inline-block; background: #667eea; color: white; padding: 12px 24px; border-radius: 8px; text-decoration: none; margin-top: 1rem; }\n"
            + ".btn-secondary { background: #edf2f7; color: #4a5568; }\n"
            + ".error { color: #e53e3e; }\n"
            + "</style>\n";

    private final String webAppUrl;

    public OAuthPageRenderer(String webAppUrl) {
        this.webAppUrl = webAppUrl;
    }

    /**
     * Mobile browsers are sent to the app via deep link, web browsers back to the web app.
     */
    public String successPage(boolean mobile, String successKey) {
        String deepLink = successKey == null || successKey.isEmpty()
                ? "quoteme://auth-success"
                : "quoteme://auth-success?success_key=" + successKey;
        String webRedirect = webAppUrl + "?auth=success";

        return "<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n"
                + "<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n"
                + "<title>Authentication Successful - Quote Me</title>\n"
                + STYLE
                + "</head>\n<body>\n<div class=\"container\">\n"
                + "<h1>Welcome to Quote Me!</h1>\n"
                + "<p>You've successfully signed in.</p>\n"
                + "<div id=\"mobile-instructions\" style=\"display: " + (mobile ? "block" : "none") + ";\">\n"
                + "<p><strong>For mobile users:</strong><br>Return to the Quote Me app - you should now be signed in!</p>\n"
                + "<a href=\"" + escapeHtml4(deepLink) + "\" class=\"btn\">Open Quote Me App</a>\n"
                + "</div>\n"
                + "<div id=\"web-instructions\" style=\"display: " + (mobile ? "none" : "block") + ";\">\n"
                + "<p>Redirecting to Quote Me...</p>\n"
                + "</div>\n"
                + "<a href=\"" + escapeHtml4(webRedirect) + "\" class=\"btn btn-secondary\">Continue to Quote Me</a>\n"
                + "</div>\n"
                + "<script>\n"
                + "try {\n"
                + "  localStorage.setItem('oauth_success', 'true');\n"
                + "  localStorage.setItem('oauth_timestamp', Date.now().toString());\n"
                + (mobile
                    ? "  setTimeout(function () { window.location.href = '" + escapeEcmaScript(deepLink) + "'; }, 1000);\n"
                    : "  setTimeout(function () { window.location.href = '" + escapeEcmaScript(webRedirect) + "'; }, 3000);\n")
                + "} catch (e) {\n  console.error('Redirect failed', e);\n}\n"
                + "</script>\n"
                + "</body>\n</html>\n";
    }

    public String errorPage(String message) {
        return "<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n"
                + "<title>Authentication Error - Quote Me</title>\n"
                + STYLE
                + "</head>\n<body>\n<div class=\"container\">\n"
                + "<h1 class=\"error\">Authentication Error</h1>\n"
                + "<p>" + escapeHtml4(message) + "</p>\n"
                + "<a href=\"" + escapeHtml4(webAppUrl) + "\" class=\"btn\">Return to Quote Me</a>\n"
                + "</div>\n</body>\n</html>\n";
    }
}
