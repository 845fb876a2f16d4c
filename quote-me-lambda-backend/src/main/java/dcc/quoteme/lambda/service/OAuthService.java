package dcc.quoteme.lambda.service;

import com.auth0.jwt.JWT;
import com.auth0.jwt.interfaces.DecodedJWT;
import dcc.quoteme.lambda.model.OAuthSuccessFlag;
import dcc.quoteme.lambda.repository.QuoteRepository;
import dcc.quoteme.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records and consumes the one-time success flag that lets the apps confirm a hosted-UI sign-in.
 */
public class OAuthService {
    private static final Logger logger = LoggerFactory.getLogger(OAuthService.class);

    private final QuoteRepository quoteRepository;
    private final TimeProvider timeProvider;

    public OAuthService(QuoteRepository quoteRepository, TimeProvider timeProvider) {
        this.quoteRepository = quoteRepository;
        this.timeProvider = timeProvider;
    }

    /**
     * Reads email and subject from the ID token and stores the success flag.
     *
     * @return the flag key, or an empty string when nothing could be stored
     */
    public String recordSuccess(String idToken) {
        try {
            DecodedJWT jwt = JWT.decode(idToken);
            String email = jwt.getClaim("email").asString();
            String sub = jwt.getSubject() != null ? jwt.getSubject() : "";
            logger.info("OAuth completed for user: {}", email);

            long now = timeProvider.currentTimeMillis() / 1000;
            String key = OAuthSuccessFlag.KEY_PREFIX + now + "_" + lastChars(sub, 8);
            quoteRepository.saveOAuthSuccessFlag(
                    new OAuthSuccessFlag(key, OAuthSuccessFlag.TOKEN_TYPE, email != null ? email : "", sub), now);
            logger.info("Stored OAuth success flag: {}", key);
            return key;
        } catch (Exception e) {
            logger.error("Failed to store OAuth success flag: {}", e.getMessage());
            return "";
        }
    }

    /**
     * Looks up a success flag and deletes it, so each key confirms at most once.
     */
    public Map<String, Object> consumeSuccess(String successKey) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (successKey == null || successKey.isEmpty()) {
            return failure(result, "Missing success key");
        }

        try {
            OAuthSuccessFlag flag = quoteRepository.findOAuthSuccessFlag(successKey);
            if (flag == null) {
                return failure(result, "Success flag not found or expired");
            }
            if (!OAuthSuccessFlag.TOKEN_TYPE.equals(flag.getTokenType())) {
                return failure(result, "Invalid flag type");
            }

            quoteRepository.delete(successKey);

            result.put("success", true);
            result.put("user_email", flag.getUserEmail());
            result.put("user_sub", flag.getUserSub());
            return result;
        } catch (Exception e) {
            logger.error("OAuth success check error: {}", e.getMessage());
            return failure(result, "Internal server error");
        }
    }

    private static Map<String, Object> failure(Map<String, Object> result, String error) {
        result.put("success", false);
        result.put("error", error);
        return result;
    }

    private static String lastChars(String value, int count) {
        return value.length() <= count ? value : value.substring(value.length() - count);
    }
}
