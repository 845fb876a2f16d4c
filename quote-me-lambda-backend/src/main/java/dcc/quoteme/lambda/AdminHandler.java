package dcc.quoteme.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.google.gson.JsonObject;
import com.google.gson.JsonSyntaxException;
import dcc.quoteme.lambda.exception.DuplicateQuoteException;
import dcc.quoteme.lambda.exception.NotFoundException;
import dcc.quoteme.lambda.exception.ValidationException;
import dcc.quoteme.lambda.model.*;
import dcc.quoteme.lambda.repository.QuoteRepository;
import dcc.quoteme.lambda.repository.TagRepository;
import dcc.quoteme.lambda.service.DuplicateDetector;
import dcc.quoteme.lambda.service.QuoteAdminService;
import dcc.quoteme.lambda.service.TagService;
import dcc.quoteme.lambda.util.ClaimsExtractor;
import dcc.quoteme.lambda.util.SystemTimeProvider;
import org.apache.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dcc.quoteme.lambda.util.ApiResponses.*;
import static dcc.quoteme.lambda.util.RequestUtil.*;

/**
 * Admin API for quotes and tags. Every route requires membership of the Admins group.
 */
public class AdminHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {
    private static final Logger logger = LoggerFactory.getLogger(AdminHandler.class);

    private final QuoteAdminService quoteAdminService;
    private final TagService tagService;

    public AdminHandler() {
        QuoteRepository quoteRepository = new QuoteRepository();
        SystemTimeProvider timeProvider = new SystemTimeProvider();
        this.tagService = new TagService(quoteRepository, new TagRepository(), timeProvider);
        this.quoteAdminService = new QuoteAdminService(quoteRepository, new DuplicateDetector(quoteRepository), tagService, timeProvider);
    }

    public AdminHandler(QuoteAdminService quoteAdminService, TagService tagService) {
        this.quoteAdminService = quoteAdminService;
        this.tagService = tagService;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent event, Context context) {
        try {
            String path = normalizedPath(event);
            String httpMethod = event.getHttpMethod();
            logger.info("path={}, httpMethod={}", path, httpMethod);

            if ("OPTIONS".equals(httpMethod)) {
                return options(corsHeaders("*"));
            }

            UserClaims claims = ClaimsExtractor.fromEvent(event);
            if (!claims.isAdmin()) {
                logger.warn("Admin request rejected for user {}", claims.getUsername());
                return forbidden();
            }
            String username = claims.getUsername();

            if ("POST".equals(httpMethod) && path.endsWith("/admin/quotes")) {
                return createQuote(event, username);
            } else if ("PUT".equals(httpMethod) && path.contains("/admin/quotes/")) {
                return updateQuote(event, path, username);
            } else if ("DELETE".equals(httpMethod) && path.contains("/admin/quotes/")) {
                return deleteQuote(event, path, username);
            } else if ("GET".equals(httpMethod) && path.endsWith("/admin/quotes")) {
                QuoteQuery query = QuoteQuery.fromParameters(event.getQueryStringParameters());
                return json(HttpStatus.SC_OK, quoteAdminService.listQuotes(query));
            } else if ("GET".equals(httpMethod) && path.endsWith("/admin/search")) {
                QuoteQuery query = QuoteQuery.fromParameters(event.getQueryStringParameters());
                return json(HttpStatus.SC_OK, quoteAdminService.searchQuotes(queryParam(event, "q"), query));
            } else if ("GET".equals(httpMethod) && path.endsWith("/admin/tags")) {
                return listTags();
            } else if ("POST".equals(httpMethod) && path.endsWith("/admin/tags")) {
                return addTag(event, username);
            } else if ("PUT".equals(httpMethod) && path.contains("/admin/tags/")) {
                return renameTag(event, path, username);
            } else if ("DELETE".equals(httpMethod) && path.endsWith("/admin/tags/unused")) {
                return cleanupUnusedTags(username);
            } else if ("DELETE".equals(httpMethod) && path.contains("/admin/tags/")) {
                return deleteTag(event, path, username);
            } else if ("POST".equals(httpMethod) && path.endsWith("/admin/check-duplicate")) {
                return checkDuplicate(event);
            } else if ("POST".equals(httpMethod) && path.endsWith("/admin/save-custom-image")) {
                return saveCustomImage(event, username);
            }
            return error(HttpStatus.SC_NOT_FOUND, "Not found");
        } catch (ValidationException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            body.put("details", e.getDetails());
            return json(HttpStatus.SC_BAD_REQUEST, body);
        } catch (JsonSyntaxException e) {
            return error(HttpStatus.SC_BAD_REQUEST, "Invalid JSON in request body");
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.SC_BAD_REQUEST, e.getMessage());
        } catch (NotFoundException e) {
            return error(HttpStatus.SC_NOT_FOUND, e.getMessage());
        } catch (DuplicateQuoteException e) {
            return json(HttpStatus.SC_CONFLICT, e.getResponse());
        } catch (Exception e) {
            logger.error("Error handling admin request", e);
            return error(HttpStatus.SC_INTERNAL_SERVER_ERROR, "Internal server error");
        }
    }

    private APIGatewayProxyResponseEvent createQuote(APIGatewayProxyRequestEvent event, String username) {
        Quote quote = quoteAdminService.createQuote(jsonBody(event), username);
        return json(HttpStatus.SC_CREATED, Map.of("message", "Quote created successfully", "quote", quote));
    }

    private APIGatewayProxyResponseEvent updateQuote(APIGatewayProxyRequestEvent event, String path, String username) {
        String id = quoteId(event, path);
        Quote quote = quoteAdminService.updateQuote(id, jsonBody(event), username);
        return json(HttpStatus.SC_OK, Map.of("message", "Quote updated successfully", "quote", quote));
    }

    private APIGatewayProxyResponseEvent deleteQuote(APIGatewayProxyRequestEvent event, String path, String username) {
        String id = quoteId(event, path);
        quoteAdminService.deleteQuote(id, username);
        return json(HttpStatus.SC_OK, Map.of("message", "Quote deleted successfully", "deleted_quote_id", id));
    }

    private APIGatewayProxyResponseEvent listTags() {
        List<TagInfo> tags = tagService.listTags();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tags", tags);
        body.put("count", tags.size());
        return json(HttpStatus.SC_OK, body);
    }

    private APIGatewayProxyResponseEvent addTag(APIGatewayProxyRequestEvent event, String username) {
        String tag = stringField(jsonBody(event), "tag");
        List<String> allTags = tagService.addTag(tag, username);

        String added = tag.trim();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Successfully added tag '" + added + "'");
        body.put("tag", added);
        body.put("all_tags", allTags);
        return json(HttpStatus.SC_CREATED, body);
    }

    private APIGatewayProxyResponseEvent renameTag(APIGatewayProxyRequestEvent event, String path, String username) {
        String oldTag = tagName(event, path);
        TagRenameResult result = tagService.renameTag(oldTag, stringField(jsonBody(event), "tag"), username);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Successfully updated tag '" + result.getOldTag() + "' to '" + result.getNewTag() + "'");
        body.put("old_tag", result.getOldTag());
        body.put("new_tag", result.getNewTag());
        body.put("quotes_updated", result.getQuotesUpdated());
        body.put("all_tags", result.getAllTags());
        return json(HttpStatus.SC_OK, body);
    }

    private APIGatewayProxyResponseEvent deleteTag(APIGatewayProxyRequestEvent event, String path, String username) {
        String tag = tagName(event, path);
        int quotesUpdated = tagService.deleteTag(tag, username);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Successfully deleted tag '" + tag + "'");
        body.put("deleted_tag", tag);
        body.put("quotes_updated", quotesUpdated);
        return json(HttpStatus.SC_OK, body);
    }

    private APIGatewayProxyResponseEvent cleanupUnusedTags(String username) {
        TagCleanupResult result = tagService.cleanupUnusedTags(username);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", result.getRemovedTags().isEmpty()
                ? "No unused tags found"
                : "Successfully removed " + result.getCountRemoved() + " unused tags");
        body.put("removed_tags", result.getRemovedTags());
        body.put("remaining_tags", result.getRemainingTags());
        body.put("count_removed", result.getCountRemoved());
        body.put("count_remaining", result.getRemainingTags().size());
        return json(HttpStatus.SC_OK, body);
    }

    /**
     * Unlike quote creation, an explicit check reports a failed scan instead of answering "no
     * duplicates".
     */
    private APIGatewayProxyResponseEvent checkDuplicate(APIGatewayProxyRequestEvent event) {
        JsonObject body = jsonBody(event);
        DuplicateCheckResponse response;
        try {
            response = quoteAdminService.checkDuplicate(body);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Error scanning for duplicates", e);
            return error(HttpStatus.SC_INTERNAL_SERVER_ERROR, "Failed to check for duplicates");
        }
        return json(HttpStatus.SC_OK, response);
    }

    private APIGatewayProxyResponseEvent saveCustomImage(APIGatewayProxyRequestEvent event, String username) {
        JsonObject body = jsonBody(event);
        String quoteId = stringField(body, "quote_id");
        String imageUrl = stringField(body, "image_url");
        quoteAdminService.saveCustomImage(quoteId, imageUrl, username);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Custom image URL saved successfully");
        response.put("quote_id", quoteId);
        response.put("image_url", imageUrl);
        return json(HttpStatus.SC_OK, response);
    }

    private static String quoteId(APIGatewayProxyRequestEvent event, String path) {
        String id = pathParam(event, "id");
        return id != null ? id : lastPathSegment(path);
    }

    private static String tagName(APIGatewayProxyRequestEvent event, String path) {
        String tag = pathParam(event, "tag");
        return tag != null ? URLDecoder.decode(tag, StandardCharsets.UTF_8) : lastPathSegment(path);
    }
}
