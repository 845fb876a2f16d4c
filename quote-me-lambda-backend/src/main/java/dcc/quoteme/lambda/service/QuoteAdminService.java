package dcc.quoteme.lambda.service;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import dcc.quoteme.lambda.exception.DuplicateQuoteException;
import dcc.quoteme.lambda.exception.NotFoundException;
import dcc.quoteme.lambda.exception.ValidationException;
import dcc.quoteme.lambda.model.*;
import dcc.quoteme.lambda.repository.QuoteRepository;
import dcc.quoteme.lambda.util.AuditLogger;
import dcc.quoteme.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

public class QuoteAdminService {
    private static final Logger logger = LoggerFactory.getLogger(QuoteAdminService.class);

    private final QuoteRepository quoteRepository;
    private final DuplicateDetector duplicateDetector;
    private final TagService tagService;
    private final TimeProvider timeProvider;

    public QuoteAdminService(QuoteRepository quoteRepository, DuplicateDetector duplicateDetector,
                             TagService tagService, TimeProvider timeProvider) {
        this.quoteRepository = quoteRepository;
        this.duplicateDetector = duplicateDetector;
        this.tagService = tagService;
        this.timeProvider = timeProvider;
    }

    /**
     * Creates a quote unless near-duplicates exist. A failing duplicate scan does not block the
     * creation; it is logged and the quote is stored.
     */
    public Quote createQuote(JsonObject body, String requestingUser) {
        Quote candidate = parseQuote(body);

        List<DuplicateMatch> duplicates;
        try {
            duplicates = duplicateDetector.findDuplicates(candidate.getQuote(), candidate.getAuthor());
        } catch (RuntimeException e) {
            logger.warn("Duplicate check failed, creating quote anyway: {}", e.getMessage());
            duplicates = List.of();
        }

        if (!duplicates.isEmpty()) {
            logger.info("Blocking quote creation, found {} potential duplicates", duplicates.size());
            DuplicateCheckResponse response = DuplicateDetector.toResponse(duplicates);
            response.setError("Duplicate quote detected");
            AuditLogger.log(logger, "WARN", "quote_change", "create", "blocked", requestingUser,
                    response.getMessage(), Map.of("duplicateCount", duplicates.size()));
            throw new DuplicateQuoteException(response);
        }

        String timestamp = timestamp();
        candidate.setId(UUID.randomUUID().toString());
        candidate.setCreatedAt(timestamp);
        candidate.setUpdatedAt(timestamp);
        candidate.setCreatedBy(requestingUser);

        try {
            quoteRepository.save(candidate);
        } catch (Exception e) {
            AuditLogger.failure(logger, "quote_change", "create", requestingUser, e.getMessage(), "CREATE_QUOTE_FAILED");
            throw new RuntimeException("Failed to create quote: " + e.getMessage(), e);
        }
        tagService.registerTags(candidate.getTags(), requestingUser);

        AuditLogger.success(logger, "quote_change", "create", requestingUser, Map.of("quoteId", candidate.getId()));
        return candidate;
    }

    public Quote updateQuote(String id, JsonObject body, String requestingUser) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Quote ID is required");
        }
        Quote update = parseQuote(body);

        Quote existing = findExisting(id);
        String timestamp = timestamp();

        update.setId(id);
        update.setCreatedAt(existing.getCreatedAt() != null ? existing.getCreatedAt() : timestamp);
        update.setCreatedBy(existing.getCreatedBy() != null ? existing.getCreatedBy() : "unknown");
        update.setImageUrl(existing.getImageUrl());
        update.setUpdatedAt(timestamp);
        update.setUpdatedBy(requestingUser);

        quoteRepository.save(update);
        tagService.registerTags(update.getTags(), requestingUser);

        AuditLogger.success(logger, "quote_change", "update", requestingUser, Map.of("quoteId", id));
        return update;
    }

    public void deleteQuote(String id, String requestingUser) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Quote ID is required");
        }
        findExisting(id);
        quoteRepository.delete(id);
        AuditLogger.success(logger, "quote_change", "delete", requestingUser, Map.of("quoteId", id));
    }

    public QuoteListResponse listQuotes(QuoteQuery query) {
        List<Quote> quotes = collectQuotes(quote -> true);
        logger.info("Retrieved {} quotes from the database", quotes.size());

        Page page = paginate(quotes, query);
        return new QuoteListResponse(page.quotes, quotes.size(), page.hasMore, page.lastKey);
    }

    public QuoteSearchResponse searchQuotes(String rawSearch, QuoteQuery query) {
        String search = rawSearch == null ? "" : rawSearch.trim().toLowerCase(Locale.ROOT);
        if (search.isEmpty()) {
            throw new IllegalArgumentException("Search query is required");
        }

        List<Quote> matches = collectQuotes(quote -> contains(quote.getQuote(), search)
                || contains(quote.getAuthor(), search)
                || quote.getTags().stream().anyMatch(tag -> contains(tag, search)));
        logger.info("Found {} quotes matching '{}'", matches.size(), search);

        Page page = paginate(matches, query);
        return new QuoteSearchResponse(page.quotes, matches.size(), page.hasMore, page.lastKey);
    }

    public DuplicateCheckResponse checkDuplicate(JsonObject body) {
        String quote = optionalString(body, "quote").trim();
        String author = optionalString(body, "author").trim();
        if (quote.isEmpty() || author.isEmpty()) {
            throw new IllegalArgumentException("Quote and author are required");
        }
        return duplicateDetector.checkForDuplicates(quote, author);
    }

    public void saveCustomImage(String quoteId, String imageUrl, String requestingUser) {
        if (quoteId == null || quoteId.isEmpty() || imageUrl == null || imageUrl.isEmpty()) {
            throw new IllegalArgumentException("Missing quote_id or image_url");
        }
        try {
            quoteRepository.updateImageUrl(quoteId, imageUrl, timestamp());
        } catch (Exception e) {
            AuditLogger.failure(logger, "quote_change", "save_image", requestingUser, e.getMessage(), "SAVE_IMAGE_FAILED");
            throw new RuntimeException("Failed to save custom image URL: " + e.getMessage(), e);
        }
        AuditLogger.success(logger, "quote_change", "save_image", requestingUser, Map.of("quoteId", quoteId));
    }

    /**
     * Validates a create/update body: {@code quote} and {@code author} are required non-blank
     * strings, {@code tags} when present must be an array of non-blank strings.
     */
    static Quote parseQuote(JsonObject body) {
        List<String> errors = new ArrayList<>();
        String quote = requiredString(body, "quote", errors);
        String author = requiredString(body, "author", errors);

        List<String> tags = new ArrayList<>();
        JsonElement rawTags = body.get("tags");
        if (rawTags != null && !rawTags.isJsonNull()) {
            if (!rawTags.isJsonArray()) {
                errors.add("'tags' must be an array");
            } else {
                JsonArray array = rawTags.getAsJsonArray();
                boolean allValid = true;
                for (JsonElement element : array) {
                    if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()
                            && !element.getAsString().trim().isEmpty()) {
                        tags.add(element.getAsString());
                    } else {
                        allValid = false;
                    }
                }
                if (!allValid) {
                    errors.add("All tags must be non-empty strings");
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return new Quote(null, quote.trim(), author.trim(), tags);
    }

    private static String requiredString(JsonObject body, String field, List<String> errors) {
        JsonElement value = body.get(field);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()
                || value.getAsString().trim().isEmpty()) {
            errors.add("'" + field + "' is required and cannot be empty");
            return "";
        }
        return value.getAsString();
    }

    private static String optionalString(JsonObject body, String field) {
        JsonElement value = body.get(field);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : "";
    }

    private Quote findExisting(String id) {
        Quote existing = quoteRepository.findById(id);
        if (existing == null || Quote.TAGS_METADATA_ID.equals(id)) {
            throw new NotFoundException("Quote not found");
        }
        return existing;
    }

    private List<Quote> collectQuotes(Predicate<Quote> filter) {
        List<Quote> quotes = new ArrayList<>();
        for (Quote quote : quoteRepository.scanAll()) {
            if (quote.qualifiesAsQuote() && filter.test(quote)) {
                quotes.add(quote);
            }
        }
        return quotes;
    }

    /**
     * Sorts in memory, skips past the quote named by the cursor, and cuts the page.
     */
    static Page paginate(List<Quote> quotes, QuoteQuery query) {
        List<Quote> sorted = new ArrayList<>(quotes);
        sorted.sort(comparatorFor(query));

        int start = 0;
        if (query.getLastKey() != null) {
            for (int i = 0; i < sorted.size(); i++) {
                if (query.getLastKey().equals(sorted.get(i).getId())) {
                    start = i + 1;
                    break;
                }
            }
        }

        int end = Math.min(start + query.getLimit(), sorted.size());
        List<Quote> pageQuotes = new ArrayList<>(sorted.subList(start, end));
        boolean hasMore = end < sorted.size();
        String lastKey = hasMore && !pageQuotes.isEmpty() ? pageQuotes.get(pageQuotes.size() - 1).getId() : null;
        return new Page(pageQuotes, hasMore, lastKey);
    }

    private static Comparator<Quote> comparatorFor(QuoteQuery query) {
        Function<Quote, String> key;
        switch (query.getSortBy()) {
            case "quote" -> key = quote -> lower(quote.getQuote());
            case "author" -> key = quote -> lower(quote.getAuthor());
            case "updated_at" -> key = quote -> nullToEmpty(quote.getUpdatedAt());
            default -> key = quote -> nullToEmpty(quote.getCreatedAt());
        }
        Comparator<Quote> comparator = Comparator.comparing(key);
        return query.isDescending() ? comparator.reversed() : comparator;
    }

    private static boolean contains(String value, String search) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(search);
    }

    private static String lower(String value) {
        return nullToEmpty(value).toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private String timestamp() {
        return timeProvider.now().toString();
    }

    static final class Page {
        final List<Quote> quotes;
        final boolean hasMore;
        final String lastKey;

        Page(List<Quote> quotes, boolean hasMore, String lastKey) {
            this.quotes = quotes;
            this.hasMore = hasMore;
            this.lastKey = lastKey;
        }
    }
}
