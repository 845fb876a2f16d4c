package dcc.quoteme.lambda.service;

import dcc.quoteme.lambda.exception.NotFoundException;
import dcc.quoteme.lambda.model.Quote;
import dcc.quoteme.lambda.model.TagCleanupResult;
import dcc.quoteme.lambda.model.TagInfo;
import dcc.quoteme.lambda.model.TagRenameResult;
import dcc.quoteme.lambda.repository.QuoteRepository;
import dcc.quoteme.lambda.repository.TagRepository;
import dcc.quoteme.lambda.util.AuditLogger;
import dcc.quoteme.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Tag administration. The tags table is the registry of tag names; the {@code TAGS_METADATA}
 * record in the quotes table is kept as a sorted copy for older clients.
 */
public class TagService {
    private static final Logger logger = LoggerFactory.getLogger(TagService.class);

    private final QuoteRepository quoteRepository;
    private final TagRepository tagRepository;
    private final TimeProvider timeProvider;

    public TagService(QuoteRepository quoteRepository, TagRepository tagRepository, TimeProvider timeProvider) {
        this.quoteRepository = quoteRepository;
        this.tagRepository = tagRepository;
        this.timeProvider = timeProvider;
    }

    public List<TagInfo> listTags() {
        Set<String> names = tagRepository.findAllTagNames();

        Map<String, Integer> usage = new HashMap<>();
        for (Quote quote : quoteRepository.scanAll()) {
            if (!quote.qualifiesAsQuote()) {
                continue;
            }
            for (String tag : quote.getTags()) {
                if (names.contains(tag)) {
                    usage.merge(tag, 1, Integer::sum);
                }
            }
        }

        List<TagInfo> tags = new ArrayList<>();
        for (String name : names) {
            tags.add(new TagInfo(name, usage.getOrDefault(name, 0)));
        }
        logger.info("Returning {} tags with usage counts", tags.size());
        return tags;
    }

    public List<String> addTag(String rawTag, String requestingUser) {
        String tag = rawTag == null ? "" : rawTag.trim();
        if (tag.isEmpty()) {
            throw new IllegalArgumentException("Tag name is required");
        }
        if (tagRepository.exists(tag)) {
            throw new IllegalArgumentException("Tag '" + tag + "' already exists");
        }

        tagRepository.save(tag, timestamp(), requestingUser);
        updateMetadata(List.of(tag), List.of());

        AuditLogger.success(logger, "tag_change", "add", requestingUser, Map.of("tag", tag));
        return new ArrayList<>(tagRepository.findAllTagNames());
    }

    public TagRenameResult renameTag(String oldTag, String rawNewTag, String requestingUser) {
        String newTag = rawNewTag == null ? "" : rawNewTag.trim();
        if (oldTag == null || oldTag.isEmpty()) {
            throw new IllegalArgumentException("Tag name is required in path");
        }
        if (newTag.isEmpty()) {
            throw new IllegalArgumentException("New tag name is required");
        }
        if (oldTag.equals(newTag)) {
            throw new IllegalArgumentException("New tag name must be different from old tag name");
        }
        if (!tagRepository.exists(oldTag)) {
            throw new NotFoundException("Tag '" + oldTag + "' not found");
        }
        if (tagRepository.exists(newTag)) {
            throw new IllegalArgumentException("Tag '" + newTag + "' already exists");
        }

        String timestamp = timestamp();
        int quotesUpdated = rewriteTags(oldTag, newTag, timestamp);

        tagRepository.save(newTag, timestamp, requestingUser);
        tagRepository.delete(oldTag);
        updateMetadata(List.of(newTag), List.of(oldTag));

        logger.info("Renamed tag '{}' to '{}' in {} quotes", oldTag, newTag, quotesUpdated);
        AuditLogger.success(logger, "tag_change", "rename", requestingUser,
                Map.of("oldTag", oldTag, "newTag", newTag, "quotesUpdated", quotesUpdated));
        return new TagRenameResult(oldTag, newTag, quotesUpdated, new ArrayList<>(tagRepository.findAllTagNames()));
    }

    /**
     * Removes the tag from every quote that carries it, then from the registry.
     *
     * @return number of quotes rewritten
     */
    public int deleteTag(String tag, String requestingUser) {
        if (tag == null || tag.isEmpty()) {
            throw new IllegalArgumentException("Tag name is required in path");
        }
        if (!tagRepository.exists(tag)) {
            throw new NotFoundException("Tag '" + tag + "' not found");
        }

        int quotesUpdated = rewriteTags(tag, null, timestamp());
        tagRepository.delete(tag);
        updateMetadata(List.of(), List.of(tag));

        logger.info("Deleted tag '{}' from {} quotes", tag, quotesUpdated);
        AuditLogger.success(logger, "tag_change", "delete", requestingUser,
                Map.of("tag", tag, "quotesUpdated", quotesUpdated));
        return quotesUpdated;
    }

    public TagCleanupResult cleanupUnusedTags(String requestingUser) {
        Set<String> registered = tagRepository.findAllTagNames();
        Set<String> used = new TreeSet<>();
        for (Quote quote : quoteRepository.scanAll()) {
            if (quote.qualifiesAsQuote()) {
                used.addAll(quote.getTags());
            }
        }

        Set<String> unused = new TreeSet<>(registered);
        unused.removeAll(used);

        int removed = 0;
        Set<String> remaining = new TreeSet<>(registered);
        for (String tag : unused) {
            try {
                tagRepository.delete(tag);
                remaining.remove(tag);
                removed++;
            } catch (RuntimeException e) {
                logger.error("Failed to delete unused tag '{}': {}", tag, e.getMessage());
            }
        }
        if (removed > 0) {
            updateMetadata(List.of(), unused);
        }

        logger.info("Removed {} of {} unused tags", removed, unused.size());
        AuditLogger.success(logger, "tag_change", "cleanup", requestingUser, Map.of("countRemoved", removed));
        return new TagCleanupResult(new ArrayList<>(unused), new ArrayList<>(remaining), removed);
    }

    /**
     * Adds any unknown tags of a saved quote to the registry and the metadata record. Failures are
     * logged and never fail the quote operation.
     */
    public void registerTags(Collection<String> tags, String requestingUser) {
        if (tags == null || tags.isEmpty()) {
            return;
        }
        try {
            String timestamp = timestamp();
            for (String tag : new TreeSet<>(tags)) {
                if (!tagRepository.exists(tag)) {
                    tagRepository.save(tag, timestamp, requestingUser);
                }
            }
            updateMetadata(tags, List.of());
        } catch (RuntimeException e) {
            logger.error("Failed to register tags {}: {}", tags, e.getMessage());
        }
    }

    private void updateMetadata(Collection<String> added, Collection<String> removed) {
        try {
            Set<String> current = new TreeSet<>(quoteRepository.getTagsMetadata());
            current.addAll(added);
            current.removeAll(removed);
            quoteRepository.saveTagsMetadata(new ArrayList<>(current), timestamp());
        } catch (RuntimeException e) {
            logger.error("Failed to update tags metadata: {}", e.getMessage());
        }
    }

    /**
     * Replaces {@code tag} with {@code replacement} on every quote, or removes it when the
     * replacement is null. Every page of the table is visited.
     */
    private int rewriteTags(String tag, String replacement, String timestamp) {
        List<Quote> affected = new ArrayList<>();
        for (Quote quote : quoteRepository.scanAll()) {
            if (quote.qualifiesAsQuote() && quote.getTags().contains(tag)) {
                affected.add(quote);
            }
        }

        for (Quote quote : affected) {
            List<String> tags = new ArrayList<>();
            for (String existing : quote.getTags()) {
                if (!existing.equals(tag)) {
                    tags.add(existing);
                } else if (replacement != null && !tags.contains(replacement)) {
                    tags.add(replacement);
                }
            }
            quote.setTags(tags);
            quote.setUpdatedAt(timestamp);
            quoteRepository.save(quote);
        }
        return affected.size();
    }

    private String timestamp() {
        return timeProvider.now().toString();
    }
}
