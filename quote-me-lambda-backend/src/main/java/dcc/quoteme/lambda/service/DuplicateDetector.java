package dcc.quoteme.lambda.service;

import dcc.quoteme.lambda.model.DuplicateCheckResponse;
import dcc.quoteme.lambda.model.DuplicateMatch;
import dcc.quoteme.lambda.model.MatchVerdict;
import dcc.quoteme.lambda.model.Quote;
import dcc.quoteme.lambda.repository.QuoteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares a candidate quote against every stored quote. The whole table is scanned on each call,
 * there is no index and no early exit.
 */
public class DuplicateDetector {
    private static final Logger logger = LoggerFactory.getLogger(DuplicateDetector.class);

    public static final int MAX_REPORTED_DUPLICATES = 5;

    private final QuoteRepository quoteRepository;

    public DuplicateDetector(QuoteRepository quoteRepository) {
        this.quoteRepository = quoteRepository;
    }

    /**
     * All stored quotes matching the candidate, in scan order. Storage failures propagate; the
     * caller decides whether that blocks the operation.
     */
    public List<DuplicateMatch> findDuplicates(String candidateQuote, String candidateAuthor) {
        if (isBlank(candidateQuote) || isBlank(candidateAuthor)) {
            throw new IllegalArgumentException("Quote and author are required");
        }

        List<DuplicateMatch> matches = new ArrayList<>();
        int examined = 0;
        for (Quote existing : quoteRepository.scanAll()) {
            if (!existing.qualifiesAsQuote()) {
                continue;
            }
            examined++;

            MatchVerdict verdict = DuplicateClassifier.classify(
                    candidateQuote, candidateAuthor, existing.getQuote(), existing.getAuthor());
            if (verdict.isMatch()) {
                matches.add(new DuplicateMatch(existing.getId(), existing.getQuote(), existing.getAuthor(),
                        existing.getCreatedAt(), verdict.getReason()));
            }
        }

        logger.info("Duplicate scan examined {} quotes and found {} potential duplicates", examined, matches.size());
        return matches;
    }

    public DuplicateCheckResponse checkForDuplicates(String candidateQuote, String candidateAuthor) {
        return toResponse(findDuplicates(candidateQuote, candidateAuthor));
    }

    public static DuplicateCheckResponse toResponse(List<DuplicateMatch> matches) {
        if (matches.isEmpty()) {
            return new DuplicateCheckResponse(false, 0, new ArrayList<>(), "No duplicates found");
        }

        List<DuplicateMatch> reported = new ArrayList<>(matches.subList(0, Math.min(MAX_REPORTED_DUPLICATES, matches.size())));
        return new DuplicateCheckResponse(true, matches.size(), reported,
                "Found " + matches.size() + " similar quote(s)");
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
