package dcc.quoteme.lambda.service;

import dcc.quoteme.lambda.model.Quote;
import dcc.quoteme.lambda.repository.QuoteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;

public class DailyQuoteService {
    private static final Logger logger = LoggerFactory.getLogger(DailyQuoteService.class);
    static final int SAMPLE_SIZE = 1000;

    private final QuoteRepository quoteRepository;
    private final Random random;

    public DailyQuoteService(QuoteRepository quoteRepository, Random random) {
        this.quoteRepository = quoteRepository;
        this.random = random;
    }

    /**
     * A random quote from the first scan page, or null when the table holds none.
     */
    public Quote pickQuote() {
        List<Quote> candidates = quoteRepository.sampleQuotes(SAMPLE_SIZE);
        if (candidates.isEmpty()) {
            logger.error("No quotes found in database");
            return null;
        }
        return candidates.get(random.nextInt(candidates.size()));
    }
}
