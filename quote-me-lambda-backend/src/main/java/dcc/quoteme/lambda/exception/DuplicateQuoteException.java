package dcc.quoteme.lambda.exception;

import dcc.quoteme.lambda.model.DuplicateCheckResponse;

/**
 * Raised when a quote creation is blocked because near-duplicates already exist.
 */
public class DuplicateQuoteException extends RuntimeException {
    private final DuplicateCheckResponse response;

    public DuplicateQuoteException(DuplicateCheckResponse response) {
        super(response.getMessage());
        this.response = response;
    }

    public DuplicateCheckResponse getResponse() {
        return response;
    }
}
