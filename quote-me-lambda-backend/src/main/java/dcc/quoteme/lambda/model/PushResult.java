package dcc.quoteme.lambda.model;

import java.util.List;

/**
 * Outcome of pushing one quote to every registered device of a subscriber.
 */
public class PushResult {
    private final int sent;
    private final List<String> errors;

    public PushResult(int sent, List<String> errors) {
        this.sent = sent;
        this.errors = List.copyOf(errors);
    }

    public int getSent() {
        return sent;
    }

    public List<String> getErrors() {
        return errors;
    }
}
