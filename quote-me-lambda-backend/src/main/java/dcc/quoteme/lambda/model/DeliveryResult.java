package dcc.quoteme.lambda.model;

public class DeliveryResult {
    private final int hourUtc;
    private final int sent;
    private final int failed;

    public DeliveryResult(int hourUtc, int sent, int failed) {
        this.hourUtc = hourUtc;
        this.sent = sent;
        this.failed = failed;
    }

    public int getHourUtc() {
        return hourUtc;
    }

    public int getSent() {
        return sent;
    }

    public int getFailed() {
        return failed;
    }
}
