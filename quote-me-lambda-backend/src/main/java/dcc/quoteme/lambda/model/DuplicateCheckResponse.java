package dcc.quoteme.lambda.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;

public class DuplicateCheckResponse {
    private String error;
    @SerializedName("is_duplicate")
    private boolean isDuplicate;
    @SerializedName("duplicate_count")
    private int duplicateCount;
    private List<DuplicateMatch> duplicates;
    private String message;

    public DuplicateCheckResponse() {
    }

    public DuplicateCheckResponse(boolean isDuplicate, int duplicateCount, List<DuplicateMatch> duplicates, String message) {
        this.isDuplicate = isDuplicate;
        this.duplicateCount = duplicateCount;
        this.duplicates = duplicates;
        this.message = message;
    }

    /**
     * Only set when the response blocks a quote creation.
     */
    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public boolean isDuplicate() {
        return isDuplicate;
    }

    public void setDuplicate(boolean duplicate) {
        isDuplicate = duplicate;
    }

    public int getDuplicateCount() {
        return duplicateCount;
    }

    public void setDuplicateCount(int duplicateCount) {
        this.duplicateCount = duplicateCount;
    }

    public List<DuplicateMatch> getDuplicates() {
        return duplicates;
    }

    public void setDuplicates(List<DuplicateMatch> duplicates) {
        this.duplicates = duplicates;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
