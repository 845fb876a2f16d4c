package dcc.quoteme.lambda.model;

/**
 * Location and size of an export object written to S3.
 */
public class ExportResult {
    private final String url;
    private final String key;
    private final String expiresIn;
    private final long originalSize;
    private final long compressedSize;
    private final String format;

    public ExportResult(String url, String key, String expiresIn, long originalSize, long compressedSize, String format) {
        this.url = url;
        this.key = key;
        this.expiresIn = expiresIn;
        this.originalSize = originalSize;
        this.compressedSize = compressedSize;
        this.format = format;
    }

    public String getUrl() {
        return url;
    }

    public String getKey() {
        return key;
    }

    public String getExpiresIn() {
        return expiresIn;
    }

    public long getOriginalSize() {
        return originalSize;
    }

    public long getCompressedSize() {
        return compressedSize;
    }

    public String getFormat() {
        return format;
    }
}
