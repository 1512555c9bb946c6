package io.proxysql.exporter.scraper;

/**
 * A field value could not be turned into a sample. Only that field is skipped.
 */
public class MalformedValueException extends ScrapeException {

    private final String field;
    private final String rawValue;

    public MalformedValueException(String field, String rawValue, String message) {
        super(message);
        this.field = field;
        this.rawValue = rawValue;
    }

    public MalformedValueException(String field, String rawValue, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
        this.rawValue = rawValue;
    }

    public String getField() {
        return field;
    }

    public String getRawValue() {
        return rawValue;
    }
}
