package io.proxysql.exporter.scraper;

public class UnknownStatusException extends MalformedValueException {

    public UnknownStatusException(String field, String rawValue) {
        super(field, rawValue, "Unknown backend status '" + rawValue + "' in field " + field);
    }
}
