package io.proxysql.exporter.scraper;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns the text values of admin tables into sample values and labels.
 *
 * <p>All functions are pure and can be called from any scraper thread.</p>
 */
public final class ValueCoercion {

    public static final String FIELD_HOSTGROUP = "hostgroup";
    public static final String FIELD_SRV_HOST = "srv_host";
    public static final String FIELD_SRV_PORT = "srv_port";
    public static final String FIELD_CLI_HOST = "cli_host";
    public static final String FIELD_STATUS = "status";

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Set<String> LABEL_FIELDS = Set.of(FIELD_HOSTGROUP, FIELD_SRV_HOST, FIELD_SRV_PORT, FIELD_CLI_HOST);

    /**
     * Result of coercing one field: either a label (no value) or a numeric sample value.
     */
    public record Coerced(double value, boolean label) {
        static final Coerced LABEL = new Coerced(Double.NaN, true);
    }

    private ValueCoercion() {}

    public static boolean isLabel(String fieldName) {
        return fieldName != null && LABEL_FIELDS.contains(fieldName.toLowerCase(Locale.ROOT));
    }

    public static Coerced parse(String fieldName, String rawText) throws MalformedValueException {
        if (isLabel(fieldName)) {
            return Coerced.LABEL;
        }
        if (FIELD_STATUS.equalsIgnoreCase(fieldName)) {
            return new Coerced(StatusOrdinal.of(fieldName, rawText).value(), false);
        }
        return new Coerced(parseNumber(fieldName, rawText), false);
    }

    public static double parseNumber(String fieldName, String rawText) throws MalformedValueException {
        if (rawText == null) {
            throw new MalformedValueException(fieldName, null, "Field " + fieldName + " is NULL");
        }
        String text = rawText.trim();
        // stricter than Double.parseDouble: no hex floats, NaN/Infinity or type suffixes
        if (!DECIMAL.matcher(text).matches()) {
            throw new MalformedValueException(fieldName, rawText, "Field " + fieldName + " is not numeric: '" + rawText + "'");
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new MalformedValueException(fieldName, rawText, "Field " + fieldName + " is not numeric: '" + rawText + "'", e);
        }
    }

    /**
     * The {@code endpoint} label shared by every metric describing a backend server.
     */
    public static String endpoint(String host, String port) {
        return host + ":" + port;
    }
}
