package io.fuelprices.error;

/**
 * A field value failed type conversion.
 */
public class MalformedFieldException extends FeedException {
    private final String field;
    private final String value;
    private final long line;

    public MalformedFieldException(String field, String value, long line, Throwable cause) {
        super("line " + line + ": " + field + " is not valid: '" + value + "'", cause);
        this.field = field;
        this.value = value;
        this.line = line;
    }

    public String field() { return field; }
    public String value() { return value; }
    public long line() { return line; }
}
