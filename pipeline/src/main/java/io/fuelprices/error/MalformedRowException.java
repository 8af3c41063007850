package io.fuelprices.error;

/**
 * A row does not have the structure the feed requires, usually a wrong field count.
 */
public class MalformedRowException extends FeedException {
    private final long line;

    public MalformedRowException(long line, String message) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    public static MalformedRowException fieldCount(long line, String expected, int actual) {
        return new MalformedRowException(line, "expected " + expected + " fields, got " + actual);
    }

    public long line() { return line; }
}
