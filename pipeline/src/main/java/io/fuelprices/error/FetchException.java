package io.fuelprices.error;

/** Transport failure reaching a feed, or an I/O failure while reading its body. */
public class FetchException extends FeedException {
    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
