package io.fuelprices.core;

import io.fuelprices.error.FetchException;

import java.io.InputStream;

/**
 * Opens the raw payload of one upstream feed. Each call performs a fresh, full-body fetch;
 * the caller owns and closes the returned stream.
 */
public interface FeedSource {
    String name();

    InputStream open() throws FetchException;
}
