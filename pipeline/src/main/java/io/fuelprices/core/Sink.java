package io.fuelprices.core;

import java.io.Closeable;

/**
 * Sink consumes joined items, in the order the refresh loop hands them over.
 */
public interface Sink<T> extends Closeable {
    void accept(T item) throws Exception;

    @Override
    default void close() {}
}
