package io.fuelprices.core;

import java.util.List;

/** Optional sink capability to consume a whole iteration's items at once. */
public interface BatchSink<T> extends Sink<T> {
    void acceptBatch(List<T> items) throws Exception;
}
