package io.fuelprices.runtime;

import io.fuelprices.core.JoinedPrice;
import io.fuelprices.core.PriceRecord;
import io.fuelprices.core.Station;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Enriches price records with station metadata. Every record yields exactly one output, in input
 * order; records without a station get empty metadata.
 */
public final class StationJoin {
    private StationJoin() {}

    public static List<JoinedPrice> join(List<PriceRecord> prices, Map<Long, Station> stations) {
        List<JoinedPrice> out = new ArrayList<>(prices.size());
        for (PriceRecord price : prices) {
            Station station = stations.get(price.stationId());
            out.add(station == null ? JoinedPrice.unmatched(price) : JoinedPrice.of(price, station));
        }
        return out;
    }
}
