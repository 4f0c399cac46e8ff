package edu.stanford.futuredata.tsquery.interfaces;

import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.util.List;

public interface Shard {
    /*
     A horizontal partition of a database.
     Reads run at any time.
     */

    int id();
    // Inverted index from tag values to series ids.
    IndexDatabase indexDatabase();
    // Stream every point of the given fields for the given series within [startTime, endTime].
    void scan(int metricID, List<String> fields, RoaringBitmap seriesIDs, long startTime, long endTime,
              PointConsumer consumer) throws IOException;

    @FunctionalInterface
    interface PointConsumer {
        void accept(int seriesID, String field, long timestamp, double value);
    }
}
