package edu.stanford.futuredata.tsquery.interfaces;

import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.util.List;

public interface IndexDatabase {
    // Values of a tag key starting with prefix, at most limit of them.
    List<String> suggestTagValues(int tagKeyID, String prefix, int limit) throws IOException;
    // Series carrying any of the given values of a tag key.
    RoaringBitmap getSeriesIDsByTagValueIDs(int tagKeyID, RoaringBitmap tagValueIDs) throws IOException;
    // Series carrying the tag key at all.
    RoaringBitmap getSeriesIDsForTag(int tagKeyID) throws IOException;
    // Every series of a metric.
    RoaringBitmap getSeriesIDsForMetric(int metricID) throws IOException;
    GroupingContext getGroupingContext(List<Integer> tagKeyIDs) throws IOException;
}
