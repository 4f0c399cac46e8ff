package edu.stanford.futuredata.tsquery.interfaces;

import edu.stanford.futuredata.tsquery.sql.expr.TagFilter;
import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.util.Map;

public interface TagMetadata {
    // Ids of the values of a tag key that satisfy the filter.
    RoaringBitmap findTagValueIDsByExpr(int tagKeyID, TagFilter filter) throws IOException;
    // Ids of every value of a tag key.
    RoaringBitmap getTagValueIDsForTag(int tagKeyID) throws IOException;
    // Resolve tag value ids to their strings, adding them to result.
    void collectTagValues(int tagKeyID, RoaringBitmap tagValueIDs, Map<Integer, String> result) throws IOException;
}
