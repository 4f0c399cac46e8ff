package edu.stanford.futuredata.tsquery.interfaces;

import org.roaringbitmap.RoaringBitmap;

import java.util.List;

/** Maps series to the tag value ids of a fixed list of tag keys. */
public interface GroupingContext {

    List<Integer> tagKeyIDs();

    /** For each tag key, in order, the value ids carried by any of the given series. */
    List<RoaringBitmap> scanTagValueIDs(RoaringBitmap seriesIDs);

    /** Value ids of one series aligned with {@link #tagKeyIDs()}; negative where the tag is absent. */
    int[] tagValueIDs(int seriesID);
}
