package edu.stanford.futuredata.tsquery.datastore;

import org.roaringbitmap.RoaringBitmap;

/** Value ids of one tag key that satisfied a tag filter. */
public final class TagFilterResult {

    public final int tagKeyID;
    public final RoaringBitmap tagValueIDs;

    public TagFilterResult(int tagKeyID, RoaringBitmap tagValueIDs) {
        this.tagKeyID = tagKeyID;
        this.tagValueIDs = tagValueIDs;
    }

    @Override
    public String toString() {
        return "TagFilterResult{" + tagKeyID + " " + tagValueIDs + "}";
    }
}
