package edu.stanford.futuredata.tsquery.datastore;

import edu.stanford.futuredata.tsquery.interfaces.IndexDatabase;
import edu.stanford.futuredata.tsquery.sql.expr.*;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.util.Map;

/** Evaluates a tag condition over one shard's index into the ids of matching series. */
public class SeriesSearch {

    private final IndexDatabase index;
    private final Map<TagFilter, TagFilterResult> filterResults;
    private final int metricID;

    public SeriesSearch(IndexDatabase index, Map<TagFilter, TagFilterResult> filterResults, int metricID) {
        this.index = index;
        this.filterResults = filterResults;
        this.metricID = metricID;
    }

    public RoaringBitmap search(Expr condition) throws QueryException {
        try {
            return eval(condition);
        } catch (IOException e) {
            throw QueryException.indexRead(e);
        }
    }

    private RoaringBitmap eval(Expr expr) throws IOException, QueryException {
        if (expr instanceof TagFilter) {
            TagFilterResult r = filterResults.get(expr);
            if (r == null || r.tagKeyID < 0 || r.tagValueIDs.isEmpty()) {
                return new RoaringBitmap();
            }
            return index.getSeriesIDsByTagValueIDs(r.tagKeyID, r.tagValueIDs);
        } else if (expr instanceof ParenExpr) {
            return eval(((ParenExpr) expr).expr);
        } else if (expr instanceof NotExpr) {
            Expr inner = ((NotExpr) expr).expr;
            return RoaringBitmap.andNot(universe(inner), eval(inner));
        } else if (expr instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) expr;
            RoaringBitmap left = eval(binary.left);
            if (binary.operator == BinaryExpr.Operator.AND && left.isEmpty()) {
                return left;
            }
            RoaringBitmap right = eval(binary.right);
            return binary.operator == BinaryExpr.Operator.AND
                    ? RoaringBitmap.and(left, right) : RoaringBitmap.or(left, right);
        }
        throw QueryException.unsupportedStatement("tag filter " + expr);
    }

    /** Negation of a single filter ranges over series having its tag key; anything else over the metric. */
    private RoaringBitmap universe(Expr negated) throws IOException {
        Expr e = negated;
        while (e instanceof ParenExpr) {
            e = ((ParenExpr) e).expr;
        }
        if (e instanceof TagFilter) {
            TagFilterResult r = filterResults.get(e);
            if (r == null || r.tagKeyID < 0) {
                return new RoaringBitmap();
            }
            return index.getSeriesIDsForTag(r.tagKeyID);
        }
        return index.getSeriesIDsForMetric(metricID);
    }
}
