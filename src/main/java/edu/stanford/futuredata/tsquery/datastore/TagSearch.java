package edu.stanford.futuredata.tsquery.datastore;

import edu.stanford.futuredata.tsquery.interfaces.MetadataDatabase;
import edu.stanford.futuredata.tsquery.interfaces.TagMetadata;
import edu.stanford.futuredata.tsquery.sql.expr.*;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves every tag filter of a condition to the tag value ids it matches. A filter over a tag
 * key the metric does not have matches nothing.
 */
public class TagSearch {

    private final MetadataDatabase metadataDatabase;
    private final TagMetadata tagMetadata;
    private final String namespace;
    private final String metricName;

    public TagSearch(MetadataDatabase metadataDatabase, TagMetadata tagMetadata, String namespace, String metricName) {
        this.metadataDatabase = metadataDatabase;
        this.tagMetadata = tagMetadata;
        this.namespace = namespace;
        this.metricName = metricName;
    }

    /** Keyed by the filter instances of {@code condition}. */
    public Map<TagFilter, TagFilterResult> filter(Expr condition) throws QueryException {
        Map<TagFilter, TagFilterResult> results = new IdentityHashMap<>();
        try {
            visit(condition, results);
        } catch (IOException e) {
            throw QueryException.indexRead(e);
        }
        return results;
    }

    private void visit(Expr expr, Map<TagFilter, TagFilterResult> results) throws IOException, QueryException {
        if (expr instanceof TagFilter) {
            TagFilter filter = (TagFilter) expr;
            Optional<Integer> tagKeyID = metadataDatabase.getTagKeyID(namespace, metricName, filter.getTagKey());
            if (tagKeyID.isEmpty()) {
                results.put(filter, new TagFilterResult(-1, new RoaringBitmap()));
            } else {
                results.put(filter, new TagFilterResult(tagKeyID.get(),
                        tagMetadata.findTagValueIDsByExpr(tagKeyID.get(), filter)));
            }
        } else if (expr instanceof ParenExpr) {
            visit(((ParenExpr) expr).expr, results);
        } else if (expr instanceof NotExpr) {
            visit(((NotExpr) expr).expr, results);
        } else if (expr instanceof BinaryExpr) {
            visit(((BinaryExpr) expr).left, results);
            visit(((BinaryExpr) expr).right, results);
        } else {
            throw QueryException.unsupportedStatement("tag filter " + expr);
        }
    }
}
