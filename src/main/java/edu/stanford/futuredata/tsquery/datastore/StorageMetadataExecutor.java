package edu.stanford.futuredata.tsquery.datastore;

import edu.stanford.futuredata.tsquery.interfaces.GroupingContext;
import edu.stanford.futuredata.tsquery.interfaces.MetadataDatabase;
import edu.stanford.futuredata.tsquery.interfaces.Shard;
import edu.stanford.futuredata.tsquery.interfaces.TSDBDatabase;
import edu.stanford.futuredata.tsquery.sql.Metadata;
import edu.stanford.futuredata.tsquery.sql.expr.TagFilter;
import edu.stanford.futuredata.tsquery.task.RequestContext;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import edu.stanford.futuredata.tsquery.utilities.Utilities;
import org.roaringbitmap.PeekableIntIterator;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;
import java.util.stream.Collectors;

/** Answers a SHOW statement from this node's share of a database. */
public class StorageMetadataExecutor {
    private static final Logger logger = LoggerFactory.getLogger(StorageMetadataExecutor.class);

    private final TSDBDatabase database;
    private final Metadata statement;
    private final List<Integer> shardIDs;
    private final RequestContext ctx;

    public StorageMetadataExecutor(TSDBDatabase database, Metadata statement, List<Integer> shardIDs,
                                   RequestContext ctx) {
        this.database = database;
        this.statement = statement;
        this.shardIDs = shardIDs;
        this.ctx = ctx;
    }

    public List<String> execute() throws QueryException {
        MetadataDatabase metadata = database.metadataDatabase();
        try {
            switch (statement.type) {
                case NAMESPACE:
                    return metadata.suggestNamespace(statement.prefix, statement.limit);
                case METRIC:
                    return metadata.suggestMetrics(statement.namespace, statement.prefix, statement.limit);
                case TAG_KEY:
                    return metadata.getAllTagKeys(statement.namespace, statement.metricName).stream()
                            .filter(k -> k.startsWith(statement.prefix))
                            .limit(statement.limit)
                            .collect(Collectors.toList());
                case TAG_VALUE:
                    return suggestTagValues(metadata);
                case FIELD:
                    return List.of(Utilities.toJSON(metadata.getAllFields(statement.namespace, statement.metricName)));
                default:
                    throw QueryException.unknownMetadataType(statement.type);
            }
        } catch (IOException e) {
            throw QueryException.indexRead(e);
        }
    }

    private List<String> suggestTagValues(MetadataDatabase metadata) throws IOException, QueryException {
        Optional<Integer> tagKeyID = metadata.getTagKeyID(statement.namespace, statement.metricName, statement.tagKey);
        if (tagKeyID.isEmpty()) {
            return List.of();
        }
        if (statement.condition == null) {
            Set<String> values = new LinkedHashSet<>();
            for (Shard shard : shards()) {
                values.addAll(shard.indexDatabase().suggestTagValues(tagKeyID.get(), statement.prefix, statement.limit));
                if (values.size() >= statement.limit) {
                    break;
                }
            }
            return values.stream().limit(statement.limit).collect(Collectors.toList());
        }
        return filterTagValues(metadata, tagKeyID.get());
    }

    /** Values of the tag key carried by the series matching the condition. */
    private List<String> filterTagValues(MetadataDatabase metadata, int tagKeyID) throws IOException, QueryException {
        Map<TagFilter, TagFilterResult> filterResults = new TagSearch(metadata, database.tagMetadata(),
                statement.namespace, statement.metricName).filter(statement.condition);
        if (filterResults.values().stream().allMatch(r -> r.tagValueIDs.isEmpty())) {
            return List.of();
        }
        int metricID = metadata.getMetricID(statement.namespace, statement.metricName).orElse(-1);
        RoaringBitmap tagValueIDs = new RoaringBitmap();
        for (Shard shard : shards()) {
            RoaringBitmap seriesIDs = new SeriesSearch(shard.indexDatabase(), filterResults, metricID)
                    .search(statement.condition);
            if (seriesIDs.isEmpty()) {
                continue;
            }
            GroupingContext grouping = shard.indexDatabase().getGroupingContext(List.of(tagKeyID));
            tagValueIDs.or(grouping.scanTagValueIDs(seriesIDs).get(0));
        }
        if (tagValueIDs.isEmpty()) {
            return List.of();
        }
        if (statement.prefix.isEmpty()) {
            tagValueIDs = first(tagValueIDs, statement.limit);
        }
        Map<Integer, String> collected = new TreeMap<>();
        database.tagMetadata().collectTagValues(tagKeyID, tagValueIDs, collected);
        return collected.values().stream()
                .filter(v -> v.startsWith(statement.prefix))
                .limit(statement.limit)
                .collect(Collectors.toList());
    }

    private static RoaringBitmap first(RoaringBitmap ids, int limit) {
        if (ids.getCardinality() <= limit) {
            return ids;
        }
        RoaringBitmap truncated = new RoaringBitmap();
        PeekableIntIterator it = ids.getIntIterator();
        while (it.hasNext() && truncated.getCardinality() < limit) {
            truncated.add(it.next());
        }
        return truncated;
    }

    private List<Shard> shards() throws QueryException {
        List<Shard> shards = new ArrayList<>();
        for (Integer shardID : shardIDs) {
            ctx.checkCancelled();
            Optional<Shard> shard = database.getShard(shardID);
            if (shard.isEmpty()) {
                logger.warn("Shard {} of {} not found, skipping", shardID, database.name());
                continue;
            }
            shards.add(shard.get());
        }
        return shards;
    }
}
