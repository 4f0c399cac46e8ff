package edu.stanford.futuredata.tsquery.datastore;

import edu.stanford.futuredata.tsquery.interfaces.*;
import edu.stanford.futuredata.tsquery.series.SeriesAggregator;
import edu.stanford.futuredata.tsquery.series.TimeSeries;
import edu.stanford.futuredata.tsquery.sql.AggregateType;
import edu.stanford.futuredata.tsquery.sql.Query;
import edu.stanford.futuredata.tsquery.sql.SelectItem;
import edu.stanford.futuredata.tsquery.sql.expr.TagFilter;
import edu.stanford.futuredata.tsquery.task.RequestContext;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * Runs a data query over this node's shards: selects series by tag condition, scans the
 * selected fields in the time range, down-samples and groups by the group-by tags.
 */
public class StorageQueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(StorageQueryExecutor.class);

    private final TSDBDatabase database;
    private final Query query;
    private final List<Integer> shardIDs;
    private final RequestContext ctx;

    public StorageQueryExecutor(TSDBDatabase database, Query query, List<Integer> shardIDs, RequestContext ctx) {
        this.database = database;
        this.query = query;
        this.shardIDs = shardIDs;
        this.ctx = ctx;
    }

    public SeriesAggregator execute() throws QueryException {
        SeriesAggregator aggregator = new SeriesAggregator();
        MetadataDatabase metadata = database.metadataDatabase();
        try {
            Optional<Integer> metricID = metadata.getMetricID(query.namespace, query.metricName);
            if (metricID.isEmpty()) {
                logger.debug("Metric {} not found in {}", query.metricName, database.name());
                return aggregator;
            }
            List<Integer> groupByKeyIDs = new ArrayList<>();
            for (String tagKey : query.groupBy) {
                groupByKeyIDs.add(metadata.getTagKeyID(query.namespace, query.metricName, tagKey)
                        .orElseThrow(() -> QueryException.tagKeyNotFound(tagKey)));
            }
            Map<TagFilter, TagFilterResult> filterResults = query.condition == null ? null
                    : new TagSearch(metadata, database.tagMetadata(), query.namespace, query.metricName)
                    .filter(query.condition);
            Map<String, AggregateType> aggregates = new LinkedHashMap<>();
            for (SelectItem item : query.selectItems) {
                aggregates.put(item.field, item.aggregate);
            }
            List<String> fields = new ArrayList<>(aggregates.keySet());

            for (Integer shardID : shardIDs) {
                ctx.checkCancelled();
                Optional<Shard> shard = database.getShard(shardID);
                if (shard.isEmpty()) {
                    logger.warn("Shard {} of {} not found, skipping", shardID, database.name());
                    continue;
                }
                IndexDatabase index = shard.get().indexDatabase();
                RoaringBitmap seriesIDs = filterResults == null ? index.getSeriesIDsForMetric(metricID.get())
                        : new SeriesSearch(index, filterResults, metricID.get()).search(query.condition);
                if (seriesIDs.isEmpty()) {
                    continue;
                }
                Map<Integer, TimeSeries> seriesGroups = group(index, groupByKeyIDs, seriesIDs);
                shard.get().scan(metricID.get(), fields, seriesIDs, query.startTime, query.endTime,
                        (seriesID, field, timestamp, value) -> {
                            TimeSeries target = seriesGroups.get(seriesID);
                            AggregateType aggregate = aggregates.get(field);
                            if (target != null && aggregate != null) {
                                target.field(field, aggregate)
                                        .addRaw(SeriesAggregator.bucket(timestamp, query.interval), value);
                            }
                        });
                seriesGroups.values().stream().distinct().filter(s -> !s.fields.isEmpty()).forEach(aggregator::add);
            }
        } catch (IOException e) {
            throw QueryException.indexRead(e);
        }
        return aggregator;
    }

    /** Maps every series to the (shared) series of its group; series lacking a group-by tag are left out. */
    private Map<Integer, TimeSeries> group(IndexDatabase index, List<Integer> groupByKeyIDs, RoaringBitmap seriesIDs)
            throws IOException {
        Map<Integer, TimeSeries> seriesGroups = new HashMap<>();
        if (groupByKeyIDs.isEmpty()) {
            TimeSeries all = new TimeSeries(new TreeMap<>());
            seriesIDs.forEach((int seriesID) -> seriesGroups.put(seriesID, all));
            return seriesGroups;
        }
        GroupingContext grouping = index.getGroupingContext(groupByKeyIDs);
        List<RoaringBitmap> valueIDs = grouping.scanTagValueIDs(seriesIDs);
        List<Map<Integer, String>> values = new ArrayList<>();
        for (int i = 0; i < groupByKeyIDs.size(); i++) {
            Map<Integer, String> resolved = new HashMap<>();
            database.tagMetadata().collectTagValues(groupByKeyIDs.get(i), valueIDs.get(i), resolved);
            values.add(resolved);
        }
        Map<TreeMap<String, String>, TimeSeries> groups = new HashMap<>();
        for (int seriesID : seriesIDs) {
            int[] ids = grouping.tagValueIDs(seriesID);
            TreeMap<String, String> tags = new TreeMap<>();
            for (int i = 0; i < groupByKeyIDs.size(); i++) {
                String value = ids[i] < 0 ? null : values.get(i).get(ids[i]);
                if (value == null) {
                    tags = null;
                    break;
                }
                tags.put(query.groupBy.get(i), value);
            }
            if (tags != null) {
                seriesGroups.put(seriesID, groups.computeIfAbsent(tags, TimeSeries::new));
            }
        }
        return seriesGroups;
    }
}
