package edu.stanford.futuredata.tsquery.tsmockinterface;

import edu.stanford.futuredata.tsquery.interfaces.MetadataDatabase;
import edu.stanford.futuredata.tsquery.interfaces.Shard;
import edu.stanford.futuredata.tsquery.interfaces.TSDBDatabase;
import edu.stanford.futuredata.tsquery.interfaces.TagMetadata;
import edu.stanford.futuredata.tsquery.series.FieldMeta;
import edu.stanford.futuredata.tsquery.series.FieldType;
import edu.stanford.futuredata.tsquery.sql.expr.TagFilter;
import org.roaringbitmap.RoaringBitmap;

import java.util.*;
import java.util.stream.Collectors;

/** In-memory database: dictionaries shared by its shards, ids handed out in insertion order. */
public class TSDatabase implements TSDBDatabase, MetadataDatabase, TagMetadata {

    private final String name;
    private final Map<Integer, TSShard> shards = new TreeMap<>();
    // "namespace/metric" -> metric id.
    private final Map<String, Integer> metrics = new TreeMap<>();
    // metric id -> tag key -> tag key id.
    private final Map<Integer, Map<String, Integer>> tagKeys = new HashMap<>();
    // tag key id -> tag value -> tag value id.
    private final Map<Integer, Map<String, Integer>> tagValues = new HashMap<>();
    private final Map<Integer, Map<String, FieldMeta>> fields = new HashMap<>();
    private int nextID = 1;

    public TSDatabase(String name) {
        this.name = name;
    }

    public synchronized TSShard createShard(int shardID) {
        return shards.computeIfAbsent(shardID, id -> new TSShard(id, this));
    }

    /** Writes one point, registering every name it mentions. */
    public synchronized void write(int shardID, String namespace, String metric, Map<String, String> tags,
                                   String field, long timestamp, double value) {
        int metricID = metrics.computeIfAbsent(namespace + "/" + metric, k -> nextID++);
        Map<String, Integer> keys = tagKeys.computeIfAbsent(metricID, k -> new TreeMap<>());
        Map<Integer, Integer> tagIDs = new TreeMap<>();
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            int tagKeyID = keys.computeIfAbsent(tag.getKey(), k -> nextID++);
            int tagValueID = tagValues.computeIfAbsent(tagKeyID, k -> new TreeMap<>())
                    .computeIfAbsent(tag.getValue(), k -> nextID++);
            tagIDs.put(tagKeyID, tagValueID);
        }
        Map<String, FieldMeta> metricFields = fields.computeIfAbsent(metricID, k -> new TreeMap<>());
        if (!metricFields.containsKey(field)) {
            metricFields.put(field, new FieldMeta(field, FieldType.SUM, metricFields.size() + 1));
        }
        createShard(shardID).write(metricID, tagIDs, field, timestamp, value);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized Optional<Shard> getShard(int shardID) {
        return Optional.ofNullable(shards.get(shardID));
    }

    @Override
    public MetadataDatabase metadataDatabase() {
        return this;
    }

    @Override
    public TagMetadata tagMetadata() {
        return this;
    }

    @Override
    public synchronized List<String> suggestNamespace(String prefix, int limit) {
        return metrics.keySet().stream().map(k -> k.substring(0, k.indexOf('/')))
                .filter(ns -> ns.startsWith(prefix)).distinct().limit(limit).collect(Collectors.toList());
    }

    @Override
    public synchronized List<String> suggestMetrics(String namespace, String prefix, int limit) {
        return metrics.keySet().stream().filter(k -> k.startsWith(namespace + "/"))
                .map(k -> k.substring(namespace.length() + 1))
                .filter(m -> m.startsWith(prefix)).limit(limit).collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<Integer> getMetricID(String namespace, String metricName) {
        return Optional.ofNullable(metrics.get(namespace + "/" + metricName));
    }

    @Override
    public synchronized List<String> getAllTagKeys(String namespace, String metricName) {
        Integer metricID = metrics.get(namespace + "/" + metricName);
        return metricID == null ? List.of() : new ArrayList<>(tagKeys.getOrDefault(metricID, Map.of()).keySet());
    }

    @Override
    public synchronized Optional<Integer> getTagKeyID(String namespace, String metricName, String tagKey) {
        Integer metricID = metrics.get(namespace + "/" + metricName);
        return metricID == null ? Optional.empty()
                : Optional.ofNullable(tagKeys.getOrDefault(metricID, Map.of()).get(tagKey));
    }

    @Override
    public synchronized List<FieldMeta> getAllFields(String namespace, String metricName) {
        Integer metricID = metrics.get(namespace + "/" + metricName);
        return metricID == null ? List.of() : new ArrayList<>(fields.getOrDefault(metricID, Map.of()).values());
    }

    @Override
    public synchronized RoaringBitmap findTagValueIDsByExpr(int tagKeyID, TagFilter filter) {
        RoaringBitmap ids = new RoaringBitmap();
        tagValues.getOrDefault(tagKeyID, Map.of()).forEach((value, id) -> {
            if (filter.matches(value)) {
                ids.add(id);
            }
        });
        return ids;
    }

    @Override
    public synchronized RoaringBitmap getTagValueIDsForTag(int tagKeyID) {
        RoaringBitmap ids = new RoaringBitmap();
        tagValues.getOrDefault(tagKeyID, Map.of()).values().forEach(ids::add);
        return ids;
    }

    @Override
    public synchronized void collectTagValues(int tagKeyID, RoaringBitmap tagValueIDs, Map<Integer, String> result) {
        tagValues.getOrDefault(tagKeyID, Map.of()).forEach((value, id) -> {
            if (tagValueIDs.contains(id)) {
                result.put(id, value);
            }
        });
    }

    /** Value strings of a tag key, for shards resolving prefixes. */
    synchronized Map<String, Integer> tagValueDictionary(int tagKeyID) {
        return new TreeMap<>(tagValues.getOrDefault(tagKeyID, Map.of()));
    }
}
