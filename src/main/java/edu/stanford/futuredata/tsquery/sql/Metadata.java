package edu.stanford.futuredata.tsquery.sql;

import edu.stanford.futuredata.tsquery.sql.expr.Expr;

import java.util.Objects;

/** A SHOW/SUGGEST statement. */
public final class Metadata implements Statement {

    public static final int DEFAULT_LIMIT = 100;

    public final MetadataType type;
    public final String namespace;
    public final String metricName;
    public final String tagKey;
    public final String prefix;
    // Tag filter for tag value suggestion, may be null.
    public final Expr condition;
    public final int limit;

    public Metadata(MetadataType type, String namespace, String metricName, String tagKey, String prefix,
                    Expr condition, int limit) {
        this.type = type;
        this.namespace = namespace == null || namespace.isEmpty() ? Query.DEFAULT_NAMESPACE : namespace;
        this.metricName = metricName == null ? "" : metricName;
        this.tagKey = tagKey == null ? "" : tagKey;
        this.prefix = prefix == null ? "" : prefix;
        this.condition = condition;
        this.limit = limit <= 0 ? DEFAULT_LIMIT : limit;
    }

    public static Metadata showDatabases() {
        return new Metadata(MetadataType.DATABASE, null, null, null, null, null, 0);
    }

    public static Metadata showNamespaces(String prefix, int limit) {
        return new Metadata(MetadataType.NAMESPACE, null, null, null, prefix, null, limit);
    }

    public static Metadata showMetrics(String namespace, String prefix, int limit) {
        return new Metadata(MetadataType.METRIC, namespace, null, null, prefix, null, limit);
    }

    public static Metadata showTagKeys(String namespace, String metricName, int limit) {
        return new Metadata(MetadataType.TAG_KEY, namespace, metricName, null, null, null, limit);
    }

    public static Metadata showTagValues(String namespace, String metricName, String tagKey, String prefix,
                                         Expr condition, int limit) {
        return new Metadata(MetadataType.TAG_VALUE, namespace, metricName, tagKey, prefix, condition, limit);
    }

    public static Metadata showFields(String namespace, String metricName) {
        return new Metadata(MetadataType.FIELD, namespace, metricName, null, null, null, 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Metadata)) return false;
        Metadata that = (Metadata) o;
        return limit == that.limit && type == that.type && namespace.equals(that.namespace)
                && metricName.equals(that.metricName) && tagKey.equals(that.tagKey) && prefix.equals(that.prefix)
                && Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, namespace, metricName, tagKey, prefix, condition, limit);
    }

    @Override
    public String toString() {
        return "show " + type + " metric=" + metricName + " tagKey=" + tagKey + " prefix=" + prefix
                + (condition == null ? "" : " where " + condition) + " limit " + limit;
    }
}
