package edu.stanford.futuredata.tsquery.interfaces;

import edu.stanford.futuredata.tsquery.series.FieldMeta;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface MetadataDatabase {
    /*
     Dictionaries shared by all shards of a database.
     Reads may run concurrently.
     */

    // Namespaces starting with prefix, at most limit of them.
    List<String> suggestNamespace(String prefix, int limit) throws IOException;
    // Metric names of a namespace starting with prefix, at most limit of them.
    List<String> suggestMetrics(String namespace, String prefix, int limit) throws IOException;
    Optional<Integer> getMetricID(String namespace, String metricName) throws IOException;
    List<String> getAllTagKeys(String namespace, String metricName) throws IOException;
    Optional<Integer> getTagKeyID(String namespace, String metricName, String tagKey) throws IOException;
    List<FieldMeta> getAllFields(String namespace, String metricName) throws IOException;
}
