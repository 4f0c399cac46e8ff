package edu.stanford.futuredata.tsquery.interfaces;

import java.util.Optional;

public interface TSDBDatabase {
    // Database name.
    String name();
    // Return the shard if this node owns it.
    Optional<Shard> getShard(int shardID);
    // Namespace, metric, tag key and field dictionaries.
    MetadataDatabase metadataDatabase();
    // Tag value dictionary.
    TagMetadata tagMetadata();
}
