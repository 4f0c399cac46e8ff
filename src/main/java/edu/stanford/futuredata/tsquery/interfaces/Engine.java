package edu.stanford.futuredata.tsquery.interfaces;

import java.util.Optional;

public interface Engine {
    /*
     The storage engine of one storage node.
     Lives on a data store; every query executor reaches shards through it.
     */

    // Return the named database if this node hosts it.
    Optional<TSDBDatabase> getDatabase(String databaseName);
}
