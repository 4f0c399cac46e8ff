package edu.stanford.futuredata.tsquery.tsmockinterface;

import edu.stanford.futuredata.tsquery.interfaces.Engine;
import edu.stanford.futuredata.tsquery.interfaces.TSDBDatabase;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class TSEngine implements Engine {

    private final Map<String, TSDatabase> databases = new ConcurrentHashMap<>();

    public TSDatabase createDatabase(String name) {
        return databases.computeIfAbsent(name, TSDatabase::new);
    }

    @Override
    public Optional<TSDBDatabase> getDatabase(String databaseName) {
        return Optional.ofNullable(databases.get(databaseName));
    }
}
