package edu.stanford.futuredata.tsquery.broker;

import com.fasterxml.jackson.core.type.TypeReference;
import edu.stanford.futuredata.tsquery.interfaces.ClusterView;
import edu.stanford.futuredata.tsquery.models.DatabaseDescriptor;
import edu.stanford.futuredata.tsquery.models.Node;
import edu.stanford.futuredata.tsquery.utilities.Utilities;
import org.apache.curator.RetryPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.apache.zookeeper.CreateMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Cluster view kept in ZooKeeper. Live brokers are ephemeral nodes under {@code /tsquery/brokers};
 * each database's shard assignment is a JSON document under {@code /tsquery/databases}.
 */
public class BrokerCurator implements ClusterView {
    private final CuratorFramework cf;
    private static final Logger logger = LoggerFactory.getLogger(BrokerCurator.class);

    static final String BROKERS_PATH = "/tsquery/brokers";
    static final String DATABASES_PATH = "/tsquery/databases";
    private static final TypeReference<Map<String, List<Integer>>> ASSIGNMENT = new TypeReference<>() {};

    public BrokerCurator(String zkHost, int zkPort) {
        this(String.format("%s:%d", zkHost, zkPort));
    }

    public BrokerCurator(String connectString) {
        RetryPolicy retryPolicy = new ExponentialBackoffRetry(1000, 3);
        this.cf = CuratorFrameworkFactory.newClient(connectString, retryPolicy);
        cf.start();
    }

    public void close() {
        cf.close();
    }

    /** Announces a live broker for as long as this session lasts. */
    public boolean registerBroker(Node broker) {
        try {
            String path = String.format("%s/%s", BROKERS_PATH, broker.indicator());
            if (cf.checkExists().forPath(path) != null) {
                cf.delete().forPath(path);
            }
            cf.create().creatingParentsIfNeeded().withMode(CreateMode.EPHEMERAL).forPath(path);
            return true;
        } catch (Exception e) {
            logger.error("ZK Failure {}", e.getMessage());
            return false;
        }
    }

    public boolean putDatabase(DatabaseDescriptor database) {
        try {
            String path = String.format("%s/%s", DATABASES_PATH, database.name);
            byte[] data = Utilities.toJSON(database.getShardAssignment()).getBytes(StandardCharsets.UTF_8);
            if (cf.checkExists().forPath(path) != null) {
                cf.setData().forPath(path, data);
            } else {
                cf.create().creatingParentsIfNeeded().forPath(path, data);
            }
            return true;
        } catch (Exception e) {
            logger.error("ZK Failure {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<DatabaseDescriptor> databases() {
        List<DatabaseDescriptor> databases = new ArrayList<>();
        for (String name : children(DATABASES_PATH)) {
            database(name).ifPresent(databases::add);
        }
        return databases;
    }

    @Override
    public Optional<DatabaseDescriptor> database(String name) {
        try {
            String path = String.format("%s/%s", DATABASES_PATH, name);
            if (cf.checkExists().forPath(path) == null) {
                return Optional.empty();
            }
            byte[] b = cf.getData().forPath(path);
            return Optional.of(new DatabaseDescriptor(name, Utilities.fromJSON(b, ASSIGNMENT)));
        } catch (Exception e) {
            logger.error("ZK Failure reading database {}: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<Node> liveBrokers() {
        List<Node> brokers = new ArrayList<>();
        for (String indicator : children(BROKERS_PATH)) {
            try {
                brokers.add(Node.parse(indicator));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping unparsable broker {}", indicator);
            }
        }
        Collections.sort(brokers);
        return brokers;
    }

    @Override
    public List<Node> storageNodes() {
        Set<Node> nodes = new TreeSet<>();
        for (DatabaseDescriptor database : databases()) {
            for (String indicator : database.getShardAssignment().keySet()) {
                try {
                    nodes.add(Node.parse(indicator));
                } catch (IllegalArgumentException e) {
                    logger.warn("Skipping unparsable storage node {} of {}", indicator, database.name);
                }
            }
        }
        return new ArrayList<>(nodes);
    }

    private List<String> children(String path) {
        try {
            if (cf.checkExists().forPath(path) == null) {
                return List.of();
            }
            List<String> children = new ArrayList<>(cf.getChildren().forPath(path));
            Collections.sort(children);
            return children;
        } catch (Exception e) {
            logger.error("ZK Failure {}", e.getMessage());
            return List.of();
        }
    }
}
