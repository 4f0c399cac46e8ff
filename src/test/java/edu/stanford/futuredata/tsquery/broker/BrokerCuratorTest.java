package edu.stanford.futuredata.tsquery.broker;

import edu.stanford.futuredata.tsquery.models.DatabaseDescriptor;
import edu.stanford.futuredata.tsquery.models.Node;
import org.apache.curator.test.TestingServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BrokerCuratorTest {

    private TestingServer zkServer;
    private BrokerCurator curator;

    @BeforeEach
    public void startZookeeper() throws Exception {
        zkServer = new TestingServer();
        curator = new BrokerCurator(zkServer.getConnectString());
    }

    @AfterEach
    public void stopZookeeper() throws Exception {
        curator.close();
        zkServer.close();
    }

    @Test
    public void testDatabasesAndStorageNodes() {
        assertTrue(curator.databases().isEmpty());
        assertTrue(curator.storageNodes().isEmpty());
        assertTrue(curator.putDatabase(new DatabaseDescriptor("metrics",
                Map.of("1.1.1.1:9000", List.of(1, 2), "1.1.1.2:9000", List.of(3)))));
        assertTrue(curator.putDatabase(new DatabaseDescriptor("logs", Map.of("1.1.1.2:9000", List.of(1)))));

        List<DatabaseDescriptor> databases = curator.databases();
        assertEquals(2, databases.size());
        assertEquals("logs", databases.get(0).name);
        assertEquals("metrics", databases.get(1).name);
        assertEquals(List.of(1, 2), curator.database("metrics").orElseThrow().getShardAssignment().get("1.1.1.1:9000"));
        assertTrue(curator.database("traces").isEmpty());
        assertEquals(List.of(new Node("1.1.1.1", 9000), new Node("1.1.1.2", 9000)), curator.storageNodes());

        // Re-assignment overwrites.
        assertTrue(curator.putDatabase(new DatabaseDescriptor("logs", Map.of("1.1.1.3:9000", List.of(1)))));
        assertEquals(List.of(1), curator.database("logs").orElseThrow().getShardAssignment().get("1.1.1.3:9000"));
        assertEquals(3, curator.storageNodes().size());
    }

    @Test
    public void testBrokerRegistrationIsSessionScoped() throws Exception {
        assertTrue(curator.registerBroker(new Node("1.1.1.5", 8000)));
        assertTrue(curator.registerBroker(new Node("1.1.1.4", 8000)));
        assertTrue(curator.registerBroker(new Node("1.1.1.4", 8000)));
        assertEquals(List.of(new Node("1.1.1.4", 8000), new Node("1.1.1.5", 8000)), curator.liveBrokers());

        BrokerCurator observer = new BrokerCurator(zkServer.getConnectString());
        try {
            assertEquals(2, observer.liveBrokers().size());
            curator.close();
            curator = new BrokerCurator(zkServer.getConnectString());
            long deadline = System.currentTimeMillis() + 10_000;
            while (!observer.liveBrokers().isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(50);
            }
            assertTrue(observer.liveBrokers().isEmpty());
        } finally {
            observer.close();
        }
    }
}
