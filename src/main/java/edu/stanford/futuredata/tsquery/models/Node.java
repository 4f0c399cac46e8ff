package edu.stanford.futuredata.tsquery.models;

import edu.stanford.futuredata.tsquery.utilities.Utilities;
import org.javatuples.Pair;

import java.io.Serializable;
import java.util.Objects;

/** A cluster participant, named by its {@code host:port} indicator. */
public final class Node implements Serializable, Comparable<Node> {

    public final String host;
    public final int port;

    public Node(String host, int port) {
        this.host = Objects.requireNonNull(host);
        this.port = port;
    }

    public static Node parse(String indicator) {
        Pair<String, Integer> hostPort = Utilities.parseConnectString(indicator);
        return new Node(hostPort.getValue0(), hostPort.getValue1());
    }

    public String indicator() {
        return String.format("%s:%d", host, port);
    }

    @Override
    public int compareTo(Node o) {
        return indicator().compareTo(o.indicator());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node)) return false;
        Node node = (Node) o;
        return port == node.port && host.equals(node.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return indicator();
    }
}
