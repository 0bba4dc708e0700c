package com.rcasentinel.core.graph;

import com.rcasentinel.core.model.CallEdge;
import com.rcasentinel.core.model.GraphStats;
import com.rcasentinel.core.model.ServiceNode;
import com.rcasentinel.core.model.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only directed call graph of one snapshot.
 *
 * <p>
 * An edge {@code a -> b} means "a calls b": {@code a} is upstream of
 * {@code b}. Construction never fails on inconsistent topology data; edges
 * with an unknown endpoint and self-calls are dropped and recorded in
 * {@link #warnings()}.
 * </p>
 *
 * <h3>Traversal</h3>
 * <p>
 * All walks are breadth-first with a visited set and a hop bound, so cycles
 * terminate. Neighbours are visited in id order, which makes every result
 * independent of insertion and hashing order.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Immutable after {@link #build}; safe for concurrent readers.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceGraph implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(ServiceGraph.class);

    private final Map<String, ServiceNode> nodes;
    private final Map<String, SortedSet<String>> callers;
    private final Map<String, SortedSet<String>> callees;
    private final Map<String, String> idsByName;
    private final int edgeCount;
    private final int droppedEdges;
    private final List<String> warnings;

    private ServiceGraph(Map<String, ServiceNode> nodes,
            Map<String, SortedSet<String>> callers,
            Map<String, SortedSet<String>> callees,
            Map<String, String> idsByName,
            int edgeCount,
            int droppedEdges,
            List<String> warnings) {
        this.nodes = nodes;
        this.callers = callers;
        this.callees = callees;
        this.idsByName = idsByName;
        this.edgeCount = edgeCount;
        this.droppedEdges = droppedEdges;
        this.warnings = List.copyOf(warnings);
    }

    // ---------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------

    public static ServiceGraph from(Topology topology) {
        Objects.requireNonNull(topology, "Topology must not be null");
        return build(topology.getNodes(), topology.getCalls());
    }

    /**
     * Build a graph from raw node and edge lists.
     *
     * @param nodeList nodes; later duplicates of an id are ignored
     * @param edgeList call edges; duplicates merge
     * @return the graph
     */
    public static ServiceGraph build(List<ServiceNode> nodeList, List<CallEdge> edgeList) {
        Objects.requireNonNull(nodeList, "Node list must not be null");
        Objects.requireNonNull(edgeList, "Edge list must not be null");

        List<String> warnings = new ArrayList<>();
        Map<String, ServiceNode> nodes = new TreeMap<>();
        Map<String, String> idsByName = new HashMap<>();
        for (ServiceNode node : nodeList) {
            if (nodes.containsKey(node.getId())) {
                warn(warnings, "Duplicate node id '" + node.getId() + "' ignored");
                continue;
            }
            nodes.put(node.getId(), node);
            idsByName.putIfAbsent(node.getName(), node.getId());
        }

        Map<String, SortedSet<String>> callers = new HashMap<>();
        Map<String, SortedSet<String>> callees = new HashMap<>();
        for (String id : nodes.keySet()) {
            callers.put(id, new TreeSet<>());
            callees.put(id, new TreeSet<>());
        }

        int edges = 0;
        int dropped = 0;
        for (CallEdge edge : edgeList) {
            String source = edge.getSource();
            String target = edge.getTarget();
            if (!nodes.containsKey(source) || !nodes.containsKey(target)) {
                String missing = !nodes.containsKey(source) ? source : target;
                warn(warnings, "Dropped edge " + source + " -> " + target
                        + ": unknown service '" + missing + "'");
                dropped++;
                continue;
            }
            if (source.equals(target)) {
                warn(warnings, "Dropped self-call on '" + source + "'");
                dropped++;
                continue;
            }
            if (callees.get(source).add(target)) {
                callers.get(target).add(source);
                edges++;
            }
        }

        Map<String, SortedSet<String>> frozenCallers = new HashMap<>();
        Map<String, SortedSet<String>> frozenCallees = new HashMap<>();
        callers.forEach((id, set) -> frozenCallers.put(id, Collections.unmodifiableSortedSet(set)));
        callees.forEach((id, set) -> frozenCallees.put(id, Collections.unmodifiableSortedSet(set)));

        LOG.debug("Built service graph: {} nodes, {} edges, {} dropped", nodes.size(), edges, dropped);
        return new ServiceGraph(Collections.unmodifiableMap(nodes), frozenCallers, frozenCallees,
                idsByName, edges, dropped, warnings);
    }

    private static void warn(List<String> warnings, String message) {
        LOG.warn(message);
        warnings.add(message);
    }

    // ---------------------------------------------------------------
    // Node queries
    // ---------------------------------------------------------------

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public boolean contains(String serviceId) {
        return serviceId != null && nodes.containsKey(serviceId);
    }

    public Optional<ServiceNode> node(String serviceId) {
        return Optional.ofNullable(serviceId == null ? null : nodes.get(serviceId));
    }

    /**
     * @return all nodes ordered by id
     */
    public Collection<ServiceNode> nodes() {
        return nodes.values();
    }

    /**
     * Map a service reference to a node id. Ids win over names.
     *
     * @param idOrName node id or service name
     * @return the node id, or empty when the service is not in the graph
     */
    public Optional<String> resolve(String idOrName) {
        if (idOrName == null) {
            return Optional.empty();
        }
        if (nodes.containsKey(idOrName)) {
            return Optional.of(idOrName);
        }
        return Optional.ofNullable(idsByName.get(idOrName));
    }

    // ---------------------------------------------------------------
    // Adjacency
    // ---------------------------------------------------------------

    /**
     * @return immediate callers of {@code serviceId}; empty for unknown ids
     */
    public SortedSet<String> upstream(String serviceId) {
        return callers.getOrDefault(serviceId, Collections.emptySortedSet());
    }

    /**
     * @return services {@code serviceId} calls; empty for unknown ids
     */
    public SortedSet<String> downstream(String serviceId) {
        return callees.getOrDefault(serviceId, Collections.emptySortedSet());
    }

    public int fanIn(String serviceId) {
        return upstream(serviceId).size();
    }

    public int fanOut(String serviceId) {
        return downstream(serviceId).size();
    }

    // ---------------------------------------------------------------
    // Traversal
    // ---------------------------------------------------------------

    /**
     * Services reachable against edge direction within {@code maxDepth} hops,
     * excluding {@code serviceId} itself.
     */
    public Set<String> reachableUpstream(String serviceId, int maxDepth) {
        return new TreeSet<>(upstreamDistances(serviceId, maxDepth).keySet());
    }

    /**
     * Services reachable along edge direction within {@code maxDepth} hops,
     * excluding {@code serviceId} itself.
     */
    public Set<String> reachableDownstream(String serviceId, int maxDepth) {
        return new TreeSet<>(downstreamDistances(serviceId, maxDepth).keySet());
    }

    /**
     * @return hop distance of every upstream service within range, in BFS order
     */
    public Map<String, Integer> upstreamDistances(String serviceId, int maxDepth) {
        return distances(serviceId, maxDepth, callers);
    }

    /**
     * @return hop distance of every downstream service within range, in BFS
     *         order
     */
    public Map<String, Integer> downstreamDistances(String serviceId, int maxDepth) {
        return distances(serviceId, maxDepth, callees);
    }

    /**
     * Shortest forward call path from {@code from} to {@code to}.
     *
     * @return the path including both endpoints, or an empty list when
     *         {@code to} is not reachable within {@code maxDepth} hops
     */
    public List<String> shortestPath(String from, String to, int maxDepth) {
        checkDepth(maxDepth);
        if (!contains(from) || !contains(to)) {
            return List.of();
        }
        if (from.equals(to)) {
            return List.of(from);
        }
        Map<String, String> parent = new HashMap<>();
        Map<String, Integer> depth = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        depth.put(from, 0);
        queue.add(from);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int d = depth.get(current);
            if (d >= maxDepth) {
                continue;
            }
            for (String next : downstream(current)) {
                if (depth.containsKey(next)) {
                    continue;
                }
                depth.put(next, d + 1);
                parent.put(next, current);
                if (next.equals(to)) {
                    return unwind(parent, from, to);
                }
                queue.add(next);
            }
        }
        return List.of();
    }

    private static List<String> unwind(Map<String, String> parent, String from, String to) {
        List<String> path = new ArrayList<>();
        for (String at = to; at != null; at = at.equals(from) ? null : parent.get(at)) {
            path.add(at);
        }
        Collections.reverse(path);
        return path;
    }

    private Map<String, Integer> distances(String serviceId, int maxDepth,
            Map<String, SortedSet<String>> adjacency) {
        checkDepth(maxDepth);
        Map<String, Integer> result = new LinkedHashMap<>();
        if (!contains(serviceId)) {
            return result;
        }
        Set<String> visited = new TreeSet<>();
        visited.add(serviceId);
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(serviceId);
        for (int hop = 1; hop <= maxDepth && !frontier.isEmpty(); hop++) {
            Deque<String> next = new ArrayDeque<>();
            for (String current : frontier) {
                for (String neighbour : adjacency.get(current)) {
                    if (visited.add(neighbour)) {
                        result.put(neighbour, hop);
                        next.add(neighbour);
                    }
                }
            }
            frontier = next;
        }
        return result;
    }

    private static void checkDepth(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
    }

    // ---------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------

    public GraphStats stats() {
        return new GraphStats(nodes.size(), edgeCount, droppedEdges);
    }

    /**
     * @return warnings recorded while building the graph, in input order
     */
    public List<String> warnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "ServiceGraph{nodes=" + nodes.size() + ", edges=" + edgeCount
                + ", droppedEdges=" + droppedEdges + '}';
    }
}
