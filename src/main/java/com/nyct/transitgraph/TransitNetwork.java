package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import org.jgrapht.Graph;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.SimpleGraph;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableMap.toImmutableMap;

/**
 * The assembled station graph. Read-only once built; vertices are station ids.
 *
 * <p>Neighbors are always exposed sorted by station id, whatever order the trips were walked in, so traversals are
 * reproducible across reorderings of the input.</p>
 */
public class TransitNetwork {
    private final Graph<String, TransitEdge> graph;
    private final ImmutableMap<String, StationNode> nodes;
    private final ImmutableMap<String, RouteRecord> routes;
    private final ImmutableListMultimap<String, TransitEdge> incidentEdges;

    TransitNetwork(Collection<StationNode> nodes, Collection<TransitEdge> edges, Collection<RouteRecord> routes) {
        final Graph<String, TransitEdge> g = new SimpleGraph<>(TransitEdge.class);
        nodes.forEach(node -> g.addVertex(node.getId()));
        edges.forEach(edge -> g.addEdge(edge.getNodeA(), edge.getNodeB(), edge));

        this.graph = new AsUnmodifiableGraph<>(g);
        this.nodes = nodes.stream()
                .sorted(Comparator.comparing(StationNode::getId))
                .collect(toImmutableMap(StationNode::getId, n -> n));
        this.routes = routes.stream()
                .collect(toImmutableMap(RouteRecord::getRouteId, r -> r, (first, second) -> first));

        final ImmutableListMultimap.Builder<String, TransitEdge> incident = ImmutableListMultimap.builder();
        for (String id : this.nodes.keySet()) {
            incident.putAll(id, graph.edgesOf(id)
                    .stream()
                    .sorted(Comparator.comparing(e -> e.opposite(id)))
                    .collect(toImmutableList()));
        }
        this.incidentEdges = incident.build();
    }

    public Graph<String, TransitEdge> getGraph() {
        return graph;
    }

    /**
     * Station ids in ascending order. This is the enumeration the all-pairs sweep walks.
     */
    public ImmutableList<String> nodeIds() {
        return nodes.keySet().asList();
    }

    public Collection<StationNode> getNodes() {
        return nodes.values();
    }

    public Optional<StationNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    public Collection<TransitEdge> getEdges() {
        return graph.edgeSet();
    }

    public Optional<TransitEdge> edge(String u, String v) {
        if (!containsNode(u) || !containsNode(v)) {
            return Optional.empty();
        }
        return Optional.ofNullable(graph.getEdge(u, v));
    }

    /**
     * Edges touching {@code id}, ordered by the id of the station at the other end.
     */
    public List<TransitEdge> incidentEdges(String id) {
        return incidentEdges.get(id);
    }

    public List<String> neighbors(String id) {
        return incidentEdges.get(id)
                .stream()
                .map(e -> e.opposite(id))
                .collect(toImmutableList());
    }

    public int degree(String id) {
        return incidentEdges.get(id).size();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return graph.edgeSet().size();
    }

    public Optional<RouteRecord> route(String routeId) {
        return Optional.ofNullable(routes.get(routeId));
    }
}
