package com.nyct.transitgraph;

import lombok.Value;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Single-pair weighted shortest path.
 *
 * <p>Weights must be non-negative; with a negative weight the returned path and cost are undefined. A station may
 * sit in the queue several times; only the entry matching its current best distance is expanded, the rest are
 * skipped as stale. Equal distances are popped in station id order.</p>
 *
 * <p>Instances hold no per-search state and may be shared between threads.</p>
 */
public class DijkstraSearch {
    private static final Comparator<QueueEntry> QUEUE_ORDER = Comparator
            .comparingDouble(QueueEntry::getDistance)
            .thenComparing(QueueEntry::getNode);

    private final WeightedNetwork weighted;

    public DijkstraSearch(WeightedNetwork weighted) {
        this.weighted = weighted;
    }

    public PathResult shortestPath(String start, String target) {
        final TransitNetwork network = weighted.getNetwork();
        if (!network.containsNode(start) || !network.containsNode(target)) {
            return PathResult.notFound();
        }

        final SearchState state = new SearchState(start);
        final PriorityQueue<QueueEntry> queue = new PriorityQueue<>(QUEUE_ORDER);
        queue.add(new QueueEntry(0.0, start));

        while (!queue.isEmpty()) {
            final QueueEntry entry = queue.poll();
            final String current = entry.getNode();

            if (entry.getDistance() > state.distance(current)) {
                continue;
            }

            if (current.equals(target)) {
                return PathResult.of(state.pathTo(target), entry.getDistance());
            }

            for (TransitEdge edge : network.incidentEdges(current)) {
                final String neighbor = edge.opposite(current);
                final double candidate = entry.getDistance() + weighted.weight(edge);
                if (candidate < state.distance(neighbor)) {
                    state.reach(neighbor, current, candidate);
                    queue.add(new QueueEntry(candidate, neighbor));
                }
            }
        }

        return PathResult.notFound();
    }

    @Value
    private static class QueueEntry {
        double distance;
        String node;
    }
}
