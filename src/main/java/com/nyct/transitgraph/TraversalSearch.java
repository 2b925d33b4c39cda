package com.nyct.transitgraph;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Unweighted depth-first and breadth-first path search. Both share one skeleton and differ only in which end of
 * the frontier is taken next. Edge weights are never consulted.
 *
 * <p>Neighbors are expanded in ascending station id, so depth-first search follows the greatest id first (it is
 * pushed last) and breadth-first search enqueues the smallest id first.</p>
 */
public class TraversalSearch {
    private final TransitNetwork network;

    public TraversalSearch(TransitNetwork network) {
        this.network = network;
    }

    /**
     * A path from {@code start} to {@code target}, not necessarily with the fewest edges.
     */
    public PathResult dfs(String start, String target) {
        return search(start, target, true);
    }

    /**
     * A path with the minimum number of edges. Among equally short paths the one discovered first wins.
     */
    public PathResult bfs(String start, String target) {
        return search(start, target, false);
    }

    private PathResult search(String start, String target, boolean lastInFirstOut) {
        if (!network.containsNode(start) || !network.containsNode(target)) {
            return PathResult.notFound();
        }

        final SearchState state = new SearchState(start);
        final Deque<String> frontier = new ArrayDeque<>();
        frontier.add(start);

        while (!frontier.isEmpty()) {
            final String current = lastInFirstOut ? frontier.pollLast() : frontier.pollFirst();

            if (current.equals(target)) {
                return PathResult.ofHops(state.pathTo(target));
            }

            for (String neighbor : network.neighbors(current)) {
                if (!state.isVisited(neighbor)) {
                    state.reach(neighbor, current, state.distance(current) + 1);
                    frontier.addLast(neighbor);
                }
            }
        }

        return PathResult.notFound();
    }
}
