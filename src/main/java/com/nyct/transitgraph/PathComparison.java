package com.nyct.transitgraph;

import lombok.Value;

import java.util.OptionalInt;

/**
 * Side-by-side figures for two traversal results, typically depth-first against breadth-first.
 */
@Value
public class PathComparison {
    PathResult first;
    PathResult second;

    public static PathComparison of(PathResult first, PathResult second) {
        return new PathComparison(first, second);
    }

    public boolean isBothFound() {
        return first.isFound() && second.isFound();
    }

    /**
     * True only when both paths exist and visit the same stations in the same order.
     */
    public boolean isSamePath() {
        return isBothFound() && first.getNodes().equals(second.getNodes());
    }

    /**
     * Station count of the first path minus that of the second; empty unless both exist.
     */
    public OptionalInt getLengthDifference() {
        return isBothFound()
                ? OptionalInt.of(first.getNodes().size() - second.getNodes().size())
                : OptionalInt.empty();
    }
}
