package com.nyct.transitgraph;

import lombok.Value;
import org.apache.commons.lang3.tuple.Pair;

import java.util.DoubleSummaryStatistics;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Cost statistics over the connected pairs of an all-pairs sweep.
 */
@Value
public class AllPairsSummary {
    long pairCount;
    OptionalDouble minCost;
    OptionalDouble maxCost;
    OptionalDouble meanCost;

    public static AllPairsSummary of(Map<Pair<String, String>, PathResult> paths) {
        final DoubleSummaryStatistics stats = paths.values()
                .stream()
                .filter(PathResult::isFound)
                .mapToDouble(PathResult::getCost)
                .filter(Double::isFinite)
                .summaryStatistics();

        if (stats.getCount() == 0) {
            return new AllPairsSummary(0, OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty());
        }
        return new AllPairsSummary(
                stats.getCount(),
                OptionalDouble.of(stats.getMin()),
                OptionalDouble.of(stats.getMax()),
                OptionalDouble.of(stats.getAverage())
        );
    }
}
