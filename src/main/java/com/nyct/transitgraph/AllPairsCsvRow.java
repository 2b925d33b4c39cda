package com.nyct.transitgraph;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"from_node", "to_node", "cost", "hops", "path"})
public class AllPairsCsvRow {
    String fromNode;
    String toNode;
    double cost;
    int hops;
    /** Stations joined with {@code |}. */
    String path;
}
