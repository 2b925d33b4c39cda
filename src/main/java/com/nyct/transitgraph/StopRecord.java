package com.nyct.transitgraph;

import lombok.Value;

/**
 * One physical stop as it appears in {@code stops.txt}.
 */
@Value
public class StopRecord {
    String stopId;
    String name;
    double lat;
    double lon;
}
