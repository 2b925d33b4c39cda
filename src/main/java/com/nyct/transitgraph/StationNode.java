package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;
import lombok.Value;
import org.gavaghan.geodesy.GlobalCoordinates;

/**
 * A logical station: every used stop sharing one trimmed name, placed at the mean of their coordinates.
 */
@Value
public class StationNode {
    String id;
    double lat;
    double lon;
    ImmutableList<String> memberStopIds;

    public boolean isTransfer() {
        return memberStopIds.size() > 1;
    }

    public GlobalCoordinates getCoordinates() {
        return new GlobalCoordinates(lat, lon);
    }
}
