package com.nyct.transitgraph;

import lombok.Value;

@Value
public class TripRecord {
    String tripId;
    String routeId;
}
