package com.nyct.transitgraph;

import lombok.Value;

/**
 * One row of {@code stop_times.txt}. Times are kept in their raw {@code HH:MM:SS} form, hours may exceed 23.
 */
@Value
public class TripStepRecord {
    String tripId;
    String stopId;
    int stopSequence;
    String arrivalTime;
    String departureTime;
}
