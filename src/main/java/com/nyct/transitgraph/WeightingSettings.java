package com.nyct.transitgraph;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WeightingSettings {
    public static final WeightingSettings DEFAULTS = WeightingSettings.builder().build();

    /** Mean Earth radius used by the haversine model. */
    @Builder.Default
    double earthRadiusKm = 6371.0;

    /** Weight of a segment with no travel-time samples. */
    @Builder.Default
    int defaultTravelTimeSeconds = 60;
}
