package com.nyct.transitgraph;

import lombok.Value;
import org.apache.commons.lang3.StringUtils;

@Value
public class RouteRecord {
    String routeId;
    int routeType;
    String shortName;
    String color;

    /**
     * The short name where the feed has one, otherwise the route id.
     */
    public String getDisplayName() {
        return StringUtils.isBlank(shortName) ? routeId : shortName;
    }
}
