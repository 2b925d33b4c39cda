package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static com.google.common.collect.ImmutableList.toImmutableList;

@UtilityClass
public class StopClusterer {

    /**
     * Node id for a stop name: leading and trailing whitespace stripped, nothing else touched. A missing name
     * clusters under the empty string.
     */
    public String normalizeName(String name) {
        return StringUtils.defaultString(StringUtils.strip(name));
    }

    /**
     * Groups the stops referenced by {@code usedStopIds} by normalized name. Stops outside that set never become
     * nodes. Members keep input order; nodes come out sorted by id.
     */
    public StopClustering cluster(List<StopRecord> stops, Set<String> usedStopIds) {
        final Map<String, List<StopRecord>> groups = new TreeMap<>();

        stops.stream()
                .filter(stop -> usedStopIds.contains(stop.getStopId()))
                .forEach(stop -> groups.computeIfAbsent(normalizeName(stop.getName()), k -> new ArrayList<>())
                        .add(stop));

        final ImmutableList<StationNode> nodes = groups.entrySet()
                .stream()
                .map(e -> toNode(e.getKey(), e.getValue()))
                .collect(toImmutableList());

        final ImmutableMap.Builder<String, String> stopToNode = ImmutableMap.builder();
        nodes.forEach(node -> node.getMemberStopIds().forEach(stopId -> stopToNode.put(stopId, node.getId())));

        return new StopClustering(nodes, stopToNode.buildKeepingLast());
    }

    private StationNode toNode(String id, List<StopRecord> members) {
        final double lat = members.stream().mapToDouble(StopRecord::getLat).average().orElse(0.0);
        final double lon = members.stream().mapToDouble(StopRecord::getLon).average().orElse(0.0);

        return new StationNode(
                id,
                lat,
                lon,
                members.stream().map(StopRecord::getStopId).collect(toImmutableList())
        );
    }
}
