package com.nyct.transitgraph;

import com.google.common.collect.ImmutableMap;
import org.gavaghan.geodesy.Ellipsoid;
import org.gavaghan.geodesy.GeodeticCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.collect.ImmutableMap.toImmutableMap;

/**
 * Derives edge weights from edge and station attributes. Weights are a pure function of the network and the
 * settings: weighting the same network twice gives bit-identical results.
 */
public class EdgeWeighting {
    private static final Logger LOG = LoggerFactory.getLogger(EdgeWeighting.class);

    private static final GeodeticCalculator GC = new GeodeticCalculator();

    private final WeightingSettings settings;

    public EdgeWeighting(WeightingSettings settings) {
        this.settings = settings;
    }

    public EdgeWeighting() {
        this(WeightingSettings.DEFAULTS);
    }

    public WeightedNetwork apply(TransitNetwork network, CostModel costModel) {
        final ImmutableMap<TransitEdge, Double> weights = network.getEdges()
                .stream()
                .collect(toImmutableMap(e -> e, e -> weigh(network, e, costModel)));

        LOG.info("Weighted {} segments by {}", weights.size(), costModel);

        return new WeightedNetwork(network, costModel, weights);
    }

    public double weigh(TransitNetwork network, TransitEdge edge, CostModel costModel) {
        switch (costModel) {
            case GEOGRAPHIC:
                return haversineKm(station(network, edge.getNodeA()), station(network, edge.getNodeB()));
            case ELLIPSOIDAL:
                return ellipsoidalKm(station(network, edge.getNodeA()), station(network, edge.getNodeB()));
            case TRAVEL_TIME:
                return travelTimeSeconds(edge);
            default:
                throw new IllegalArgumentException("Unknown cost model " + costModel);
        }
    }

    public double haversineKm(StationNode a, StationNode b) {
        final double lat1 = Math.toRadians(a.getLat());
        final double lat2 = Math.toRadians(b.getLat());
        final double dLat = lat2 - lat1;
        final double dLon = Math.toRadians(b.getLon()) - Math.toRadians(a.getLon());

        // rounding can push h past 1 for near-antipodal points
        final double h = Math.min(1.0, Math.pow(Math.sin(dLat / 2), 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.pow(Math.sin(dLon / 2), 2));

        return 2 * settings.getEarthRadiusKm() * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    }

    public double ellipsoidalKm(StationNode a, StationNode b) {
        // Vincenty's iteration divides by the angular separation
        if (a.getLat() == b.getLat() && a.getLon() == b.getLon()) {
            return 0.0;
        }
        return GC.calculateGeodeticCurve(Ellipsoid.WGS84, a.getCoordinates(), b.getCoordinates())
                .getEllipsoidalDistance() / 1000.0;
    }

    public double travelTimeSeconds(TransitEdge edge) {
        return edge.getTravelTimes()
                .stream()
                .mapToInt(Integer::intValue)
                .min()
                .orElse(settings.getDefaultTravelTimeSeconds());
    }

    private static StationNode station(TransitNetwork network, String id) {
        return network.node(id)
                .orElseThrow(() -> new IllegalStateException("Segment references unknown station " + id));
    }
}
