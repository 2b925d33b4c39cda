package com.nyct.transitgraph;

import com.google.common.collect.ImmutableMap;
import org.jgrapht.Graph;
import org.jgrapht.graph.AsWeightedGraph;

/**
 * A {@link TransitNetwork} with one weight per edge under a chosen {@link CostModel}. The underlying network is not
 * touched; weights live in this view only.
 */
public class WeightedNetwork {
    private final TransitNetwork network;
    private final CostModel costModel;
    private final ImmutableMap<TransitEdge, Double> weights;
    private final Graph<String, TransitEdge> weightedGraph;

    WeightedNetwork(TransitNetwork network, CostModel costModel, ImmutableMap<TransitEdge, Double> weights) {
        this.network = network;
        this.costModel = costModel;
        this.weights = weights;
        this.weightedGraph = new AsWeightedGraph<>(network.getGraph(), weights);
    }

    public TransitNetwork getNetwork() {
        return network;
    }

    public CostModel getCostModel() {
        return costModel;
    }

    public Graph<String, TransitEdge> getGraph() {
        return weightedGraph;
    }

    public double weight(TransitEdge edge) {
        return weights.get(edge);
    }

    /**
     * @return the weight of the segment between {@code u} and {@code v}, or NaN when there is none
     */
    public double weight(String u, String v) {
        return network.edge(u, v).map(this::weight).orElse(Double.NaN);
    }

    public ImmutableMap<TransitEdge, Double> getWeights() {
        return weights;
    }
}
