package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TripGraphAssemblerTest {

    static TimetableFeed threeStopLine() {
        return new FeedBuilder()
                .stop("A", 0, 0)
                .stop("B", 0, 1)
                .stop("C", 0, 2)
                .route("R1", 402)
                .trip("T1", "R1")
                .step("T1", "A", 1, "08:00:00", "08:05:00")
                .step("T1", "B", 2, "08:05:00", "08:05:00")
                .step("T1", "C", 3, "08:09:00", "08:09:00")
                .build();
    }

    @Test
    public void foldsTripIntoConsecutiveSegments() {
        final TransitNetwork network = new TripGraphAssembler().assemble(threeStopLine());

        assertEquals(ImmutableList.of("A", "B", "C"), network.nodeIds());
        assertEquals(2, network.edgeCount());

        final TransitEdge ab = network.edge("A", "B").orElseThrow();
        assertEquals(ImmutableList.of(0), ab.getTravelTimes());
        assertEquals(ImmutableSet.of("R1"), ab.getRouteIds());
        assertEquals(ImmutableSet.of(402), ab.getRouteTypes());

        assertEquals(ImmutableList.of(240), network.edge("C", "B").orElseThrow().getTravelTimes());
        assertFalse(network.edge("A", "C").isPresent());
    }

    @Test
    public void walksStepsInStopSequenceOrder() {
        final TimetableFeed feed = new FeedBuilder()
                .stop("A", 0, 0)
                .stop("B", 0, 1)
                .stop("C", 0, 2)
                .route("R1", 3)
                .trip("T1", "R1")
                .step("T1", "C", 30, "08:10:00", "08:10:00")
                .step("T1", "A", 10, "08:00:00", "08:00:00")
                .step("T1", "B", 20, "08:04:00", "08:05:00")
                .build();

        final TransitNetwork network = new TripGraphAssembler().assemble(feed);

        assertEquals(ImmutableList.of(240), network.edge("A", "B").orElseThrow().getTravelTimes());
        assertEquals(ImmutableList.of(300), network.edge("B", "C").orElseThrow().getTravelTimes());
        assertFalse(network.edge("A", "C").isPresent());
    }

    @Test
    public void collapsedStopsNeverFormSelfLoops() {
        final TimetableFeed feed = new FeedBuilder()
                .stop("P1", "Hub", 0, 0)
                .stop("P2", "Hub ", 0, 0.001)
                .stop("P3", "Hub", 0, 0.002)
                .stop("X", 0, 1)
                .stop("Y", 0, -1)
                .route("R1", 3)
                .trip("T1", "R1", "X", "P1", "P2", "P3", "Y")
                .trip("T2", "R1", "P2", "P1")
                .build();

        final TransitNetwork network = new TripGraphAssembler().assemble(feed);

        assertEquals(ImmutableList.of("Hub", "X", "Y"), network.nodeIds());
        assertTrue(network.node("Hub").orElseThrow().isTransfer());
        assertEquals(2, network.edgeCount());
        network.getEdges().forEach(e -> assertNotEquals(e.getNodeA(), e.getNodeB()));
        assertFalse(network.edge("Hub", "Hub").isPresent());
    }

    @Test
    public void bothDirectionsShareOneSegment() {
        final TimetableFeed feed = new FeedBuilder()
                .stop("A", 0, 0)
                .stop("B", 0, 1)
                .route("U1", 402)
                .route("U2", 402)
                .route("B7", 3)
                .trip("T1", "U1", "A", "B")
                .trip("T2", "U2", "B", "A")
                .trip("T3", "B7", "A", "B")
                .build();

        final TransitNetwork network = new TripGraphAssembler().assemble(feed);

        assertEquals(1, network.edgeCount());
        final TransitEdge edge = network.edge("B", "A").orElseThrow();
        assertEquals(ImmutableSet.of("U1", "U2", "B7"), edge.getRouteIds());
        assertEquals(ImmutableSet.of(402, 3), edge.getRouteTypes());
        assertEquals(ImmutableList.of(60, 60, 60), edge.getTravelTimes());
        assertEquals(edge, network.edge("A", "B").orElseThrow());
    }

    @Test
    public void travelTimeSamplesAreAMultiset() {
        final TimetableFeed feed = new FeedBuilder()
                .stop("A", 0, 0)
                .stop("B", 0, 1)
                .route("R1", 3)
                .timedTrip("T1", "R1", 300, "A", "B")
                .timedTrip("T2", "R1", 300, "A", "B")
                .timedTrip("T3", "R1", 120, "B", "A")
                .build();

        final TransitEdge edge = new TripGraphAssembler().assemble(feed).edge("A", "B").orElseThrow();

        assertEquals(ImmutableList.of(300, 300, 120), edge.getTravelTimes());
    }

    @Test
    public void departureBeforeMidnightArrivalAfter() {
        final TimetableFeed feed = new FeedBuilder()
                .stop("A", 0, 0)
                .stop("B", 0, 1)
                .stop("C", 0, 2)
                .route("N1", 3)
                .trip("T1", "N1")
                .step("T1", "A", 1, "23:58:00", "23:58:00")
                .step("T1", "B", 2, "24:02:00", "24:02:00")
                .trip("T2", "N1")
                .step("T2", "B", 1, "23:58:00", "23:58:00")
                .step("T2", "C", 2, "00:02:00", "00:02:00")
                .build();

        final TransitNetwork network = new TripGraphAssembler().assemble(feed);

        assertEquals(ImmutableList.of(240), network.edge("A", "B").orElseThrow().getTravelTimes());
        assertEquals(ImmutableList.of(240), network.edge("B", "C").orElseThrow().getTravelTimes());
    }

    @Test
    public void malformedTimesDegradeToZero() {
        final TimetableFeed feed = new FeedBuilder()
                .stop("A", 0, 0)
                .stop("B", 0, 1)
                .stop("C", 0, 2)
                .route("R1", 3)
                .trip("T1", "R1")
                .step("T1", "A", 1, null, null)
                .step("T1", "B", 2, "not a time", "08:00:00")
                .step("T1", "C", 3, "08:01:00", "")
                .build();

        final TransitNetwork network = new TripGraphAssembler().assemble(feed);

        assertEquals(ImmutableList.of(0), network.edge("A", "B").orElseThrow().getTravelTimes());
        assertEquals(ImmutableList.of(60), network.edge("B", "C").orElseThrow().getTravelTimes());
    }

    @Test
    public void routeTypeFilterDropsRoutesTripsAndTheirStops() {
        final TimetableFeed feed = new FeedBuilder()
                .stop("A", 0, 0)
                .stop("B", 0, 1)
                .stop("C", 0, 2)
                .stop("Unserved", 5, 5)
                .route("U1", 402)
                .route("S1", 109)
                .route("B5", 3)
                .trip("T1", "U1", "A", "B")
                .trip("T2", "S1", "B", "A")
                .trip("T3", "B5", "B", "C")
                .build();

        final TransitNetwork network = new TripGraphAssembler(RouteTypeFilter.of(402, 109)).assemble(feed);

        assertEquals(ImmutableList.of("A", "B"), network.nodeIds());
        assertEquals(ImmutableSet.of("U1", "S1"), network.edge("A", "B").orElseThrow().getRouteIds());
        assertFalse(network.route("B5").isPresent());

        final TransitNetwork everything = new TripGraphAssembler(RouteTypeFilter.all()).assemble(feed);
        assertEquals(ImmutableList.of("A", "B", "C"), everything.nodeIds());
    }

    @Test
    public void neighborsAreSortedWhateverTheTripOrder() {
        final TransitNetwork network = new FeedBuilder()
                .stop("Hub", 0, 0)
                .stop("Zulu", 0, 1)
                .stop("Alpha", 0, 2)
                .stop("Mike", 0, 3)
                .route("R1", 3)
                .trip("T1", "R1", "Hub", "Zulu")
                .trip("T2", "R1", "Mike", "Hub", "Alpha")
                .assemble();

        assertEquals(ImmutableList.of("Alpha", "Mike", "Zulu"), network.neighbors("Hub"));
        assertEquals(3, network.degree("Hub"));
    }

    @Test
    public void missingRequiredColumnAbortsAssembly() {
        final TimetableFeed feed = new FeedBuilder()
                .stop("A", 0, 0)
                .route("R1", 3)
                .trip("T1", "R1")
                .step("T1", "A", 1, "08:00:00", "08:00:00")
                .step("T1", null, 2, "08:01:00", "08:01:00")
                .build();

        final FeedSchemaException e = assertThrows(FeedSchemaException.class,
                () -> new TripGraphAssembler().assemble(feed));
        assertTrue(e.getMessage().contains("stop_times"));
        assertTrue(e.getMessage().contains("stop_id"));
    }

    @Test
    public void tripWithoutRouteIdIsASchemaError() {
        final TimetableFeed feed = new TimetableFeed(
                Collections.emptyList(),
                Collections.emptyList(),
                Collections.singletonList(new TripRecord("T1", null)),
                Collections.emptyList());

        assertThrows(FeedSchemaException.class, () -> new TripGraphAssembler().assemble(feed));
    }

    @Test
    public void emptyFeedGivesEmptyNetwork() {
        final TransitNetwork network = new FeedBuilder().assemble();

        assertEquals(0, network.nodeCount());
        assertEquals(0, network.edgeCount());
    }
}
