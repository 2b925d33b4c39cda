package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ItineraryBuilderTest {

    private final TransitNetwork network = new FeedBuilder()
            .stop("Ohlsdorf", 0, 0)
            .stop("Barmbek", 0, 1)
            .stop("Hauptbahnhof", 0, 2)
            .stop("Stade", 0, 3)
            .stop("Airport", 1, 0)
            .route("r-u1", 402, "U1")
            .route("r-s10", 109, "S10")
            .route("r-s2", 109, "S2")
            .route("r-x", 3, "")
            .trip("T1", "r-u1", "Ohlsdorf", "Barmbek", "Hauptbahnhof")
            .trip("T2", "r-s10", "Hauptbahnhof", "Stade")
            .trip("T3", "r-s2", "Hauptbahnhof", "Stade")
            .trip("T4", "r-x", "Airport", "Ohlsdorf")
            .assemble();

    private final ItineraryBuilder builder = new ItineraryBuilder(network);

    @Test
    public void newLegWhereTheRoutesChange() {
        final ImmutableList<ItineraryLeg> legs = builder.legs(
                ImmutableList.of("Airport", "Ohlsdorf", "Barmbek", "Hauptbahnhof", "Stade"));

        assertEquals(3, legs.size());
        assertEquals("Airport - r-x - Ohlsdorf", legs.get(0).toString());
        assertEquals(new ItineraryLeg("Ohlsdorf", "Hauptbahnhof", ImmutableList.of("U1"), 2), legs.get(1));
        assertEquals("Hauptbahnhof - S2, S10 - Stade", legs.get(2).toString());
        assertEquals(1, legs.get(0).getSegmentCount());
        assertEquals(2, legs.get(1).getSegmentCount());
        assertEquals(1, legs.get(2).getSegmentCount());
    }

    @Test
    public void shortPathsHaveNoLegs() {
        assertTrue(builder.legs(ImmutableList.of("Stade")).isEmpty());
        assertTrue(builder.legs(PathResult.notFound()).isEmpty());
    }

    @Test
    public void rejectsPathsWithGaps() {
        assertThrows(IllegalArgumentException.class, () -> builder.legs(ImmutableList.of("Ohlsdorf", "Stade")));
    }
}
