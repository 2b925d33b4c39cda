package com.nyct.transitgraph;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class AllPairsCsvWriterTest {

    @Test
    public void writesOneRowPerPair() throws IOException, InterruptedException {
        final TransitNetwork network = new TripGraphAssembler().assemble(TripGraphAssemblerTest.threeStopLine());
        final WeightedNetwork weighted = new EdgeWeighting().apply(network, CostModel.TRAVEL_TIME);

        final StringWriter out = new StringWriter();
        AllPairsCsvWriter.write(new AllPairsShortestPaths(weighted).compute(), out);

        final List<String> lines = out.toString().lines().collect(Collectors.toList());
        assertEquals(List.of(
                "from_node,to_node,cost,hops,path",
                "A,B,0.0,1,A|B",
                "A,C,240.0,2,A|B|C",
                "B,C,240.0,1,B|C"
        ), lines);
    }
}
