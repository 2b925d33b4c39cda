package com.nyct.transitgraph;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.tuple.Pair;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;

import static com.google.common.collect.ImmutableList.toImmutableList;

@UtilityClass
public class AllPairsCsvWriter {

    public List<AllPairsCsvRow> rows(Map<Pair<String, String>, PathResult> paths) {
        return paths.entrySet()
                .stream()
                .map(e -> new AllPairsCsvRow(
                        e.getKey().getLeft(),
                        e.getKey().getRight(),
                        e.getValue().getCost(),
                        e.getValue().getEdgeCount(),
                        String.join("|", e.getValue().getNodes())
                ))
                .collect(toImmutableList());
    }

    public void write(Map<Pair<String, String>, PathResult> paths, File outputFile) throws IOException {
        try (final SequenceWriter sequenceWriter = writer().writeValues(outputFile)) {
            sequenceWriter.writeAll(rows(paths));
        }
    }

    public void write(Map<Pair<String, String>, PathResult> paths, Writer out) throws IOException {
        try (final SequenceWriter sequenceWriter = writer().writeValues(out)) {
            sequenceWriter.writeAll(rows(paths));
        }
    }

    private ObjectWriter writer() {
        final CsvMapper mapper = new CsvMapper();
        final CsvSchema schema = mapper.schemaFor(AllPairsCsvRow.class).withHeader();
        return mapper.writerFor(AllPairsCsvRow.class).with(schema);
    }
}
