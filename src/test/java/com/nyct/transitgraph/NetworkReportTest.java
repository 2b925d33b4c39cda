package com.nyct.transitgraph;

import freemarker.template.TemplateException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.assertTrue;

public class NetworkReportTest {

    @Test
    public void listsEveryStation() throws IOException, TemplateException {
        final TransitNetwork network = new FeedBuilder()
                .stop("P1", "Hub & Spoke", 53.5, 10.0)
                .stop("P2", "Hub & Spoke", 53.5, 10.0)
                .stop("X", 53.6, 10.1)
                .route("R1", 3)
                .trip("T1", "R1", "P1", "X", "P2")
                .assemble();

        final StringWriter out = new StringWriter();
        NetworkReport.write(network, "Test network", out);
        final String html = out.toString();

        assertTrue(html.contains("<title>Test network</title>"));
        assertTrue(html.contains("<td>Hub &amp; Spoke</td>"), html);
        assertTrue(html.contains("<td>X</td>"));
        assertTrue(html.contains("class=\"transfer\""));
    }
}
