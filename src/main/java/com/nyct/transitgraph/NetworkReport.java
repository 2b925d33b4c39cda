package com.nyct.transitgraph;

import freemarker.template.Configuration;
import freemarker.template.DefaultObjectWrapperBuilder;
import freemarker.template.SimpleHash;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.Version;
import lombok.Value;
import lombok.experimental.UtilityClass;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * HTML summary of an assembled network: size and degree figures plus one row per station.
 */
@UtilityClass
public class NetworkReport {

    private final Version FREEMARKER_VERSION = Configuration.VERSION_2_3_32;

    public void write(TransitNetwork network, String title, File outputFile) throws IOException, TemplateException {
        try (final FileOutputStream fos = new FileOutputStream(outputFile);
             final Writer out = new OutputStreamWriter(fos, StandardCharsets.UTF_8)) {
            write(network, title, out);
        }
    }

    public void write(TransitNetwork network, String title, Writer out) throws IOException, TemplateException {
        final GraphStatistics stats = GraphStatistics.of(network);

        final List<StationEntry> stations = network.getNodes()
                .stream()
                .map(node -> new StationEntry(
                        node.getId(),
                        node.getLat(),
                        node.getLon(),
                        node.getMemberStopIds().size(),
                        stats.getDegrees().get(node.getId()),
                        node.isTransfer()
                ))
                .collect(toImmutableList());

        final Configuration freemarkerConfiguration = new Configuration(FREEMARKER_VERSION);
        freemarkerConfiguration.setClassForTemplateLoading(NetworkReport.class, "");
        freemarkerConfiguration.setDefaultEncoding("UTF-8");
        freemarkerConfiguration.setLocale(Locale.ROOT);
        freemarkerConfiguration.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        freemarkerConfiguration.setLogTemplateExceptions(false);
        freemarkerConfiguration.setWrapUncheckedExceptions(true);
        freemarkerConfiguration.setFallbackOnNullLoopVariable(false);

        final SimpleHash root = new SimpleHash(new DefaultObjectWrapperBuilder(FREEMARKER_VERSION).build());
        root.put("title", title);
        root.put("stats", stats);
        root.put("stations", stations);

        final Template template = freemarkerConfiguration.getTemplate("networkReport.ftlh");
        template.process(root, out);
    }

    @Value
    public static class StationEntry {
        String id;
        double lat;
        double lon;
        int stopCount;
        int degree;
        boolean transfer;
    }
}
