package com.nyct.transitgraph;

import com.google.common.base.Splitter;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * GTFS service-day times. Hours may run past 23 for trips that continue after midnight.
 */
@UtilityClass
public class GtfsTime {
    private final Logger LOG = LoggerFactory.getLogger(GtfsTime.class);

    private final Splitter COLON = Splitter.on(':').trimResults();

    public final int SECONDS_PER_DAY = 24 * 3600;

    /**
     * Seconds past midnight for an {@code HH:MM:SS} value. Blank, malformed or out-of-range input yields 0.
     */
    public int parseSeconds(String time) {
        if (StringUtils.isBlank(time)) {
            return 0;
        }

        final List<String> parts = COLON.splitToList(time);
        if (parts.size() != 3) {
            LOG.warn("Unparseable GTFS time '{}', using 0", time);
            return 0;
        }

        try {
            return Math.addExact(
                    Math.addExact(Math.multiplyExact(Integer.parseInt(parts.get(0)), 3600),
                            Math.multiplyExact(Integer.parseInt(parts.get(1)), 60)),
                    Integer.parseInt(parts.get(2)));
        } catch (NumberFormatException | ArithmeticException e) {
            LOG.warn("Unparseable GTFS time '{}', using 0", time);
            return 0;
        }
    }

    public String format(int seconds) {
        return String.format("%02d:%02d:%02d", seconds / 3600, (seconds / 60) % 60, seconds % 60);
    }

    /**
     * {@code arrival - departure}, shifted forward one day when the raw difference is negative.
     */
    public int travelSeconds(int departure, int arrival) {
        final int raw = arrival - departure;
        return raw < 0 ? raw + SECONDS_PER_DAY : raw;
    }
}
