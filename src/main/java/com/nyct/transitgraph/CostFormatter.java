package com.nyct.transitgraph;

import lombok.experimental.UtilityClass;

import java.util.Locale;

@UtilityClass
public class CostFormatter {

    public String format(double cost, CostModel costModel) {
        if (Double.isInfinite(cost)) {
            return "unreachable";
        }
        return costModel == CostModel.TRAVEL_TIME ? formatSeconds(cost) : formatKilometers(cost);
    }

    public String formatSeconds(double seconds) {
        if (seconds < 60) {
            return String.format(Locale.ROOT, "%.1f sec", seconds);
        } else if (seconds < 3600) {
            return String.format(Locale.ROOT, "%.1f min", seconds / 60);
        }
        return String.format(Locale.ROOT, "%d h %d min", (long) (seconds / 3600), (long) ((seconds % 3600) / 60));
    }

    public String formatKilometers(double km) {
        if (km < 1) {
            return String.format(Locale.ROOT, "%.0f m", km * 1000);
        }
        return String.format(Locale.ROOT, "%.2f km", km);
    }
}
