package com.meshsentinel.monitor.output;

import com.meshsentinel.core.model.Anomaly;

import java.util.List;
import java.util.Locale;

/**
 * One fixed-width row per anomaly. Cells longer than their column are cut
 * and end in {@code ...}.
 *
 * @since 1.0.0
 */
public class TableRenderer implements AnomalyRenderer {

    static final int ENTITY_WIDTH = 15;
    static final int TYPE_WIDTH = 18;
    static final int SEVERITY_WIDTH = 8;
    static final int DESCRIPTION_WIDTH = 40;

    private static final String ROW = "%-" + ENTITY_WIDTH + "s  %-" + TYPE_WIDTH + "s  %-" + SEVERITY_WIDTH
            + "s  %s%n";

    @Override
    public String render(List<Anomaly> anomalies) {
        if (anomalies.isEmpty()) {
            return TextRenderer.EMPTY;
        }

        StringBuilder out = new StringBuilder();
        out.append(String.format(Locale.ROOT, ROW, "ENTITY", "TYPE", "SEVERITY", "DESCRIPTION"));
        out.append(String.format(Locale.ROOT, ROW, "------", "----", "--------", "-----------"));
        for (Anomaly anomaly : anomalies) {
            out.append(String.format(Locale.ROOT, ROW,
                    truncate(anomaly.getEntity(), ENTITY_WIDTH),
                    truncate(anomaly.getType().getId(), TYPE_WIDTH),
                    anomaly.getSeverityLevel(),
                    truncate(anomaly.getDescription(), DESCRIPTION_WIDTH)));
        }
        return out.toString();
    }

    static String truncate(String value, int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength - 3) + "...";
    }
}
