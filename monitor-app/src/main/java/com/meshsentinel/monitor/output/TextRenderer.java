package com.meshsentinel.monitor.output;

import com.meshsentinel.core.model.Anomaly;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Numbered, multi-line description of each anomaly.
 *
 * <pre>
 * Found 1 anomalies:
 *
 * 1. High error rate: 12.00% (threshold: 5.00%) [HIGH]
 *    Entity: checkout
 *    Type: error_rate_high
 *    Time: 2024-01-01T00:00:00Z
 *    Metrics:
 *      error_rate: 0.12
 * </pre>
 *
 * @since 1.0.0
 */
public class TextRenderer implements AnomalyRenderer {

    static final String EMPTY = "No anomalies detected.\n";

    @Override
    public String render(List<Anomaly> anomalies) {
        if (anomalies.isEmpty()) {
            return EMPTY;
        }

        StringBuilder out = new StringBuilder();
        out.append(String.format(Locale.ROOT, "Found %d anomalies:%n%n", anomalies.size()));

        int index = 1;
        for (Anomaly anomaly : anomalies) {
            out.append(String.format(Locale.ROOT, "%d. %s [%s]%n",
                    index++, anomaly.getDescription(), anomaly.getSeverityLevel()));
            out.append("   Entity: ").append(anomaly.getEntity()).append(System.lineSeparator());
            out.append("   Type: ").append(anomaly.getType().getId()).append(System.lineSeparator());
            out.append("   Time: ").append(DateTimeFormatter.ISO_INSTANT.format(anomaly.getTimestamp()))
                    .append(System.lineSeparator());

            if (!anomaly.getMetrics().isEmpty()) {
                out.append("   Metrics:").append(System.lineSeparator());
                for (Map.Entry<String, Double> metric : new TreeMap<>(anomaly.getMetrics()).entrySet()) {
                    out.append(String.format(Locale.ROOT, "     %s: %.2f%n", metric.getKey(), metric.getValue()));
                }
            }
            if (!anomaly.getLabels().isEmpty()) {
                out.append("   Labels: ").append(new TreeMap<>(anomaly.getLabels())).append(System.lineSeparator());
            }
            out.append(System.lineSeparator());
        }
        return out.toString();
    }
}
