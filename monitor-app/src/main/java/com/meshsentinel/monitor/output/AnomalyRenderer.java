package com.meshsentinel.monitor.output;

import com.meshsentinel.core.model.Anomaly;

import java.util.List;

/**
 * Turns the anomalies of one tick into printable text.
 *
 * @since 1.0.0
 */
public interface AnomalyRenderer {

    /**
     * @param anomalies anomalies in detection order; may be empty
     * @return the rendered output, ending with a newline
     */
    String render(List<Anomaly> anomalies);
}
