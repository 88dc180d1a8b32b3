package com.meshsentinel.core.config;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * How detected anomalies are rendered.
 *
 * @since 1.0.0
 */
public class OutputSettings {

    static final Set<String> FORMATS = Set.of("text", "table", "json");

    /** One of {@code text}, {@code table}, {@code json}. */
    private String format = "text";

    /** Also log ticks that produced no anomalies. */
    private boolean verbose;

    void collectErrors(List<String> errors) {
        if (format == null || !FORMATS.contains(format)) {
            errors.add("output.format must be one of " + FORMATS + ", got: '" + format + "'");
        }
    }

    public String getFormat() {
        return format;
    }

    /**
     * Set the output format, normalised to lowercase.
     */
    public void setFormat(String format) {
        this.format = format != null ? format.toLowerCase(Locale.ROOT) : null;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public String toString() {
        return "OutputSettings{format='" + format + "', verbose=" + verbose + '}';
    }
}
