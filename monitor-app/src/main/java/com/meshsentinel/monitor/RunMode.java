package com.meshsentinel.monitor;

import java.util.Locale;

/**
 * How {@link MeshSentinelApp} drives the {@link MonitorLoop}.
 *
 * @since 1.0.0
 */
public enum RunMode {

    /** Poll on a fixed interval until the process is stopped. */
    MONITOR,

    /** Run the learning ticks back to back, then one detection tick, then exit. */
    SCAN;

    /**
     * @param name mode name, case-insensitive
     * @throws IllegalArgumentException if no mode has this name
     */
    public static RunMode fromName(String name) {
        if (name != null) {
            for (RunMode mode : values()) {
                if (mode.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown run mode: '" + name + "' (expected monitor or scan)");
    }
}
