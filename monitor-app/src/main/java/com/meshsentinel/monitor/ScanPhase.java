package com.meshsentinel.monitor;

/**
 * What a scan tick does with the readings it stored.
 *
 * @since 1.0.0
 */
public enum ScanPhase {

    /** Fit a baseline per entity from its recent history. */
    LEARN,

    /** Run the detector over each entity's recent history. */
    DETECT
}
