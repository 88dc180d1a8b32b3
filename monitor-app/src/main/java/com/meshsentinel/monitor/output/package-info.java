/**
 * Anomaly renderers, one per {@link com.meshsentinel.monitor.output.OutputFormat}.
 */
package com.meshsentinel.monitor.output;
