/**
 * Sliding-window feature extraction and the numeric helpers behind it.
 *
 * @since 1.0.0
 */
package com.meshsentinel.core.features;
