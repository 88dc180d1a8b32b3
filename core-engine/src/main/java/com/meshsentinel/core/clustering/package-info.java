/**
 * K-means clustering used to learn per-entity behaviour baselines.
 *
 * @since 1.0.0
 */
package com.meshsentinel.core.clustering;
