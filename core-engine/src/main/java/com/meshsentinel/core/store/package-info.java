/**
 * In-memory time-series storage.
 *
 * <p>
 * {@link com.meshsentinel.core.store.TimeSeriesStore} owns one
 * {@link com.meshsentinel.core.store.TimeSeries} per entity/metric pair and
 * serves windowed reads to the feature extractor and the detector.
 * </p>
 *
 * @since 1.0.0
 */
package com.meshsentinel.core.store;
