package com.meshsentinel.core.features;

import com.meshsentinel.core.model.Sample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FeatureExtractor}.
 */
class FeatureExtractorTest {

    private static final Instant BASE = Instant.parse("2024-01-01T00:00:00Z");

    private final FeatureExtractor extractor = new FeatureExtractor();

    @Test
    @DisplayName("Should produce one vector per window followed by a trigger")
    void shouldSlideWindow() {
        List<FeatureVector> features = extractor.extractFeatures(samples(10, 12, 11, 13, 14, 15), 3);

        assertThat(features).hasSize(3);
        assertThat(features).allSatisfy(f -> assertThat(f.dimensions()).isEqualTo(FeatureExtractor.DIMENSIONS));
    }

    @Test
    @DisplayName("Should summarize the window preceding the trigger")
    void shouldSummarizeWindow() {
        List<Sample> points = samples(10, 12, 11, 13, 14, 15);

        FeatureVector first = extractor.extractFeatures(points, 3).get(0);

        // window [10, 12, 11], trigger 13
        assertThat(first.get(FeatureVector.MEAN)).isCloseTo(11.0, within(1e-9));
        assertThat(first.get(FeatureVector.STD_DEV)).isCloseTo(1.0, within(1e-9));
        assertThat(first.get(FeatureVector.TREND)).isCloseTo(0.1, within(1e-9));
        assertThat(first.getTrigger()).contains(points.get(3));
    }

    @Test
    @DisplayName("Should return no vectors when there is no trigger after the window")
    void shouldReturnEmptyForShortInput() {
        assertThat(extractor.extractFeatures(samples(1, 2, 3), 3)).isEmpty();
        assertThat(extractor.extractFeatures(List.of(), 3)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive window size")
    void shouldRejectInvalidWindow() {
        assertThatThrownBy(() -> extractor.extractFeatures(samples(1, 2, 3), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSize");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<Sample> samples(double... values) {
        List<Sample> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(Sample.of(BASE.plusSeconds(i), values[i]));
        }
        return points;
    }
}
