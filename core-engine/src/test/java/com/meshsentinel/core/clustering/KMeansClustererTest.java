package com.meshsentinel.core.clustering;

import com.meshsentinel.core.features.FeatureVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link KMeansClusterer}.
 */
class KMeansClustererTest {

    private static final List<FeatureVector> TWO_GROUPS = List.of(
            FeatureVector.of(1, 1),
            FeatureVector.of(1.2, 0.8),
            FeatureVector.of(0.9, 1.1),
            FeatureVector.of(10, 10),
            FeatureVector.of(10.2, 9.8),
            FeatureVector.of(9.9, 10.1));

    @Test
    @DisplayName("Should separate two well-spaced groups")
    void shouldFindTwoGroups() {
        KMeansClusterer clusterer = new KMeansClusterer(new KMeansConfig(2, 100, 0.01));

        List<Cluster> clusters = clusterer.fit(TWO_GROUPS);

        assertThat(clusters).hasSize(2);
        assertThat(clusters.get(0).getCentroid()[0]).isCloseTo(1.0, within(0.2));
        assertThat(clusters.get(0).getCentroid()[1]).isCloseTo(1.0, within(0.2));
        assertThat(clusters.get(1).getCentroid()[0]).isCloseTo(10.0, within(0.2));
        assertThat(clusters.get(1).getCentroid()[1]).isCloseTo(10.0, within(0.2));
        assertThat(clusters).allSatisfy(c -> assertThat(c.size()).isEqualTo(3));
    }

    @Test
    @DisplayName("Should assign every point to exactly one cluster")
    void shouldPartitionInput() {
        KMeansClusterer clusterer = new KMeansClusterer(new KMeansConfig(3, 100, 0.01));

        List<Cluster> clusters = clusterer.fit(TWO_GROUPS);

        int assigned = clusters.stream().mapToInt(Cluster::size).sum();
        assertThat(assigned).isEqualTo(TWO_GROUPS.size());
        assertThat(clusters.stream().flatMap(c -> c.getPoints().stream()))
                .containsExactlyInAnyOrderElementsOf(TWO_GROUPS);
    }

    @Test
    @DisplayName("Should produce identical clusters for identical input")
    void shouldBeDeterministic() {
        KMeansClusterer clusterer = new KMeansClusterer(new KMeansConfig(2, 100, 0.01));

        List<Cluster> first = clusterer.fit(TWO_GROUPS);
        List<Cluster> second = clusterer.fit(TWO_GROUPS);

        for (int i = 0; i < first.size(); i++) {
            assertThat(second.get(i).getCentroid()).containsExactly(first.get(i).getCentroid());
        }
    }

    @Test
    @DisplayName("Should return no clusters when there are fewer points than K")
    void shouldReturnEmptyBelowK() {
        KMeansClusterer clusterer = new KMeansClusterer(new KMeansConfig(3, 100, 0.01));

        assertThat(clusterer.fit(List.of(FeatureVector.of(1, 1), FeatureVector.of(2, 2)))).isEmpty();
        assertThat(clusterer.fit(List.of())).isEmpty();
    }

    @Test
    @DisplayName("Should reject vectors of mixed dimensionality")
    void shouldRejectMixedDimensions() {
        KMeansClusterer clusterer = new KMeansClusterer(new KMeansConfig(1, 100, 0.01));

        assertThatThrownBy(() -> clusterer.fit(List.of(FeatureVector.of(1, 1), FeatureVector.of(1, 1, 1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should report convergence only within tolerance")
    void shouldDetectConvergence() {
        KMeansClusterer clusterer = new KMeansClusterer(new KMeansConfig(1, 100, 0.01));

        assertThat(clusterer.hasConverged(new double[][] { { 0, 0 } }, new double[][] { { 0.005, 0 } })).isTrue();
        assertThat(clusterer.hasConverged(new double[][] { { 0, 0 } }, new double[][] { { 1, 0 } })).isFalse();
        assertThatThrownBy(() -> clusterer.hasConverged(new double[][] { { 0 } }, new double[0][]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject invalid configuration")
    void shouldRejectInvalidConfig() {
        assertThatThrownBy(() -> new KMeansConfig(0, 100, 0.01)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new KMeansConfig(2, 0, 0.01)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new KMeansConfig(2, 100, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
