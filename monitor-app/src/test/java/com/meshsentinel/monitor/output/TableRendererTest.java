package com.meshsentinel.monitor.output;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TableRenderer}.
 */
class TableRendererTest {

    private final TableRenderer renderer = new TableRenderer();

    @Test
    @DisplayName("Should render a header and one row per anomaly")
    void shouldRenderRows() {
        String[] lines = renderer.render(List.of(RendererFixtures.errorRateAnomaly(), RendererFixtures.longNamedAnomaly()))
                .split("\\R");

        assertThat(lines).hasSize(4);
        assertThat(lines[0]).startsWith("ENTITY").contains("TYPE").contains("SEVERITY").endsWith("DESCRIPTION");
        assertThat(lines[2]).startsWith("checkout ").contains("error_rate_high").contains("HIGH");
    }

    @Test
    @DisplayName("Should cut long cells to their column width")
    void shouldTruncateLongCells() {
        String table = renderer.render(List.of(RendererFixtures.longNamedAnomaly()));

        assertThat(table)
                .contains("recommendati...")
                .contains("behavioral_anomaly")
                .contains("Behavioral anomaly: distance 4.20 exc...")
                .doesNotContain("recommendation-engine-v2")
                .doesNotContain("threshold 2.10");
    }

    @Test
    @DisplayName("Should leave short values untouched")
    void shouldKeepShortValues() {
        assertThat(TableRenderer.truncate("auth", 15)).isEqualTo("auth");
        assertThat(TableRenderer.truncate("abcdefghij", 8)).isEqualTo("abcde...").hasSize(8);
    }

    @Test
    @DisplayName("Should fall back to the empty message")
    void shouldRenderEmpty() {
        assertThat(renderer.render(List.of())).isEqualTo(TextRenderer.EMPTY);
    }
}
