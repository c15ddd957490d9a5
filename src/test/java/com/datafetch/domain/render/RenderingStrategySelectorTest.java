package com.datafetch.domain.render;

import com.datafetch.domain.model.AxisMapping;
import com.datafetch.domain.model.ComputeContext;
import com.datafetch.domain.model.TimeSeriesDataset;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RenderingStrategySelectorTest {

    private static final long T0 = Instant.parse("2021-06-01T00:00:00Z").toEpochMilli();

    private final RenderingStrategySelector selector = new RenderingStrategySelector();

    private static final RenderOptions OPTIONS = RenderOptions.builder()
            .shadeThreshold(500)
            .width(8)
            .height(4)
            .build();

    private static TimeSeriesDataset dataset(int samples) {
        long[] times = new long[samples];
        double[] temperature = new double[samples];
        double[] salinity = new double[samples];
        double[] pressure = new double[samples];
        for (int i = 0; i < samples; i++) {
            times[i] = T0 + i * 1_000L;
            temperature[i] = 10 + (i % 50) * 0.1;
            salinity[i] = 30 + (i % 7);
            pressure[i] = i;
        }
        return TimeSeriesDataset.builder()
                .name("ctd")
                .timestamps(times)
                .variable("temperature", temperature)
                .variable("salinity", salinity)
                .variable("pressure", pressure)
                .build()
                .withUniformChunks(3);
    }

    private static AxisMapping axis(String x, String y, String z, String color) {
        return AxisMapping.builder().x(x).y(y).z(z).color(color).build();
    }

    @Test
    void testSelect() {
        assertEquals(RenderStrategy.COLORED_SCATTER,
                RenderingStrategySelector.select(axis("time", "temperature", "", "salinity"), 10_000, 500));
        assertEquals(RenderStrategy.SHADED,
                RenderingStrategySelector.select(axis("time", "temperature", "", ""), 501, 500));
        assertEquals(RenderStrategy.SCATTER,
                RenderingStrategySelector.select(axis("time", "temperature", "", ""), 500, 500));
    }

    @Test
    void testRender_PlainScatterKeepsEverySample() {
        // Given
        AxisMapping axis = axis("time", "temperature", "", "");

        // When
        RenderResult result = selector.render(dataset(400), axis, OPTIONS, ComputeContext.direct());

        // Then
        assertFalse(result.isShaded());
        assertNull(result.getColorColumn());
        assertThat(result.getColumns()).containsOnlyKeys("time", "temperature");
        assertEquals(400, result.getColumns().get("time").size());
        assertEquals(400, result.getColumns().get("temperature").size());
        assertEquals("2021-06-01T00:00:00Z", result.getColumns().get("time").get(0));
    }

    @Test
    void testRender_ShadedAboveThreshold() {
        // Given
        AxisMapping axis = axis("time", "temperature", "", "");

        // When
        RenderResult result = selector.render(dataset(600), axis, OPTIONS, ComputeContext.direct());

        // Then
        assertTrue(result.isShaded());
        assertEquals(RenderStrategy.SHADED, result.getStrategy());
        assertEquals("time_temperature temperature", result.getColorColumn());
        assertThat(result.getColumns()).containsOnlyKeys("time", "temperature", "time_temperature temperature");
        List<Object> means = result.getColumns().get("time_temperature temperature");
        assertEquals(8 * 4, means.size());
        assertTrue(means.stream().anyMatch(Objects::nonNull));
    }

    @Test
    void testRender_ColoredScatterNeverShades() {
        AxisMapping axis = axis("time", "temperature", "pressure", "salinity");

        RenderResult result = selector.render(dataset(600), axis, OPTIONS, ComputeContext.direct());

        assertFalse(result.isShaded());
        assertEquals("salinity", result.getColorColumn());
        assertThat(result.getColumns()).containsOnlyKeys("time", "temperature", "salinity", "pressure");
        assertEquals(600, result.getColumns().get("salinity").size());
    }

    @Test
    void testRender_NonTimeXSwapsDimension() {
        AxisMapping axis = axis("salinity", "temperature", "time", "");

        RenderResult result = selector.render(dataset(100), axis, OPTIONS, ComputeContext.direct());

        assertThat(result.getColumns()).containsOnlyKeys("salinity", "temperature", "time");
        assertEquals(30.0, result.getColumns().get("salinity").get(0));
        assertEquals("2021-06-01T00:00:00Z", result.getColumns().get("time").get(0));
    }

    @Test
    void testRender_MissingValuesBecomeNull() {
        // Given
        TimeSeriesDataset withGaps = TimeSeriesDataset.builder()
                .name("gaps")
                .timestamps(new long[] {T0, T0 + 1_000, T0 + 2_000})
                .variable("temperature", new double[] {1.5, Double.NaN, -0.0})
                .build();

        // When
        RenderResult result = selector.render(withGaps, axis("time", "temperature", "", ""), OPTIONS,
                ComputeContext.direct());

        // Then
        List<Object> values = result.getColumns().get("temperature");
        assertEquals(3, values.size());
        assertEquals(1.5, values.get(0));
        assertNull(values.get(1));
        assertEquals(-0.0, values.get(2));
    }

    @Test
    void testShadedColumnName() {
        assertEquals("time_temperature temperature",
                RenderingStrategySelector.shadedColumnName(axis("time", "temperature", null, null)));
    }
}
