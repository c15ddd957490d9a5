package com.datafetch.infrastructure.dataset;

import com.datafetch.domain.model.TimeSeriesDataset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDatasetRegistryTest {

    private InMemoryDatasetRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryDatasetRegistry();
        registry.register(TimeSeriesDataset.builder()
                .name("ctd")
                .timestamps(new long[] {1_000, 2_000, 3_000, 4_000})
                .variable("temperature", new double[] {1, 2, 3, 4})
                .variable("salinity", new double[] {5, 6, 7, 8})
                .variable("oxygen", new double[] {9, 10, 11, 12})
                .build());
    }

    @Test
    void testEstimateCoversOnlyProjection() {
        DatasetHandle handle = registry.resolve("ctd", List.of("temperature", "time"));

        // temperature + time, four samples, eight bytes each
        assertEquals(2 * 4 * 8, handle.getEstimatedBytes());
        assertEquals("ctd", handle.getDatasetId());
    }

    @Test
    void testFetchSlicesWindow() {
        DatasetHandle handle = registry.resolve("ctd", List.of("salinity", "time"));

        Optional<TimeSeriesDataset> fetched = handle.fetch(Instant.ofEpochMilli(2_000), Instant.ofEpochMilli(3_000));

        assertTrue(fetched.isPresent());
        assertArrayEquals(new double[] {6, 7}, fetched.get().values("salinity"));
        assertFalse(fetched.get().hasVariable("oxygen"));
    }

    @Test
    void testUnknownDataset() {
        assertThrows(DatasetResolutionException.class, () -> registry.resolve("adcp", List.of("time")));
    }

    @Test
    void testUnknownVariable() {
        assertThrows(DatasetResolutionException.class, () -> registry.resolve("ctd", List.of("chlorophyll")));
    }

    @Test
    void testDatasetWithoutData() {
        registry.registerWithoutData("empty-stream");

        DatasetHandle handle = registry.resolve("empty-stream", List.of("temperature", "time"));

        assertEquals(0, handle.getEstimatedBytes());
        assertTrue(handle.fetch(Instant.EPOCH, Instant.now()).isEmpty());
    }
}
