package com.pulse.forecast.service.prediction;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.model.FeatureOutcomePair;
import com.pulse.forecast.model.FeatureRecord;
import com.pulse.forecast.repository.FeatureRecordRepository;
import com.pulse.forecast.service.feature.FeatureVectorSchema;
import com.pulse.forecast.util.TestFeatureFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FeatureWindowServiceTest {

    private static final Instant START = Instant.parse("2024-03-04T22:00:00Z");

    private final FeatureVectorSchema schema = new FeatureVectorSchema();
    private final int rsiColumn = schema.names().indexOf("rsi");
    private FeatureRecordRepository repository;
    private FeatureWindowService service;

    @BeforeEach
    void setUp() {
        ForecastProperties properties = new ForecastProperties();
        properties.getTraining().setSequenceWindow(3);
        repository = mock(FeatureRecordRepository.class);
        service = new FeatureWindowService(repository, schema, properties);
    }

    @Test
    void windowEndsWithTheScoredRowAndReadsOnlyEarlierRows() {
        FeatureRecord monday = row(1, 0);
        FeatureRecord tuesday = row(2, 1);
        FeatureRecord wednesday = row(3, 2);
        when(repository.findBySymbolAndTimestampBeforeOrderByTimestampDesc(eq("CBA.AX"), eq(wednesday.getTimestamp()), any()))
                .thenReturn(List.of(tuesday, monday));

        double[][] window = service.window(wednesday);

        assertThat(rsi(window)).containsExactly(41.0, 42.0, 43.0);
        verify(repository).findBySymbolAndTimestampBeforeOrderByTimestampDesc("CBA.AX", wednesday.getTimestamp(),
                PageRequest.of(0, 2));
    }

    @Test
    void shortHistoryIsPaddedWithItsOldestRow() {
        FeatureRecord first = row(1, 0);

        assertThat(rsi(service.window(first))).containsExactly(41.0, 41.0, 41.0);
    }

    @Test
    void trainingWindowsIncludeStoredRowsWithoutOutcomes() {
        FeatureRecord monday = row(1, 0);
        FeatureRecord tuesday = row(2, 1);
        FeatureRecord wednesday = row(3, 2);
        FeatureRecord thursday = row(4, 3);
        when(repository.findBySymbolAndTimestampLessThanEqualOrderByTimestampAsc("CBA.AX", thursday.getTimestamp()))
                .thenReturn(List.of(monday, tuesday, wednesday, thursday));
        List<FeatureOutcomePair> pairs = List.of(pair(monday), pair(thursday));

        Map<Long, double[][]> windows = service.windows(pairs);

        assertThat(rsi(windows.get(1L))).containsExactly(41.0, 41.0, 41.0);
        assertThat(rsi(windows.get(4L))).containsExactly(42.0, 43.0, 44.0);
    }

    @Test
    void rowsUnknownToTheStoreUseTheBatchHistory() {
        FeatureRecord monday = row(1, 0);
        FeatureRecord tuesday = row(2, 1);

        Map<Long, double[][]> windows = service.windows(List.of(pair(tuesday), pair(monday)));

        assertThat(rsi(windows.get(2L))).containsExactly(41.0, 41.0, 42.0);
    }

    private FeatureRecord row(long id, int day) {
        FeatureRecord feature = TestFeatureFactory.feature("CBA.AX", START.plus(Duration.ofDays(day)));
        feature.setId(id);
        feature.setRsi(40.0 + id);
        return feature;
    }

    private FeatureOutcomePair pair(FeatureRecord feature) {
        return new FeatureOutcomePair(feature,
                TestFeatureFactory.completeOutcome(feature, 100.0, 100.5, 101.0, 102.0));
    }

    private double[] rsi(double[][] window) {
        return Arrays.stream(window).mapToDouble(values -> values[rsiColumn]).toArray();
    }
}
