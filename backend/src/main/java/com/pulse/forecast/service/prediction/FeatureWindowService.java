package com.pulse.forecast.service.prediction;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.model.FeatureOutcomePair;
import com.pulse.forecast.model.FeatureRecord;
import com.pulse.forecast.repository.FeatureRecordRepository;
import com.pulse.forecast.service.feature.FeatureVectorSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the per-symbol window of feature vectors the models score: the stored rows of the same
 * symbol up to and including the target row, oldest first. Only rows at or before the target's
 * timestamp are ever read, and short histories are padded with their oldest row.
 */
@Service
@RequiredArgsConstructor
public class FeatureWindowService {

    private final FeatureRecordRepository featureRecordRepository;
    private final FeatureVectorSchema featureVectorSchema;
    private final ForecastProperties forecastProperties;

    public int length() {
        return forecastProperties.getTraining().getSequenceWindow();
    }

    @Transactional(readOnly = true)
    public double[][] window(FeatureRecord feature) {
        List<FeatureRecord> rows = new ArrayList<>();
        if (length() > 1) {
            rows.addAll(featureRecordRepository.findBySymbolAndTimestampBeforeOrderByTimestampDesc(
                    feature.getSymbol(), feature.getTimestamp(), PageRequest.of(0, length() - 1)));
            Collections.reverse(rows);
        }
        rows.add(feature);
        return pad(rows);
    }

    /**
     * Windows for every pair, keyed by feature id. Each symbol's history is read once.
     */
    @Transactional(readOnly = true)
    public Map<Long, double[][]> windows(List<FeatureOutcomePair> pairs) {
        Map<String, List<FeatureRecord>> bySymbol = pairs.stream()
                .map(FeatureOutcomePair::feature)
                .collect(Collectors.groupingBy(FeatureRecord::getSymbol));
        Map<Long, double[][]> windows = new HashMap<>();
        bySymbol.forEach((symbol, features) -> {
            Instant newest = features.stream().map(FeatureRecord::getTimestamp).max(Comparator.naturalOrder()).orElseThrow();
            List<FeatureRecord> history = featureRecordRepository
                    .findBySymbolAndTimestampLessThanEqualOrderByTimestampAsc(symbol, newest);
            Map<Long, Integer> positions = new HashMap<>();
            for (int i = 0; i < history.size(); i++) {
                positions.put(history.get(i).getId(), i);
            }
            for (FeatureRecord feature : features) {
                Integer position = positions.get(feature.getId());
                List<FeatureRecord> rows = position == null
                        ? earlierInBatch(features, feature)
                        : history.subList(Math.max(0, position - length() + 1), position + 1);
                windows.put(feature.getId(), pad(rows));
            }
        });
        return windows;
    }

    /**
     * Falls back to the rows handed in when the store has not seen the feature.
     */
    private List<FeatureRecord> earlierInBatch(List<FeatureRecord> features, FeatureRecord target) {
        List<FeatureRecord> earlier = features.stream()
                .filter(candidate -> !candidate.getTimestamp().isAfter(target.getTimestamp()))
                .filter(candidate -> !Objects.equals(candidate.getId(), target.getId()))
                .sorted(Comparator.comparing(FeatureRecord::getTimestamp))
                .collect(Collectors.toCollection(ArrayList::new));
        earlier.add(target);
        return earlier.subList(Math.max(0, earlier.size() - length()), earlier.size());
    }

    private double[][] pad(List<FeatureRecord> rows) {
        int length = length();
        double[][] window = new double[length][];
        int offset = length - rows.size();
        for (int t = 0; t < length; t++) {
            window[t] = featureVectorSchema.vector(rows.get(Math.max(0, t - offset)));
        }
        return window;
    }
}
