package com.pulse.forecast.service.prediction;

import com.pulse.forecast.ml.TrainingSample;
import com.pulse.forecast.model.FeatureOutcomePair;
import com.pulse.forecast.model.FeatureRecord;
import com.pulse.forecast.model.Horizon;
import com.pulse.forecast.model.Outcome;
import com.pulse.forecast.repository.OutcomeRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Reads committed feature/outcome pairs in timestamp order.
 */
@Service
@RequiredArgsConstructor
public class TrainingDataService {

    private final OutcomeRepository outcomeRepository;
    private final FeatureWindowService featureWindowService;

    @Transactional(readOnly = true)
    public List<FeatureOutcomePair> completePairsUpTo(Instant asOf) {
        return toPairs(outcomeRepository.findPairsUpTo(Outcome.Status.COMPLETE, asOf));
    }

    @Transactional(readOnly = true)
    public List<FeatureOutcomePair> completePairsAfter(Instant cutoff) {
        return toPairs(outcomeRepository.findPairsAfter(Outcome.Status.COMPLETE, cutoff));
    }

    @Transactional(readOnly = true)
    public List<FeatureOutcomePair> allPairs() {
        return toPairs(outcomeRepository.findAllPairs());
    }

    /**
     * Labelled samples in the order given, each carrying its symbol's feature window.
     */
    public List<TrainingSample> toSamples(List<FeatureOutcomePair> pairs) {
        Map<Long, double[][]> windows = featureWindowService.windows(pairs);
        return pairs.stream()
                .map(pair -> toSample(pair, windows.get(pair.feature().getId())))
                .toList();
    }

    TrainingSample toSample(FeatureOutcomePair pair, double[][] window) {
        Outcome outcome = pair.outcome();
        Horizon[] horizons = Horizon.values();
        int[] directions = new int[horizons.length];
        double[] returns = new double[horizons.length];
        for (Horizon horizon : horizons) {
            if (!outcome.isFilled(horizon)) {
                throw new IllegalArgumentException("Outcome " + outcome.getId() + " has no " + horizon.label() + " value");
            }
            directions[horizon.ordinal()] = outcome.direction(horizon).index();
            returns[horizon.ordinal()] = outcome.returnPct(horizon);
        }
        return new TrainingSample(pair.timestamp(), window, directions, returns);
    }

    private List<FeatureOutcomePair> toPairs(List<Object[]> rows) {
        return rows.stream()
                .map(row -> new FeatureOutcomePair((FeatureRecord) row[0], (Outcome) row[1]))
                .toList();
    }
}
