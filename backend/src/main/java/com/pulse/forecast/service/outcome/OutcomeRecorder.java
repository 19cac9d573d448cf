package com.pulse.forecast.service.outcome;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.exception.StalePriceException;
import com.pulse.forecast.model.Direction;
import com.pulse.forecast.model.FeatureRecord;
import com.pulse.forecast.model.Horizon;
import com.pulse.forecast.model.Outcome;
import com.pulse.forecast.repository.OutcomeRepository;
import com.pulse.forecast.util.ReturnMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the single outcome row of a feature. Horizons that have not elapsed stay null; elapsed
 * horizons without a price leave the row PENDING and raise {@link StalePriceException} after the
 * row is stored. Later calls only fill fields that are still null.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutcomeRecorder {

    private final OutcomeRepository outcomeRepository;
    private final ForecastProperties forecastProperties;

    public Outcome record(FeatureRecord feature, Double entryPrice, Map<Horizon, PriceLookup.PriceQuote> exits,
                          Instant asOf) {
        Instant featureTime = feature.getTimestamp();
        if (!Horizon.shortest().hasElapsed(featureTime, asOf)) {
            throw new IllegalStateException("Outcome for feature " + feature.getId() + " is not due before "
                    + Horizon.shortest().after(featureTime));
        }
        Outcome outcome = outcomeRepository.findByFeatureId(feature.getId())
                .orElseGet(() -> Outcome.builder()
                        .featureId(feature.getId())
                        .symbol(feature.getSymbol())
                        .status(Outcome.Status.PENDING)
                        .recordedTimestamp(asOf)
                        .build());
        if (outcome.getEntryPrice() == null && isUsablePrice(entryPrice)) {
            outcome.setEntryPrice(entryPrice);
        }

        List<Horizon> missing = new ArrayList<>();
        int filled = 0;
        for (Horizon horizon : Horizon.values()) {
            if (outcome.isFilled(horizon) || !horizon.hasElapsed(featureTime, asOf)) {
                continue;
            }
            PriceLookup.PriceQuote quote = exits.get(horizon);
            if (outcome.getEntryPrice() == null || quote == null || !isUsablePrice(quote.price())) {
                missing.add(horizon);
                continue;
            }
            if (quote.observedAt().isBefore(horizon.after(featureTime))) {
                log.warn("Exit price observed before horizon end ignored symbol={} horizon={} observedAt={}",
                        feature.getSymbol(), horizon.label(), quote.observedAt());
                missing.add(horizon);
                continue;
            }
            double returnPct = ReturnMath.returnPct(outcome.getEntryPrice(), quote.price());
            if (Math.abs(returnPct) > forecastProperties.getGuard().getMaxAbsReturnPct()) {
                log.warn("Unusually large return symbol={} horizon={} entry={} exit={} returnPct={}",
                        feature.getSymbol(), horizon.label(), outcome.getEntryPrice(), quote.price(), returnPct);
            }
            Direction direction = Direction.ofReturn(returnPct, forecastProperties.getFlatBandPct());
            outcome.fill(horizon, quote.price(), returnPct, direction, quote.observedAt());
            filled++;
        }
        outcome.setStatus(outcome.isComplete() ? Outcome.Status.COMPLETE : Outcome.Status.PENDING);
        if (filled > 0 || outcome.getId() == null) {
            outcome.setRecordedTimestamp(asOf);
            outcome = outcomeRepository.save(outcome);
            log.info("Outcome recorded featureId={} symbol={} filled={} status={}",
                    feature.getId(), feature.getSymbol(), filled, outcome.getStatus());
        }
        if (!missing.isEmpty()) {
            String horizons = missing.stream().map(Horizon::label).collect(Collectors.joining(","));
            throw new StalePriceException(feature.getSymbol(), asOf,
                    "No usable price for " + feature.getSymbol() + " horizons=" + horizons
                            + (outcome.getEntryPrice() == null ? " (entry price missing)" : ""));
        }
        return outcome;
    }

    private boolean isUsablePrice(Double price) {
        return price != null && Double.isFinite(price) && price > 0;
    }
}
