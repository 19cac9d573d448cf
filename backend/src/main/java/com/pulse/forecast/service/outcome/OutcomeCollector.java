package com.pulse.forecast.service.outcome;

import com.pulse.forecast.exception.StalePriceException;
import com.pulse.forecast.model.FeatureRecord;
import com.pulse.forecast.model.Horizon;
import com.pulse.forecast.model.Outcome;
import com.pulse.forecast.repository.FeatureRecordRepository;
import com.pulse.forecast.repository.OutcomeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evening sweep over every matured feature whose outcome is missing or incomplete. Each feature is
 * recorded on its own; a failure on one symbol never stops the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutcomeCollector {

    private final FeatureRecordRepository featureRecordRepository;
    private final OutcomeRepository outcomeRepository;
    private final OutcomeRecorder outcomeRecorder;
    private final ObjectProvider<PriceLookup> priceLookups;

    public CollectionSummary collect(Instant asOf) {
        Instant matured = asOf.minus(Horizon.shortest().duration());
        List<FeatureRecord> awaiting = featureRecordRepository.findAwaitingOutcome(matured, Outcome.Status.COMPLETE);
        log.info("Collecting outcomes asOf={} awaiting={}", asOf, awaiting.size());
        int recorded = 0;
        int backfilled = 0;
        int stale = 0;
        int failed = 0;
        for (FeatureRecord feature : awaiting) {
            MDC.put("symbol", feature.getSymbol());
            boolean existed = outcomeRepository.existsByFeatureId(feature.getId());
            try {
                outcomeRecorder.record(feature, resolveEntry(feature), resolveExits(feature, asOf), asOf);
                if (existed) {
                    backfilled++;
                } else {
                    recorded++;
                }
            } catch (StalePriceException ex) {
                stale++;
                if (!existed) {
                    recorded++;
                }
                log.warn("Outcome pending featureId={} reason={}", feature.getId(), ex.getMessage());
            } catch (RuntimeException ex) {
                failed++;
                log.error("Outcome recording failed featureId={} symbol={}", feature.getId(), feature.getSymbol(), ex);
            } finally {
                MDC.remove("symbol");
            }
        }
        long pending = outcomeRepository.countByStatus(Outcome.Status.PENDING);
        CollectionSummary summary = new CollectionSummary(awaiting.size(), recorded, backfilled, (int) pending, stale, failed);
        log.info("Outcome collection finished {}", summary);
        return summary;
    }

    private Double resolveEntry(FeatureRecord feature) {
        if (feature.getCurrentPrice() != null) {
            return feature.getCurrentPrice();
        }
        return lookup(feature.getSymbol(), feature.getTimestamp(), Duration.ZERO)
                .map(PriceLookup.PriceQuote::price)
                .orElse(null);
    }

    private Map<Horizon, PriceLookup.PriceQuote> resolveExits(FeatureRecord feature, Instant asOf) {
        Map<Horizon, PriceLookup.PriceQuote> exits = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            Instant target = horizon.after(feature.getTimestamp());
            if (target.isAfter(asOf)) {
                continue;
            }
            lookup(feature.getSymbol(), target, horizon.duration())
                    .filter(quote -> !quote.observedAt().isAfter(asOf))
                    .ifPresent(quote -> exits.put(horizon, quote));
        }
        return exits;
    }

    private Optional<PriceLookup.PriceQuote> lookup(String symbol, Instant at, Duration horizon) {
        return priceLookups.orderedStream()
                .map(lookup -> lookup.priceAt(symbol, at, horizon))
                .flatMap(Optional::stream)
                .findFirst();
    }

    public record CollectionSummary(int awaiting, int recorded, int backfilled, int pending, int stalePrices, int failed) {}
}
