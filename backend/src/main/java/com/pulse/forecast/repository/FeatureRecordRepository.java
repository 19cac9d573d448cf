package com.pulse.forecast.repository;

import com.pulse.forecast.model.FeatureRecord;
import com.pulse.forecast.model.Outcome;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface FeatureRecordRepository extends JpaRepository<FeatureRecord, Long> {

    Optional<FeatureRecord> findBySymbolAndCycleDate(String symbol, LocalDate cycleDate);

    Optional<FeatureRecord> findFirstBySymbolAndTimestampGreaterThanEqualAndCurrentPriceIsNotNullOrderByTimestampAsc(
            String symbol, Instant timestamp);

    List<FeatureRecord> findBySymbolAndTimestampBeforeOrderByTimestampDesc(String symbol, Instant timestamp,
                                                                         Pageable pageable);

    List<FeatureRecord> findBySymbolAndTimestampLessThanEqualOrderByTimestampAsc(String symbol, Instant timestamp);

    @Query("select f from FeatureRecord f where f.timestamp <= :cutoff "
            + "and not exists (select o.id from Outcome o where o.featureId = f.id and o.status = :complete) "
            + "order by f.timestamp asc")
    List<FeatureRecord> findAwaitingOutcome(@Param("cutoff") Instant cutoff,
                                            @Param("complete") Outcome.Status complete);

    @Query("select count(f) from FeatureRecord f where f.timestamp <= :cutoff "
            + "and not exists (select o.id from Outcome o where o.featureId = f.id)")
    long countMatureWithoutOutcome(@Param("cutoff") Instant cutoff);

    @Query("select count(f) from FeatureRecord f where f.sentimentObservedAt > f.timestamp "
            + "or f.technicalObservedAt > f.timestamp or f.contextObservedAt > f.timestamp")
    long countWithFutureSignals();
}
