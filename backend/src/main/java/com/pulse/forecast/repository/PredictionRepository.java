package com.pulse.forecast.repository;

import com.pulse.forecast.model.Prediction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface PredictionRepository extends JpaRepository<Prediction, Long> {

    boolean existsBySymbolAndPredictionDate(String symbol, LocalDate predictionDate);

    List<Prediction> findByPredictionDateOrderBySymbolAsc(LocalDate predictionDate);

    Optional<Prediction> findTopBySymbolOrderByPredictionDateDesc(String symbol);

    @Query("select p.symbol, p.predictionDate, count(p) from Prediction p "
            + "group by p.symbol, p.predictionDate having count(p) > 1")
    List<Object[]> findDuplicateSymbolDays();

    @Query("select count(p) from Prediction p, FeatureRecord f "
            + "where p.featureId = f.id and p.createdTimestamp <> f.timestamp")
    long countCreatedAwayFromFeature();

    @Query("select p, o from Prediction p, Outcome o where p.featureId = o.featureId "
            + "and o.realizedReturnPct is not null order by p.createdTimestamp asc")
    List<Object[]> findWithRealizedOutcome();
}
