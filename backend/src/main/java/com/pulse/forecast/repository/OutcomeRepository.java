package com.pulse.forecast.repository;

import com.pulse.forecast.model.Outcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface OutcomeRepository extends JpaRepository<Outcome, Long> {

    Optional<Outcome> findByFeatureId(Long featureId);

    boolean existsByFeatureId(Long featureId);

    long countByStatus(Outcome.Status status);

    @Query("select count(o) from Outcome o where not exists "
            + "(select f.id from FeatureRecord f where f.id = o.featureId)")
    long countOrphans();

    @Query("select o.featureId from Outcome o group by o.featureId having count(o) > 1")
    List<Long> findFeaturesWithSeveralOutcomes();

    @Query("select count(o) from Outcome o, FeatureRecord f where o.featureId = f.id "
            + "and o.exitPrice1h is not null and o.exitRecordedAt1h < f.timestamp + 1 hour")
    long countEarlyExits1h();

    @Query("select count(o) from Outcome o, FeatureRecord f where o.featureId = f.id "
            + "and o.exitPrice4h is not null and o.exitRecordedAt4h < f.timestamp + 4 hour")
    long countEarlyExits4h();

    @Query("select count(o) from Outcome o, FeatureRecord f where o.featureId = f.id "
            + "and o.exitPrice1d is not null and o.exitRecordedAt1d < f.timestamp + 1 day")
    long countEarlyExits1d();

    /**
     * Stored returns that disagree with {@code ((exit - entry) / entry) * 100} by more than the tolerance.
     * A filled horizon without a positive entry price counts as a disagreement.
     */
    @Query("select count(o) from Outcome o where o.returnPct1h is not null and o.exitPrice1h is not null "
            + "and (o.entryPrice is null or o.entryPrice <= 0 "
            + "or abs(o.returnPct1h - ((o.exitPrice1h - o.entryPrice) / o.entryPrice) * 100) > :tolerance)")
    long countInconsistentReturns1h(@Param("tolerance") double tolerance);

    @Query("select count(o) from Outcome o where o.returnPct4h is not null and o.exitPrice4h is not null "
            + "and (o.entryPrice is null or o.entryPrice <= 0 "
            + "or abs(o.returnPct4h - ((o.exitPrice4h - o.entryPrice) / o.entryPrice) * 100) > :tolerance)")
    long countInconsistentReturns4h(@Param("tolerance") double tolerance);

    @Query("select count(o) from Outcome o where o.returnPct1d is not null and o.exitPrice1d is not null "
            + "and (o.entryPrice is null or o.entryPrice <= 0 "
            + "or abs(o.returnPct1d - ((o.exitPrice1d - o.entryPrice) / o.entryPrice) * 100) > :tolerance)")
    long countInconsistentReturns1d(@Param("tolerance") double tolerance);

    /**
     * Feature/outcome pairs ordered by feature timestamp. Rows are {@code [FeatureRecord, Outcome]}.
     */
    @Query("select f, o from FeatureRecord f, Outcome o where o.featureId = f.id order by f.timestamp asc")
    List<Object[]> findAllPairs();

    @Query("select f, o from FeatureRecord f, Outcome o where o.featureId = f.id "
            + "and o.status = :status and f.timestamp <= :asOf order by f.timestamp asc")
    List<Object[]> findPairsUpTo(@Param("status") Outcome.Status status, @Param("asOf") Instant asOf);

    @Query("select f, o from FeatureRecord f, Outcome o where o.featureId = f.id "
            + "and o.status = :status and f.timestamp > :after order by f.timestamp asc")
    List<Object[]> findPairsAfter(@Param("status") Outcome.Status status, @Param("after") Instant after);
}
