package com.koni.homeenergy.infrastructure.persistence.repository;

import com.koni.homeenergy.infrastructure.persistence.entity.SampleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * JPA repository for SampleEntity persistence operations.
 * Filtered lookups go through {@link JpaSpecificationExecutor} with {@link SampleSpecifications}.
 */
@Repository
public interface SampleJpaRepository extends JpaRepository<SampleEntity, Long>, JpaSpecificationExecutor<SampleEntity> {

    @Query("select s from SampleEntity s " +
           "where lower(s.category) = lower(:category) and s.timestamp >= :from and s.timestamp < :to " +
           "order by s.timestamp asc")
    List<SampleEntity> findPowerSamples(@Param("category") String category,
                                        @Param("from") Instant from,
                                        @Param("to") Instant to);

    @Query("select s from SampleEntity s " +
           "where s.deviceId in :deviceIds " +
           "and lower(s.category) = lower(:category) and s.timestamp >= :from and s.timestamp < :to " +
           "order by s.timestamp asc")
    List<SampleEntity> findPowerSamples(@Param("deviceIds") Collection<String> deviceIds,
                                        @Param("category") String category,
                                        @Param("from") Instant from,
                                        @Param("to") Instant to);

    @Query("select new com.koni.homeenergy.infrastructure.persistence.repository.CategoryStatsRow(" +
           "s.category, count(s), avg(s.value), min(s.value), max(s.value), max(s.timestamp)) " +
           "from SampleEntity s " +
           "where s.deviceId = :deviceId and s.timestamp >= :from and s.timestamp <= :to " +
           "group by s.category order by s.category")
    List<CategoryStatsRow> statsByCategory(@Param("deviceId") String deviceId,
                                           @Param("from") Instant from,
                                           @Param("to") Instant to);

    @Modifying
    @Transactional
    @Query("delete from SampleEntity s where s.timestamp < :cutoff")
    int deleteByTimestampBefore(@Param("cutoff") Instant cutoff);
}
