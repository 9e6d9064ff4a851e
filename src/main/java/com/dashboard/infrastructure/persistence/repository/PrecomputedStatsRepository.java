package com.dashboard.infrastructure.persistence.repository;

import com.dashboard.infrastructure.persistence.entity.PrecomputedStatsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Repository for precomputed AC snapshots.
 */
@Repository
public interface PrecomputedStatsRepository extends JpaRepository<PrecomputedStatsEntity, Integer> {
    
    /**
     * Atomic full-row upsert.
     * 
     * The WHERE clause on the conflict branch keeps computed_at monotonic:
     * a snapshot older than the stored one updates nothing and 0 is returned.
     */
    @Transactional
    @Modifying
    @Query(value = "INSERT INTO precomputed_stats " +
           "(ac_id, ac_name, total_members, total_families, total_booths, surveys_completed, " +
           " booth_stats, computed_at, compute_duration_ms, updated_at) " +
           "VALUES (:#{#s.acId}, :#{#s.acName}, :#{#s.totalMembers}, :#{#s.totalFamilies}, " +
           " :#{#s.totalBooths}, :#{#s.surveysCompleted}, :#{#s.boothStats}, :#{#s.computedAt}, " +
           " :#{#s.computeDurationMs}, :#{#s.updatedAt}) " +
           "ON CONFLICT (ac_id) DO UPDATE SET " +
           "ac_name = EXCLUDED.ac_name, " +
           "total_members = EXCLUDED.total_members, " +
           "total_families = EXCLUDED.total_families, " +
           "total_booths = EXCLUDED.total_booths, " +
           "surveys_completed = EXCLUDED.surveys_completed, " +
           "booth_stats = EXCLUDED.booth_stats, " +
           "computed_at = EXCLUDED.computed_at, " +
           "compute_duration_ms = EXCLUDED.compute_duration_ms, " +
           "updated_at = EXCLUDED.updated_at " +
           "WHERE precomputed_stats.computed_at <= EXCLUDED.computed_at",
           nativeQuery = true)
    int upsert(@Param("s") PrecomputedStatsEntity snapshot);
}
