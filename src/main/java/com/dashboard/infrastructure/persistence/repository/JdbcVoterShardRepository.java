package com.dashboard.infrastructure.persistence.repository;

import com.dashboard.domain.exception.ShardUnavailableException;
import com.dashboard.domain.model.BoothStat;
import com.dashboard.infrastructure.shard.ShardHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.function.Supplier;

/**
 * Voter aggregations against the per-AC voters tables.
 * 
 * Indexing Strategy (per shard table):
 * - booth_id for booth grouping and distinct booth counts
 * - family_id (partial, non-null) for distinct family counts
 * - surveyed for the survey completion count
 * 
 * age is nullable; AVG skips unknown ages.
 * 
 * Connection and missing-table errors surface as ShardUnavailableException;
 * anything else propagates unchanged.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcVoterShardRepository implements VoterShardRepository {
    
    private static final RowMapper<BoothStat> BOOTH_ROW = (rs, rowNum) -> BoothStat.builder()
            .boothId(rs.getString("booth_id"))
            .boothNo(rs.getObject("booth_no", Integer.class))
            .boothName(rs.getString("booth_name"))
            .voterCount(rs.getLong("voters"))
            .surveyedVoters(rs.getLong("surveyed_voters"))
            .maleVoters(rs.getLong("male_voters"))
            .femaleVoters(rs.getLong("female_voters"))
            .familyCount(rs.getLong("family_count"))
            .verifiedVoters(rs.getLong("verified_voters"))
            .avgAge(rs.getLong("avg_age"))
            .build();
    
    private final JdbcTemplate jdbcTemplate;
    
    @Override
    public long count(ShardHandle shard, VoterFilter filter) {
        String sql = switch (filter) {
            case ALL -> "SELECT COUNT(*) FROM " + shard.getTableName();
            case SURVEYED -> "SELECT COUNT(*) FROM " + shard.getTableName() + " WHERE surveyed = TRUE";
        };
        return execute(shard, () -> queryForCount(sql));
    }
    
    @Override
    public long countDistinct(ShardHandle shard, VoterField field) {
        String column = field.getColumn();
        String sql = "SELECT COUNT(DISTINCT " + column + ") FROM " + shard.getTableName() +
                " WHERE " + column + " IS NOT NULL AND " + column + " <> ''";
        return execute(shard, () -> queryForCount(sql));
    }
    
    /**
     * Booth-wise stats.
     * 
     * boothName is the first non-null name in insertion (id) order, which a
     * plain MIN/MAX would not give us.
     */
    @Override
    public List<BoothStat> boothBreakdown(ShardHandle shard) {
        String table = shard.getTableName();
        String sql = "SELECT v.booth_id, " +
                "MIN(v.boothno) AS booth_no, " +
                "(SELECT b.boothname FROM " + table + " b " +
                "  WHERE b.booth_id = v.booth_id AND b.boothname IS NOT NULL " +
                "  ORDER BY b.id LIMIT 1) AS booth_name, " +
                "COUNT(*) AS voters, " +
                "SUM(CASE WHEN v.surveyed = TRUE THEN 1 ELSE 0 END) AS surveyed_voters, " +
                "SUM(CASE WHEN LOWER(v.gender) = 'male' THEN 1 ELSE 0 END) AS male_voters, " +
                "SUM(CASE WHEN LOWER(v.gender) = 'female' THEN 1 ELSE 0 END) AS female_voters, " +
                "COUNT(DISTINCT NULLIF(v.family_id, '')) AS family_count, " +
                "SUM(CASE WHEN v.verified = TRUE THEN 1 ELSE 0 END) AS verified_voters, " +
                "COALESCE(ROUND(AVG(v.age)), 0) AS avg_age " +
                "FROM " + table + " v " +
                "WHERE v.booth_id IS NOT NULL AND v.booth_id <> '' " +
                "GROUP BY v.booth_id " +
                "ORDER BY booth_no ASC";
        return execute(shard, () -> jdbcTemplate.query(sql, BOOTH_ROW));
    }
    
    private long queryForCount(String sql) {
        Long count = jdbcTemplate.queryForObject(sql, Long.class);
        return count != null ? count : 0L;
    }
    
    private <T> T execute(ShardHandle shard, Supplier<T> query) {
        try {
            return query.get();
            
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw new ShardUnavailableException(shard.getAcId(), e.getMessage(), e);
            
        } catch (BadSqlGrammarException e) {
            // Most likely the shard table does not exist (yet)
            log.error("Query against {} failed: {}", shard.getTableName(), e.getMessage());
            throw new ShardUnavailableException(shard.getAcId(), "table " + shard.getTableName() + " not queryable", e);
        }
    }
}
