package com.mouse.surebet.repository;

import com.mouse.surebet.entity.OddsComparisonView;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface OddsComparisonRepository extends JpaRepository<OddsComparisonView, OddsComparisonView.Key> {

    @Query("""
    SELECT o FROM OddsComparisonView o
    WHERE COALESCE(o.sportType, 'football') = :sportType
      AND o.matchDate >= :dateFrom
      AND o.matchDate <= :dateTo
    ORDER BY o.matchDate ASC, o.matchId ASC
    """)
    List<OddsComparisonView> findForComparison(
            @Param("sportType") String sportType,
            @Param("dateFrom") Instant dateFrom,
            @Param("dateTo") Instant dateTo
    );

    @Query("""
    SELECT o FROM OddsComparisonView o
    WHERE COALESCE(o.sportType, 'football') = :sportType
      AND o.leagueName = :leagueName
      AND o.matchDate >= :dateFrom
      AND o.matchDate <= :dateTo
    ORDER BY o.matchDate ASC, o.matchId ASC
    """)
    List<OddsComparisonView> findForComparisonInLeague(
            @Param("sportType") String sportType,
            @Param("leagueName") String leagueName,
            @Param("dateFrom") Instant dateFrom,
            @Param("dateTo") Instant dateTo
    );
}
