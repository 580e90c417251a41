package com.salesanomaly.repository;

import com.salesanomaly.entity.GojekDailyStat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface GojekDailyStatRepository extends JpaRepository<GojekDailyStat, Long> {

    @Query("""
        SELECT g FROM GojekDailyStat g
        WHERE g.restaurantId = :restaurantId
          AND g.statDate BETWEEN :fromDate AND :toDate
        ORDER BY g.statDate ASC
    """)
    List<GojekDailyStat> findForRestaurant(
        @Param("restaurantId") Long restaurantId,
        @Param("fromDate") LocalDate fromDate,
        @Param("toDate") LocalDate toDate);
}
