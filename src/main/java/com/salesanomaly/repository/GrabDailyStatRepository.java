package com.salesanomaly.repository;

import com.salesanomaly.entity.GrabDailyStat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface GrabDailyStatRepository extends JpaRepository<GrabDailyStat, Long> {

    @Query("""
        SELECT g FROM GrabDailyStat g
        WHERE g.restaurantId = :restaurantId
          AND g.statDate BETWEEN :fromDate AND :toDate
        ORDER BY g.statDate ASC
    """)
    List<GrabDailyStat> findForRestaurant(
        @Param("restaurantId") Long restaurantId,
        @Param("fromDate") LocalDate fromDate,
        @Param("toDate") LocalDate toDate);
}
