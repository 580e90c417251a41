package com.salesanomaly.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.LocalDate;

@MappedSuperclass
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public abstract class PlatformDailyStat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Column(name = "stat_date", nullable = false)
    private LocalDate statDate;

    private double sales;
    private int orders;
    private Double rating;

    @Column(name = "cancelled_orders")
    private int cancelledOrders;

    @Column(name = "store_is_closed")
    private boolean storeIsClosed;

    @Column(name = "out_of_stock")
    private boolean outOfStock;

    @Column(name = "store_is_busy")
    private boolean storeIsBusy;

    @Column(name = "ads_spend")
    private double adsSpend;

    @Column(name = "ads_sales")
    private double adsSales;

    public abstract Platform platform();
}
