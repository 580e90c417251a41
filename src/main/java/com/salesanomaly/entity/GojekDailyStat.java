package com.salesanomaly.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

@Entity
@Table(
    name = "gojek_stats",
    uniqueConstraints = @UniqueConstraint(name = "uq_gojek_restaurant_date", columnNames = {"restaurant_id", "stat_date"}),
    indexes = @Index(name = "idx_gojek_restaurant_date", columnList = "restaurant_id, stat_date")
)
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class GojekDailyStat extends PlatformDailyStat {

    @Column(name = "preparation_time")
    private Double preparationTime;

    @Column(name = "delivery_time")
    private Double deliveryTime;

    @Override
    public Platform platform() {
        return Platform.GOJEK;
    }
}
