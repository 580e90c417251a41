package com.salesanomaly.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

@Entity
@Table(
    name = "grab_stats",
    uniqueConstraints = @UniqueConstraint(name = "uq_grab_restaurant_date", columnNames = {"restaurant_id", "stat_date"}),
    indexes = @Index(name = "idx_grab_restaurant_date", columnList = "restaurant_id, stat_date")
)
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class GrabDailyStat extends PlatformDailyStat {

    @Override
    public Platform platform() {
        return Platform.GRAB;
    }
}
