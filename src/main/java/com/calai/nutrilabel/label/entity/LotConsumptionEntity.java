package com.calai.nutrilabel.label.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * 出餐 × recipe line × inventory lot 的實際消耗克數
 */
@Getter
@Setter
@Entity
@Table(name = "lot_consumptions",
        indexes = @Index(name = "idx_lot_consumptions_event", columnList = "meal_service_event_id")
)
public class LotConsumptionEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "meal_service_event_id", length = 36, nullable = false)
    private String mealServiceEventId;

    @Column(name = "recipe_line_id", length = 36, nullable = false)
    private String recipeLineId;

    @Column(name = "inventory_lot_id", length = 36, nullable = false)
    private String inventoryLotId;

    @Column(name = "grams_consumed", nullable = false)
    private double gramsConsumed;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
    }
}
