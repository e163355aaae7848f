package com.calai.nutrilabel.label.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * 一次出餐（SKU × servedAt）
 * ✅ finalLabelSnapshotId 是唯一會被改的指標：重建 label 時改指向最新 SKU snapshot
 */
@Getter
@Setter
@Entity
@Table(name = "meal_service_events",
        indexes = @Index(name = "idx_meal_service_events_org_served", columnList = "organization_id,served_at")
)
public class MealServiceEventEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "organization_id", length = 36, nullable = false)
    private String organizationId;

    @Column(name = "sku_id", length = 36, nullable = false)
    private String skuId;

    @Column(name = "served_at", nullable = false)
    private Instant servedAt;

    @Column(name = "planned_servings", nullable = false)
    private double plannedServings;

    @Column(name = "final_label_snapshot_id", length = 36)
    private String finalLabelSnapshotId;

    @Version
    @Column(nullable = false)
    private long version;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
    }
}
