package com.calai.nutrilabel.label.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "recipes",
        indexes = @Index(name = "idx_recipes_sku_active", columnList = "sku_id,active")
)
public class RecipeEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "sku_id", length = 36, nullable = false)
    private String skuId;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (updatedAtUtc == null) updatedAtUtc = Instant.now();
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }
}
