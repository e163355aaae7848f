package com.calai.nutrilabel.nutrient.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "product_catalog",
        indexes = {
                @Index(name = "idx_product_catalog_org_ingredient", columnList = "organization_id,ingredient_id"),
                @Index(name = "idx_product_catalog_upc", columnList = "upc")
        }
)
public class ProductCatalogEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "organization_id", length = 36, nullable = false)
    private String organizationId;

    @Column(name = "ingredient_id", length = 36, nullable = false)
    private String ingredientId;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 128)
    private String brand;

    @Column(length = 64)
    private String upc;

    @Column(length = 128)
    private String vendor;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        if (createdAtUtc == null) createdAtUtc = now;
        if (updatedAtUtc == null) updatedAtUtc = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }
}
