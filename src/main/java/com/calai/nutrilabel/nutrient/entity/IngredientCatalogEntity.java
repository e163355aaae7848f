package com.calai.nutrilabel.nutrient.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "ingredient_catalog",
        uniqueConstraints = @UniqueConstraint(name = "ux_ingredient_catalog_org_key", columnNames = {"organization_id", "canonical_key"})
)
public class IngredientCatalogEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "organization_id", length = 36, nullable = false)
    private String organizationId;

    @Column(name = "canonical_key", length = 128, nullable = false)
    private String canonicalKey;

    @Column(nullable = false, length = 255)
    private String name;

    /** milk / egg / tree_nuts ... */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "allergen_tags", columnDefinition = "JSON")
    private List<String> allergenTags = new ArrayList<>();

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
