package com.calai.nutrilabel.nutrient.entity;

import com.calai.nutrilabel.nutrient.model.EvidenceGrade;
import com.calai.nutrilabel.nutrient.model.SourceType;
import com.calai.nutrilabel.nutrient.model.VerificationStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * 每個產品、每個 nutrient key 一列（per 100g，標準單位）
 * ✅ version：樂觀鎖，upsert 時 +1（last-writer-wins）
 */
@Getter
@Setter
@Entity
@Table(name = "product_nutrient_values",
        uniqueConstraints = @UniqueConstraint(name = "ux_pnv_product_key", columnNames = {"product_id", "nutrient_key"}),
        indexes = @Index(name = "idx_pnv_key", columnList = "nutrient_key")
)
public class ProductNutrientValueEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "product_id", length = 36, nullable = false)
    private String productId;

    @Column(name = "nutrient_key", length = 32, nullable = false)
    private String nutrientKey;

    @Column(name = "value_per_100g")
    private Double valuePer100g;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", length = 16, nullable = false)
    private SourceType sourceType;

    @Column(name = "source_ref", length = 512, nullable = false)
    private String sourceRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", length = 16, nullable = false)
    private VerificationStatus verificationStatus = VerificationStatus.NEEDS_REVIEW;

    @Enumerated(EnumType.STRING)
    @Column(name = "evidence_grade", length = 40, nullable = false)
    private EvidenceGrade evidenceGrade;

    @Column(name = "confidence_score", nullable = false)
    private double confidenceScore;

    @Column(name = "historical_exception", nullable = false)
    private boolean historicalException;

    @Column(name = "retrieved_at")
    private Instant retrievedAt;

    @Column(name = "retrieval_run_id", length = 64)
    private String retrievalRunId;

    @Version
    @Column(nullable = false)
    private long version;

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
