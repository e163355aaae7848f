package com.calai.nutrilabel.label.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * 標示快照（只新增，不更新、不刪除）
 * ✅ version = 同 (organizationId, labelType, externalRefId) 既有筆數 + 1
 */
@Getter
@Setter
@Entity
@Table(name = "label_snapshots",
        uniqueConstraints = @UniqueConstraint(name = "ux_label_snapshots_ref_version",
                columnNames = {"organization_id", "label_type", "external_ref_id", "version"}),
        indexes = @Index(name = "idx_label_snapshots_ref", columnList = "organization_id,label_type,external_ref_id")
)
public class LabelSnapshotEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "organization_id", length = 36, nullable = false, updatable = false)
    private String organizationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "label_type", length = 16, nullable = false, updatable = false)
    private LabelType labelType;

    @Column(name = "external_ref_id", length = 64, nullable = false, updatable = false)
    private String externalRefId;

    @Column(nullable = false, length = 255, updatable = false)
    private String title;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "JSON", nullable = false, updatable = false)
    private JsonNode payload;

    @Column(nullable = false, updatable = false)
    private int version;

    @Column(name = "frozen_at", nullable = false, updatable = false)
    private Instant frozenAt;

    @Column(name = "created_by", length = 64, nullable = false, updatable = false)
    private String createdBy;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (frozenAt == null) frozenAt = Instant.now();
    }
}
