package com.calai.nutrilabel.label.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * parent（粗）→ child（細），只新增
 */
@Getter
@Setter
@Entity
@Table(name = "label_lineage_edges",
        indexes = {
                @Index(name = "idx_label_edges_parent", columnList = "parent_label_id"),
                @Index(name = "idx_label_edges_child", columnList = "child_label_id")
        }
)
public class LabelLineageEdgeEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "parent_label_id", length = 36, nullable = false, updatable = false)
    private String parentLabelId;

    @Column(name = "child_label_id", length = 36, nullable = false, updatable = false)
    private String childLabelId;

    @Enumerated(EnumType.STRING)
    @Column(name = "edge_type", length = 40, nullable = false, updatable = false)
    private LineageEdgeType edgeType;

    @Column(name = "created_at_utc", nullable = false, updatable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
