package com.calai.nutrilabel.nutrient.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * 人工複核任務（只負責建立，處理流程不在這個服務）
 */
@Getter
@Setter
@Entity
@Table(name = "verification_tasks",
        indexes = @Index(name = "idx_verification_tasks_org_status", columnList = "organization_id,status")
)
public class VerificationTaskEntity {

    public enum TaskType { SOURCE_RETRIEVAL, CONSISTENCY }

    public enum Severity { LOW, MEDIUM, HIGH, CRITICAL }

    public enum Status { OPEN, RESOLVED, DISMISSED }

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "organization_id", length = 36, nullable = false)
    private String organizationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", length = 32, nullable = false)
    private TaskType taskType;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private Status status = Status.OPEN;

    @Column(nullable = false, length = 255)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "JSON")
    private JsonNode payload;

    @Column(name = "created_by", length = 64, nullable = false)
    private String createdBy;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAtUtc == null) createdAtUtc = Instant.now();
        if (status == null) status = Status.OPEN;
    }
}
