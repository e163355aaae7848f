package com.calai.nutrilabel.label.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "inventory_lots",
        indexes = @Index(name = "idx_inventory_lots_org_product", columnList = "organization_id,product_id")
)
public class InventoryLotEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "organization_id", length = 36, nullable = false)
    private String organizationId;

    @Column(name = "product_id", length = 36, nullable = false)
    private String productId;

    @Column(name = "lot_code", length = 64)
    private String lotCode;

    @Column(name = "source_order_ref", length = 255)
    private String sourceOrderRef;

    @Column(name = "received_at")
    private Instant receivedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "quantity_available_g")
    private Double quantityAvailableG;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
    }
}
