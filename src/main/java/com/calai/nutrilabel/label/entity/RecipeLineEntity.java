package com.calai.nutrilabel.label.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "recipe_lines",
        indexes = @Index(name = "idx_recipe_lines_recipe", columnList = "recipe_id,line_order")
)
public class RecipeLineEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "recipe_id", length = 36, nullable = false)
    private String recipeId;

    @Column(name = "ingredient_id", length = 36, nullable = false)
    private String ingredientId;

    @Column(name = "line_order", nullable = false)
    private int lineOrder;

    /** 每份目標克數（ingredient declaration 排序用） */
    @Column(name = "target_g_per_serving", nullable = false)
    private double targetGPerServing;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
    }
}
