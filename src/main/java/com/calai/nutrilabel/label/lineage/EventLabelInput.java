package com.calai.nutrilabel.label.lineage;

import com.calai.nutrilabel.label.compute.DeclaredIngredient;
import com.calai.nutrilabel.label.entity.MealServiceEventEntity;
import com.calai.nutrilabel.label.entity.SkuEntity;

import java.util.List;

/**
 * @param declaredIngredients active recipe 的每一條 line（成分聲明 / 過敏原用）
 */
public record EventLabelInput(
        MealServiceEventEntity event,
        SkuEntity sku,
        String recipeId,
        List<ConsumedLot> lots,
        List<DeclaredIngredient> declaredIngredients
) {
    public EventLabelInput {
        lots = List.copyOf(lots);
        declaredIngredients = declaredIngredients == null ? List.of() : List.copyOf(declaredIngredients);
    }
}
