package com.calai.nutrilabel.label.compute;

import com.calai.nutrilabel.nutrient.model.NutrientKey;

import java.util.EnumMap;
import java.util.Map;

/**
 * 一筆消耗：per 100g 營養值 × 消耗克數
 */
public record NutrientContribution(Map<NutrientKey, Double> per100g, double grams) {

    public NutrientContribution {
        EnumMap<NutrientKey, Double> copy = new EnumMap<>(NutrientKey.class);
        if (per100g != null) {
            per100g.forEach((k, v) -> {
                if (k != null && v != null && Double.isFinite(v)) copy.put(k, v);
            });
        }
        per100g = copy;
        grams = Double.isFinite(grams) && grams > 0 ? grams : 0.0;
    }
}
