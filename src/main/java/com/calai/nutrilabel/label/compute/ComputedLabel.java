package com.calai.nutrilabel.label.compute;

import com.calai.nutrilabel.nutrient.model.NutrientKey;

import java.util.Map;

public record ComputedLabel(
        double servings,
        double servingWeightG,
        Map<NutrientKey, Double> totals,
        Map<NutrientKey, Double> perServing,
        RoundedFda roundedFda,
        String ingredientDeclaration,
        String allergenStatement,
        LabelQa qa
) {}
