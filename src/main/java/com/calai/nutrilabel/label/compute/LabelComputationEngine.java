package com.calai.nutrilabel.label.compute;

import com.calai.nutrilabel.nutrient.model.NutrientKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 消耗 lot → 每份營養標示
 * - total = Σ(per100g × grams / 100)，perServing = total / servings
 * - servings ≤ 0 一律視為 1
 * - 缺值的 key 算 0（core key 一定會出現在 perServing）
 * ✅ QA 只是診斷，不會擋住 label
 */
@Component
public class LabelComputationEngine {

    private final double qaToleranceKcal;

    public LabelComputationEngine(LabelProperties props) {
        this.qaToleranceKcal = props.qaToleranceKcalOrDefault();
    }

    public ComputedLabel compute(List<NutrientContribution> contributions,
                                 double plannedServings,
                                 List<DeclaredIngredient> ingredients) {
        double servings = servingsOrOne(plannedServings);

        Map<NutrientKey, Double> totals = totals(contributions);
        Map<NutrientKey, Double> perServing = divide(totals, servings);
        for (NutrientKey core : NutrientKey.CORE) {
            perServing.putIfAbsent(core, 0.0);
        }

        double totalGrams = 0;
        for (NutrientContribution c : contributions) totalGrams += c.grams();

        RoundedFda rounded = round(perServing);
        LabelQa qa = qa(perServing, rounded.calories());

        return new ComputedLabel(
                servings,
                totalGrams / servings,
                Collections.unmodifiableMap(totals),
                Collections.unmodifiableMap(perServing),
                rounded,
                declaration(ingredients),
                allergenStatement(ingredients),
                qa
        );
    }

    /** 只加總有資料的 key */
    public static Map<NutrientKey, Double> totals(List<NutrientContribution> contributions) {
        Map<NutrientKey, Double> out = new EnumMap<>(NutrientKey.class);
        if (contributions == null) return out;
        for (NutrientContribution c : contributions) {
            double factor = c.grams() / 100.0;
            c.per100g().forEach((k, v) -> out.merge(k, v * factor, Double::sum));
        }
        return out;
    }

    public static Map<NutrientKey, Double> divide(Map<NutrientKey, Double> totals, double servings) {
        double s = servingsOrOne(servings);
        Map<NutrientKey, Double> out = new EnumMap<>(NutrientKey.class);
        totals.forEach((k, v) -> out.put(k, v / s));
        return out;
    }

    /** 份數可以是小數（1.5 份）；≤ 0 或 NaN 一律視為 1 */
    public static double servingsOrOne(double servings) {
        return servings > 0 && Double.isFinite(servings) ? servings : 1.0;
    }

    public static RoundedFda round(Map<NutrientKey, Double> perServing) {
        return new RoundedFda(
                FdaRounding.calories(v(perServing, NutrientKey.KCAL)),
                FdaRounding.fatLike(v(perServing, NutrientKey.FAT_G)),
                FdaRounding.fatLike(v(perServing, NutrientKey.SAT_FAT_G)),
                FdaRounding.fatLike(v(perServing, NutrientKey.TRANS_FAT_G)),
                FdaRounding.cholesterol(v(perServing, NutrientKey.CHOLESTEROL_MG)),
                FdaRounding.sodium(v(perServing, NutrientKey.SODIUM_MG)),
                FdaRounding.generalGrams(v(perServing, NutrientKey.CARB_G)),
                FdaRounding.generalGrams(v(perServing, NutrientKey.FIBER_G)),
                FdaRounding.generalGrams(v(perServing, NutrientKey.SUGARS_G)),
                FdaRounding.generalGrams(v(perServing, NutrientKey.ADDED_SUGARS_G)),
                FdaRounding.generalGrams(v(perServing, NutrientKey.PROTEIN_G))
        );
    }

    LabelQa qa(Map<NutrientKey, Double> perServing, double labeledCalories) {
        double macroKcal = v(perServing, NutrientKey.PROTEIN_G) * 4
                           + v(perServing, NutrientKey.CARB_G) * 4
                           + v(perServing, NutrientKey.FAT_G) * 9;
        double delta = macroKcal - labeledCalories;
        return new LabelQa(macroKcal, labeledCalories, delta, Math.abs(delta) <= qaToleranceKcal);
    }

    /** 依每份目標克數由大到小，同名只列一次 */
    static String declaration(List<DeclaredIngredient> ingredients) {
        List<DeclaredIngredient> sorted = new ArrayList<>(ingredients == null ? List.of() : ingredients);
        sorted.sort(Comparator.comparingDouble(DeclaredIngredient::targetGPerServing).reversed());

        Set<String> names = new LinkedHashSet<>();
        for (DeclaredIngredient i : sorted) {
            if (i.name() != null && !i.name().isBlank()) names.add(i.name().trim());
        }
        return "Ingredients: " + String.join(", ", names);
    }

    static String allergenStatement(List<DeclaredIngredient> ingredients) {
        List<String> tags = new ArrayList<>();
        if (ingredients != null) {
            for (DeclaredIngredient i : ingredients) tags.addAll(i.allergenTags());
        }
        return MajorAllergen.statement(tags);
    }

    private static double v(Map<NutrientKey, Double> m, NutrientKey k) {
        Double d = m.get(k);
        return d == null ? 0.0 : d;
    }
}
