package com.calai.nutrilabel.label.compute;

import com.calai.nutrilabel.nutrient.model.NutrientKey;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LabelComputationEngineTest {

    private final LabelComputationEngine engine = new LabelComputationEngine(new LabelProperties(null, null));

    @Test
    void per_serving_is_total_divided_by_servings_then_rounded() {
        List<NutrientContribution> lots = List.of(
                new NutrientContribution(Map.of(NutrientKey.KCAL, 130.0, NutrientKey.SODIUM_MG, 100.0), 150),
                new NutrientContribution(Map.of(NutrientKey.KCAL, 130.0), 100)
        );

        ComputedLabel label = engine.compute(lots, 2, List.of());

        assertThat(label.totals().get(NutrientKey.KCAL)).isCloseTo(325.0, within(1e-9));
        assertThat(label.perServing().get(NutrientKey.KCAL)).isCloseTo(162.5, within(1e-9));
        assertThat(label.roundedFda().calories()).isEqualTo(160);
        assertThat(label.perServing().get(NutrientKey.SODIUM_MG)).isCloseTo(75.0, within(1e-9));
        assertThat(label.roundedFda().sodiumMg()).isEqualTo(75);
        assertThat(label.servings()).isEqualTo(2.0);
        assertThat(label.servingWeightG()).isEqualTo(125.0);
    }

    @Test
    void fractional_servings_are_kept_as_is() {
        ComputedLabel label = engine.compute(
                List.of(new NutrientContribution(Map.of(NutrientKey.KCAL, 165.0, NutrientKey.PROTEIN_G, 31.0), 300)),
                1.5, List.of());

        assertThat(label.servings()).isEqualTo(1.5);
        assertThat(label.servingWeightG()).isCloseTo(200.0, within(1e-9));
        assertThat(label.perServing().get(NutrientKey.KCAL)).isCloseTo(330.0, within(1e-9));
        assertThat(label.perServing().get(NutrientKey.PROTEIN_G)).isCloseTo(62.0, within(1e-9));
        assertThat(LabelComputationEngine.servingsOrOne(-2.5)).isEqualTo(1.0);
        assertThat(LabelComputationEngine.servingsOrOne(Double.NaN)).isEqualTo(1.0);
        assertThat(LabelComputationEngine.servingsOrOne(0.5)).isEqualTo(0.5);
    }

    @Test
    void non_positive_servings_are_treated_as_one_and_core_keys_always_present() {
        ComputedLabel label = engine.compute(
                List.of(new NutrientContribution(Map.of(NutrientKey.PROTEIN_G, 20.0), 50)), 0, List.of());

        assertThat(label.servings()).isEqualTo(1.0);
        assertThat(label.perServing()).containsKeys(NutrientKey.CORE.toArray(new NutrientKey[0]));
        assertThat(label.perServing().get(NutrientKey.PROTEIN_G)).isCloseTo(10.0, within(1e-9));
        assertThat(label.perServing().get(NutrientKey.KCAL)).isZero();
    }

    @Test
    void qa_compares_macro_estimate_with_labeled_calories() {
        ComputedLabel ok = engine.compute(List.of(new NutrientContribution(Map.of(
                NutrientKey.KCAL, 160.0, NutrientKey.PROTEIN_G, 10.0, NutrientKey.CARB_G, 20.0, NutrientKey.FAT_G, 5.0), 100)),
                1, List.of());

        assertThat(ok.qa().macroKcal()).isCloseTo(165.0, within(1e-9));
        assertThat(ok.qa().labeledCalories()).isEqualTo(160.0);
        assertThat(ok.qa().delta()).isCloseTo(5.0, within(1e-9));
        assertThat(ok.qa().pass()).isTrue();

        ComputedLabel off = engine.compute(List.of(new NutrientContribution(Map.of(NutrientKey.KCAL, 325.0), 100)),
                2, List.of());
        assertThat(off.qa().pass()).isFalse();
        assertThat(off.qa().delta()).isCloseTo(-160.0, within(1e-9));
    }

    @Test
    void declaration_orders_by_target_grams_and_dedupes_names() {
        List<DeclaredIngredient> ingredients = List.of(
                new DeclaredIngredient("Rice", 100, List.of()),
                new DeclaredIngredient("Chicken", 150, List.of()),
                new DeclaredIngredient("Soy Sauce", 5, List.of("soy", "wheat")),
                new DeclaredIngredient("Butter", 10, List.of("milk", "Milk"))
        );

        ComputedLabel label = engine.compute(List.of(), 1, ingredients);

        assertThat(label.ingredientDeclaration()).isEqualTo("Ingredients: Chicken, Rice, Butter, Soy Sauce");
        assertThat(label.allergenStatement()).isEqualTo("Contains: milk, soy, wheat");
    }

    @Test
    void allergen_statement_without_major_allergens() {
        assertThat(MajorAllergen.statement(List.of("celery", "mustard"))).isEqualTo(MajorAllergen.NONE_STATEMENT);
        assertThat(MajorAllergen.statement(List.of("Tree-Nuts"))).isEqualTo("Contains: tree nuts");
        assertThat(MajorAllergen.fromTagOrNull("  sesame ")).isEqualTo(MajorAllergen.SESAME);
    }

    @Test
    void non_finite_values_and_negative_grams_contribute_nothing() {
        NutrientContribution c = new NutrientContribution(Map.of(NutrientKey.KCAL, Double.NaN, NutrientKey.FAT_G, 4.0), -20);

        assertThat(c.per100g()).containsOnlyKeys(NutrientKey.FAT_G);
        assertThat(c.grams()).isZero();
        assertThat(LabelComputationEngine.totals(List.of(c)).get(NutrientKey.FAT_G)).isZero();
    }
}
