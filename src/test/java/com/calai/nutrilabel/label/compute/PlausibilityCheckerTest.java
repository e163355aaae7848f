package com.calai.nutrilabel.label.compute;

import com.calai.nutrilabel.nutrient.model.NutrientKey;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PlausibilityCheckerTest {

    private final PlausibilityChecker checker = new PlausibilityChecker();

    private static Map<NutrientKey, Double> serving(double kcal, double protein, double carb, double fat) {
        Map<NutrientKey, Double> m = new EnumMap<>(NutrientKey.class);
        m.put(NutrientKey.KCAL, kcal);
        m.put(NutrientKey.PROTEIN_G, protein);
        m.put(NutrientKey.CARB_G, carb);
        m.put(NutrientKey.FAT_G, fat);
        return m;
    }

    @Test
    void consistent_serving_is_valid() {
        PlausibilityChecker.Report r = checker.check(serving(165, 10, 20, 5));

        assertThat(r.valid()).isTrue();
        assertThat(r.issues()).isEmpty();
    }

    @Test
    void subset_exceeding_parent_beyond_tolerance_is_error() {
        Map<NutrientKey, Double> m = serving(165, 10, 20, 5);
        m.put(NutrientKey.SAT_FAT_G, 5.6);
        m.put(NutrientKey.SUGARS_G, 20.4);
        m.put(NutrientKey.ADDED_SUGARS_G, 21.0);
        m.put(NutrientKey.FIBER_G, 21.0);

        PlausibilityChecker.Report r = checker.check(m);

        assertThat(r.valid()).isFalse();
        assertThat(r.errorCount()).isEqualTo(3);
        assertThat(r.issues()).extracting(PlausibilityChecker.Issue::rule)
                .containsExactly("SAT_FAT_EXCEEDS_FAT", "ADDED_SUGARS_EXCEED_SUGARS", "FIBER_EXCEEDS_CARB");
    }

    @Test
    void energy_mismatch_is_only_a_warning() {
        PlausibilityChecker.Report r = checker.check(serving(300, 10, 20, 5));

        assertThat(r.valid()).isTrue();
        assertThat(r.warningCount()).isEqualTo(1);
        assertThat(r.issues().get(0).rule()).isEqualTo("ENERGY_MACRO_MISMATCH");
        assertThat(r.issues().get(0).severity()).isEqualTo(PlausibilityChecker.Severity.WARNING);
    }

    @Test
    void low_energy_servings_skip_energy_check() {
        PlausibilityChecker.Report r = checker.check(serving(15, 0, 0, 0));

        assertThat(r.issues()).isEmpty();
    }
}
