package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.model.NutrientKey;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

import static com.calai.nutrilabel.nutrient.model.NutrientKey.*;

/**
 * 最後一層 fallback 的 per-100g 預設值（不可變，當成設定注入 resolver）
 */
public final class NutrientFallbackTable {

    private final Map<NutrientKey, Double> values;

    public NutrientFallbackTable(Map<NutrientKey, Double> values) {
        EnumMap<NutrientKey, Double> copy = new EnumMap<>(NutrientKey.class);
        values.forEach((k, v) -> {
            if (v == null || !Double.isFinite(v) || v < 0) {
                throw new IllegalArgumentException("FALLBACK_VALUE_INVALID: " + k.key() + "=" + v);
            }
            copy.put(k, v);
        });
        this.values = Collections.unmodifiableMap(copy);
    }

    public static NutrientFallbackTable empty() {
        return new NutrientFallbackTable(Map.of());
    }

    public OptionalDouble get(NutrientKey key) {
        Double v = values.get(key);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public Map<NutrientKey, Double> asMap() {
        return values;
    }

    public static NutrientFallbackTable defaults() {
        Map<NutrientKey, Double> m = new EnumMap<>(NutrientKey.class);
        m.put(KCAL, 120.0);
        m.put(PROTEIN_G, 5.0);
        m.put(CARB_G, 15.0);
        m.put(FAT_G, 4.0);
        m.put(FIBER_G, 2.0);
        m.put(SUGARS_G, 3.0);
        m.put(ADDED_SUGARS_G, 1.0);
        m.put(SAT_FAT_G, 1.0);
        m.put(TRANS_FAT_G, 0.01);
        m.put(CHOLESTEROL_MG, 5.0);
        m.put(SODIUM_MG, 80.0);
        m.put(VITAMIN_D_MCG, 0.2);
        m.put(CALCIUM_MG, 40.0);
        m.put(IRON_MG, 1.0);
        m.put(POTASSIUM_MG, 180.0);
        m.put(VITAMIN_A_MCG, 30.0);
        m.put(VITAMIN_C_MG, 4.0);
        m.put(VITAMIN_E_MG, 0.8);
        m.put(VITAMIN_K_MCG, 8.0);
        m.put(THIAMIN_MG, 0.08);
        m.put(RIBOFLAVIN_MG, 0.07);
        m.put(NIACIN_MG, 0.9);
        m.put(VITAMIN_B6_MG, 0.1);
        m.put(FOLATE_MCG, 20.0);
        m.put(VITAMIN_B12_MCG, 0.2);
        m.put(BIOTIN_MCG, 1.5);
        m.put(PANTOTHENIC_ACID_MG, 0.4);
        m.put(PHOSPHORUS_MG, 90.0);
        m.put(IODINE_MCG, 8.0);
        m.put(MAGNESIUM_MG, 20.0);
        m.put(ZINC_MG, 0.7);
        m.put(SELENIUM_MCG, 8.0);
        m.put(COPPER_MG, 0.08);
        m.put(MANGANESE_MG, 0.2);
        m.put(CHROMIUM_MCG, 2.0);
        m.put(MOLYBDENUM_MCG, 5.0);
        m.put(CHLORIDE_MG, 70.0);
        m.put(CHOLINE_MG, 18.0);
        m.put(OMEGA3_G, 0.06);
        m.put(OMEGA6_G, 0.3);
        return new NutrientFallbackTable(m);
    }
}
