package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.model.NutrientKey;

import java.util.EnumMap;
import java.util.Map;

import static com.calai.nutrilabel.nutrient.model.NutrientKey.*;

/**
 * per 100g 的物理上限（超過視為來源資料錯誤，候選直接丟掉）
 */
public final class NutrientSanityLimits {

    private NutrientSanityLimits() {}

    public static final double MAX_KCAL_100G = 900.0;
    public static final double MAX_MACRO_G_100G = 100.0;
    public static final double MAX_FIBER_G_100G = 80.0;
    public static final double MAX_CHOLESTEROL_MG_100G = 3_100.0;
    public static final double MAX_SODIUM_MG_100G = 40_000.0;

    private static final Map<NutrientKey, Double> MAX;

    static {
        Map<NutrientKey, Double> m = new EnumMap<>(NutrientKey.class);
        m.put(KCAL, MAX_KCAL_100G);
        m.put(PROTEIN_G, MAX_MACRO_G_100G);
        m.put(FAT_G, MAX_MACRO_G_100G);
        m.put(CARB_G, MAX_MACRO_G_100G);
        m.put(SUGARS_G, MAX_MACRO_G_100G);
        m.put(ADDED_SUGARS_G, MAX_MACRO_G_100G);
        m.put(SAT_FAT_G, MAX_MACRO_G_100G);
        m.put(TRANS_FAT_G, MAX_MACRO_G_100G);
        m.put(FIBER_G, MAX_FIBER_G_100G);
        m.put(CHOLESTEROL_MG, MAX_CHOLESTEROL_MG_100G);
        m.put(SODIUM_MG, MAX_SODIUM_MG_100G);
        MAX = Map.copyOf(m);
    }

    public static boolean withinLimits(NutrientKey key, double value) {
        Double max = MAX.get(key);
        return max == null || value <= max;
    }
}
