package com.calai.nutrilabel.nutrient.source.off;

import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.source.JsonNumbers;
import com.calai.nutrilabel.nutrient.unit.NutrientUnits;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

import static com.calai.nutrilabel.nutrient.model.NutrientKey.*;

/**
 * OFF nutriments（*_100g）→ 標準單位的 per-100g 值
 * - 單位看 {field}_unit，沒有就當作 key 的標準單位
 * - 沒 sodium 但有 salt：sodium_mg = salt_g × 393.4
 * - 沒 kcal 但有 kJ：kcal = kJ / 4.184
 */
public final class OpenFoodFactsNutrientMapper {

    private OpenFoodFactsNutrientMapper() {}

    static final Map<String, NutrientKey> FIELD_TO_KEY;

    static {
        Map<String, NutrientKey> m = new LinkedHashMap<>();
        m.put("energy-kcal_100g", KCAL);
        m.put("proteins_100g", PROTEIN_G);
        m.put("carbohydrates_100g", CARB_G);
        m.put("fat_100g", FAT_G);
        m.put("fiber_100g", FIBER_G);
        m.put("sugars_100g", SUGARS_G);
        m.put("added-sugars_100g", ADDED_SUGARS_G);
        m.put("saturated-fat_100g", SAT_FAT_G);
        m.put("trans-fat_100g", TRANS_FAT_G);
        m.put("cholesterol_100g", CHOLESTEROL_MG);
        m.put("sodium_100g", SODIUM_MG);
        m.put("vitamin-d_100g", VITAMIN_D_MCG);
        m.put("calcium_100g", CALCIUM_MG);
        m.put("iron_100g", IRON_MG);
        m.put("potassium_100g", POTASSIUM_MG);
        m.put("vitamin-a_100g", VITAMIN_A_MCG);
        m.put("vitamin-c_100g", VITAMIN_C_MG);
        m.put("vitamin-e_100g", VITAMIN_E_MG);
        m.put("vitamin-k_100g", VITAMIN_K_MCG);
        m.put("vitamin-b1_100g", THIAMIN_MG);
        m.put("vitamin-b2_100g", RIBOFLAVIN_MG);
        m.put("vitamin-pp_100g", NIACIN_MG);
        m.put("vitamin-b6_100g", VITAMIN_B6_MG);
        m.put("folates_100g", FOLATE_MCG);
        m.put("vitamin-b12_100g", VITAMIN_B12_MCG);
        m.put("biotin_100g", BIOTIN_MCG);
        m.put("pantothenic-acid_100g", PANTOTHENIC_ACID_MG);
        m.put("phosphorus_100g", PHOSPHORUS_MG);
        m.put("iodine_100g", IODINE_MCG);
        m.put("magnesium_100g", MAGNESIUM_MG);
        m.put("zinc_100g", ZINC_MG);
        m.put("selenium_100g", SELENIUM_MCG);
        m.put("copper_100g", COPPER_MG);
        m.put("manganese_100g", MANGANESE_MG);
        m.put("chromium_100g", CHROMIUM_MCG);
        m.put("molybdenum_100g", MOLYBDENUM_MCG);
        m.put("chloride_100g", CHLORIDE_MG);
        m.put("choline_100g", CHOLINE_MG);
        m.put("omega-3-fat_100g", OMEGA3_G);
        m.put("omega-6-fat_100g", OMEGA6_G);
        FIELD_TO_KEY = Map.copyOf(m);
    }

    /**
     * @return status != 1 或沒有 nutriments 時回空 map
     */
    public static Map<NutrientKey, Double> map(JsonNode root) {
        Map<NutrientKey, Double> out = new EnumMap<>(NutrientKey.class);
        if (root == null || root.isNull()) return out;
        if (root.path("status").asInt(0) != 1) return out;

        JsonNode nutr = root.path("product").path("nutriments");
        if (!nutr.isObject()) return out;

        for (Map.Entry<String, NutrientKey> e : FIELD_TO_KEY.entrySet()) {
            String field = e.getKey();
            NutrientKey key = e.getValue();

            Double raw = JsonNumbers.numberOrNull(nutr, field);
            if (raw == null || raw < 0) continue;

            String unit = JsonNumbers.textOrNull(nutr, field.replace("_100g", "_unit"));
            OptionalDouble converted = NutrientUnits.toCanonical(raw, unit == null ? key.unit() : unit, key);
            if (converted.isPresent()) out.put(key, converted.getAsDouble());
        }

        if (!out.containsKey(SODIUM_MG)) {
            Double salt = JsonNumbers.numberOrNull(nutr, "salt_100g");
            if (salt != null && salt >= 0) {
                String saltUnit = JsonNumbers.textOrNull(nutr, "salt_unit");
                NutrientUnits.convert(salt, saltUnit == null ? "g" : saltUnit, "g", null)
                        .ifPresent(saltG -> out.put(SODIUM_MG, NutrientUnits.sodiumMgFromSaltG(saltG)));
            }
        }

        if (!out.containsKey(KCAL)) {
            Double kj = JsonNumbers.numberOrNull(nutr, "energy-kj_100g");
            if (kj != null && kj >= 0) out.put(KCAL, kj / NutrientUnits.KJ_PER_KCAL);
        }

        return out;
    }

    public static String sourceRef(String upc) {
        return "https://world.openfoodfacts.org/product/" + upc;
    }
}
