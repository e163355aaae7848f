package com.calai.nutrilabel.nutrient.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 固定的營養素 key 清單（封閉集合）
 * - key：對外 / DB 使用的字串（例如 sodium_mg）
 * - unit：唯一的標準單位（由 key 的後綴決定，kcal 例外）
 */
public enum NutrientKey {

    KCAL("kcal"),
    PROTEIN_G("protein_g"),
    CARB_G("carb_g"),
    FAT_G("fat_g"),
    FIBER_G("fiber_g"),
    SUGARS_G("sugars_g"),
    ADDED_SUGARS_G("added_sugars_g"),
    SAT_FAT_G("sat_fat_g"),
    TRANS_FAT_G("trans_fat_g"),
    CHOLESTEROL_MG("cholesterol_mg"),
    SODIUM_MG("sodium_mg"),
    VITAMIN_D_MCG("vitamin_d_mcg"),
    CALCIUM_MG("calcium_mg"),
    IRON_MG("iron_mg"),
    POTASSIUM_MG("potassium_mg"),
    VITAMIN_A_MCG("vitamin_a_mcg"),
    VITAMIN_C_MG("vitamin_c_mg"),
    VITAMIN_E_MG("vitamin_e_mg"),
    VITAMIN_K_MCG("vitamin_k_mcg"),
    THIAMIN_MG("thiamin_mg"),
    RIBOFLAVIN_MG("riboflavin_mg"),
    NIACIN_MG("niacin_mg"),
    VITAMIN_B6_MG("vitamin_b6_mg"),
    FOLATE_MCG("folate_mcg"),
    VITAMIN_B12_MCG("vitamin_b12_mcg"),
    BIOTIN_MCG("biotin_mcg"),
    PANTOTHENIC_ACID_MG("pantothenic_acid_mg"),
    PHOSPHORUS_MG("phosphorus_mg"),
    IODINE_MCG("iodine_mcg"),
    MAGNESIUM_MG("magnesium_mg"),
    ZINC_MG("zinc_mg"),
    SELENIUM_MCG("selenium_mcg"),
    COPPER_MG("copper_mg"),
    MANGANESE_MG("manganese_mg"),
    CHROMIUM_MCG("chromium_mcg"),
    MOLYBDENUM_MCG("molybdenum_mcg"),
    CHLORIDE_MG("chloride_mg"),
    CHOLINE_MG("choline_mg"),
    OMEGA3_G("omega3_g"),
    OMEGA6_G("omega6_g");

    /** ✅ label / 缺漏判斷用的核心 key */
    public static final Set<NutrientKey> CORE = Set.copyOf(EnumSet.of(KCAL, PROTEIN_G, CARB_G, FAT_G, SODIUM_MG));

    /** 碳水家族：動物蛋白 sanity rule 會強制歸零 */
    public static final Set<NutrientKey> CARB_FAMILY =
            Set.copyOf(EnumSet.of(CARB_G, FIBER_G, SUGARS_G, ADDED_SUGARS_G));

    private static final Map<String, NutrientKey> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(NutrientKey::key, Function.identity()));

    private final String key;
    private final String unit;

    NutrientKey(String key) {
        this.key = key;
        this.unit = unitOf(key);
    }

    public String key() {
        return key;
    }

    /** g / mg / mcg / kcal */
    public String unit() {
        return unit;
    }

    public boolean isCore() {
        return CORE.contains(this);
    }

    /**
     * 寬鬆解析：未知 key 回 null（DB 裡可能有舊 key）
     */
    public static NutrientKey fromKeyOrNull(String raw) {
        if (raw == null) return null;
        return BY_KEY.get(raw.trim().toLowerCase());
    }

    private static String unitOf(String key) {
        if ("kcal".equals(key)) return "kcal";
        if (key.endsWith("_mcg")) return "mcg";
        if (key.endsWith("_mg")) return "mg";
        return "g";
    }
}
