package com.calai.nutrilabel.nutrient.unit;

import com.calai.nutrilabel.nutrient.model.NutrientKey;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 單位正規化 + 換算
 * - normalizeUnit：各種拼法 → g / mg / mcg / kcal / kj / iu（未知原樣回傳，null → ""）
 * - convert：換不了回 empty，不是 0 也不丟例外
 */
public final class NutrientUnits {

    private NutrientUnits() {}

    public static final double KJ_PER_KCAL = 4.184;
    public static final double SODIUM_MG_PER_SALT_G = 393.4;
    public static final double VITAMIN_D_MCG_PER_IU = 0.025;
    public static final double VITAMIN_A_MCG_PER_IU = 0.3;

    private static final Map<String, String> UNIT_ALIAS = Map.ofEntries(
            Map.entry("ug", "mcg"),
            Map.entry("mcg", "mcg"),
            Map.entry("microgram", "mcg"),
            Map.entry("micrograms", "mcg"),
            Map.entry("mg", "mg"),
            Map.entry("milligram", "mg"),
            Map.entry("milligrams", "mg"),
            Map.entry("g", "g"),
            Map.entry("gram", "g"),
            Map.entry("grams", "g"),
            Map.entry("kcal", "kcal"),
            Map.entry("calorie", "kcal"),
            Map.entry("calories", "kcal"),
            Map.entry("kj", "kj"),
            Map.entry("kilojoule", "kj"),
            Map.entry("kilojoules", "kj"),
            Map.entry("iu", "iu")
    );

    // g ↔ mg ↔ mcg 的階梯（以 mcg 為基準）
    private static final Map<String, Double> MASS_IN_MCG = Map.of(
            "g", 1_000_000.0,
            "mg", 1_000.0,
            "mcg", 1.0
    );

    public static String normalizeUnit(String raw) {
        if (raw == null) return "";
        String u = raw.trim().toLowerCase(Locale.ROOT)
                .replace('μ', 'u')   // U+03BC greek mu
                .replace('µ', 'u');  // U+00B5 micro sign
        if (u.isEmpty()) return "";
        return UNIT_ALIAS.getOrDefault(u, u);
    }

    /**
     * 換算到目標單位
     * 1) 目標 kcal：kcal 原樣、kj / 4.184，其餘換不了
     * 2) vitamin D / A 的 IU 特例
     * 3) 只在 g/mg/mcg 之間換算
     */
    public static OptionalDouble convert(double value, String fromUnit, String toUnit, NutrientKey key) {
        if (!Double.isFinite(value)) return OptionalDouble.empty();

        String from = normalizeUnit(fromUnit);
        String to = normalizeUnit(toUnit);

        if ("kcal".equals(to)) {
            if ("kcal".equals(from)) return OptionalDouble.of(value);
            if ("kj".equals(from)) return OptionalDouble.of(value / KJ_PER_KCAL);
            return OptionalDouble.empty();
        }

        if ("iu".equals(from)) {
            if (key == NutrientKey.VITAMIN_D_MCG && "mcg".equals(to)) return OptionalDouble.of(value * VITAMIN_D_MCG_PER_IU);
            if (key == NutrientKey.VITAMIN_A_MCG && "mcg".equals(to)) return OptionalDouble.of(value * VITAMIN_A_MCG_PER_IU);
            return OptionalDouble.empty();
        }

        Double fromFactor = MASS_IN_MCG.get(from);
        Double toFactor = MASS_IN_MCG.get(to);
        if (fromFactor == null || toFactor == null) return OptionalDouble.empty();
        if (from.equals(to)) return OptionalDouble.of(value);
        return OptionalDouble.of(value * fromFactor / toFactor);
    }

    /** 換到 key 的標準單位 */
    public static OptionalDouble toCanonical(double value, String fromUnit, NutrientKey key) {
        return convert(value, fromUnit, key.unit(), key);
    }

    /** 鹽（g）→ 鈉（mg） */
    public static double sodiumMgFromSaltG(double saltG) {
        return saltG * SODIUM_MG_PER_SALT_G;
    }
}
