package com.calai.nutrilabel.nutrient.source.usda;

import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.source.JsonNumbers;
import com.calai.nutrilabel.nutrient.unit.NutrientUnits;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

import static com.calai.nutrilabel.nutrient.model.NutrientKey.*;

/**
 * USDA foodNutrients → 標準單位 per-100g
 * 1) 先看 nutrient number
 * 2) 再用名稱 pattern
 * 3) omega-3 / omega-6 沒有總量時，用脂肪酸分項加總
 */
public final class UsdaNutrientMapper {

    private UsdaNutrientMapper() {}

    static final Map<String, NutrientKey> NUMBER_TO_KEY = Map.ofEntries(
            Map.entry("208", KCAL),
            Map.entry("1008", KCAL),
            Map.entry("203", PROTEIN_G),
            Map.entry("205", CARB_G),
            Map.entry("204", FAT_G),
            Map.entry("291", FIBER_G),
            Map.entry("269", SUGARS_G),
            Map.entry("539", ADDED_SUGARS_G),
            Map.entry("606", SAT_FAT_G),
            Map.entry("605", TRANS_FAT_G),
            Map.entry("601", CHOLESTEROL_MG),
            Map.entry("307", SODIUM_MG),
            Map.entry("324", VITAMIN_D_MCG),
            Map.entry("301", CALCIUM_MG),
            Map.entry("303", IRON_MG),
            Map.entry("306", POTASSIUM_MG),
            Map.entry("320", VITAMIN_A_MCG),
            Map.entry("401", VITAMIN_C_MG),
            Map.entry("323", VITAMIN_E_MG),
            Map.entry("430", VITAMIN_K_MCG),
            Map.entry("404", THIAMIN_MG),
            Map.entry("405", RIBOFLAVIN_MG),
            Map.entry("406", NIACIN_MG),
            Map.entry("415", VITAMIN_B6_MG),
            Map.entry("417", FOLATE_MCG),
            Map.entry("418", VITAMIN_B12_MCG),
            Map.entry("416", BIOTIN_MCG),
            Map.entry("410", PANTOTHENIC_ACID_MG),
            Map.entry("305", PHOSPHORUS_MG),
            Map.entry("353", IODINE_MCG),
            Map.entry("304", MAGNESIUM_MG),
            Map.entry("309", ZINC_MG),
            Map.entry("317", SELENIUM_MCG),
            Map.entry("312", COPPER_MG),
            Map.entry("315", MANGANESE_MG),
            Map.entry("334", CHROMIUM_MCG),
            Map.entry("341", MOLYBDENUM_MCG),
            Map.entry("313", CHLORIDE_MG),
            Map.entry("421", CHOLINE_MG)
    );

    private record NamePattern(Pattern pattern, NutrientKey key) {}

    // ⚠️ 有順序：第一個命中的為準
    private static final List<NamePattern> NAME_TO_KEY = List.of(
            np("^protein$", PROTEIN_G),
            np("carbohydrate, by difference", CARB_G),
            np("total lipid \\(fat\\)", FAT_G),
            np("fiber, total dietary", FIBER_G),
            np("sugars, total", SUGARS_G),
            np("sugars, added", ADDED_SUGARS_G),
            np("fatty acids, total saturated", SAT_FAT_G),
            np("fatty acids, total trans", TRANS_FAT_G),
            np("^cholesterol", CHOLESTEROL_MG),
            np("^sodium, na", SODIUM_MG),
            np("vitamin d", VITAMIN_D_MCG),
            np("^calcium, ca", CALCIUM_MG),
            np("^iron, fe", IRON_MG),
            np("^potassium, k", POTASSIUM_MG),
            np("vitamin a, rae", VITAMIN_A_MCG),
            np("vitamin c", VITAMIN_C_MG),
            np("vitamin e", VITAMIN_E_MG),
            np("vitamin k", VITAMIN_K_MCG),
            np("^thiamin", THIAMIN_MG),
            np("^riboflavin", RIBOFLAVIN_MG),
            np("^niacin", NIACIN_MG),
            np("vitamin b-?6", VITAMIN_B6_MG),
            np("^folate, total", FOLATE_MCG),
            np("vitamin b-?12", VITAMIN_B12_MCG),
            np("^biotin", BIOTIN_MCG),
            np("pantothenic acid", PANTOTHENIC_ACID_MG),
            np("^phosphorus, p", PHOSPHORUS_MG),
            np("^iodine, i", IODINE_MCG),
            np("^magnesium, mg", MAGNESIUM_MG),
            np("^zinc, zn", ZINC_MG),
            np("^selenium, se", SELENIUM_MCG),
            np("^copper, cu", COPPER_MG),
            np("^manganese, mn", MANGANESE_MG),
            np("^chromium, cr", CHROMIUM_MCG),
            np("^molybdenum, mo", MOLYBDENUM_MCG),
            np("^chloride, cl", CHLORIDE_MG),
            np("^choline, total", CHOLINE_MG),
            np("omega-3", OMEGA3_G),
            np("omega-6", OMEGA6_G)
    );

    private static final List<Pattern> OMEGA3_COMPONENTS = List.of(
            Pattern.compile("18:3 n-3"),
            Pattern.compile("18:4"),
            Pattern.compile("20:5 n-3"),
            Pattern.compile("22:5 n-3"),
            Pattern.compile("22:6 n-3")
    );

    private static final List<Pattern> OMEGA6_COMPONENTS = List.of(
            Pattern.compile("18:2 n-6"),
            Pattern.compile("18:3 n-6"),
            Pattern.compile("20:2 n-6"),
            Pattern.compile("20:3 n-6"),
            Pattern.compile("20:4 n-6"),
            Pattern.compile("22:2 n-6")
    );

    public static Map<NutrientKey, Double> map(JsonNode detail) {
        Map<NutrientKey, Double> out = new EnumMap<>(NutrientKey.class);
        if (detail == null || detail.isNull()) return out;

        JsonNode rows = detail.path("foodNutrients");
        if (!rows.isArray()) return out;

        double omega3Sum = 0.0;
        double omega6Sum = 0.0;

        for (JsonNode row : rows) {
            JsonNode nutrient = row.path("nutrient");
            String number = firstNonBlank(JsonNumbers.textOrNull(nutrient, "number"), JsonNumbers.textOrNull(row, "nutrientNumber"));
            String name = firstNonBlank(JsonNumbers.textOrNull(nutrient, "name"), JsonNumbers.textOrNull(row, "nutrientName"));
            String unit = firstNonBlank(JsonNumbers.textOrNull(nutrient, "unitName"), JsonNumbers.textOrNull(row, "unitName"));
            name = name == null ? "" : name.toLowerCase(Locale.ROOT);

            Double amount = JsonNumbers.numberOrNull(row, "amount");
            if (amount == null) amount = JsonNumbers.numberOrNull(row, "value");
            if (amount == null) continue;

            if (matchesAny(OMEGA3_COMPONENTS, name)) {
                omega3Sum += nonNegative(NutrientUnits.convert(amount, unit, "g", OMEGA3_G));
            }
            if (matchesAny(OMEGA6_COMPONENTS, name)) {
                omega6Sum += nonNegative(NutrientUnits.convert(amount, unit, "g", OMEGA6_G));
            }

            NutrientKey key = keyFor(number, name);
            if (key == null) continue;

            OptionalDouble converted = NutrientUnits.toCanonical(amount, unit, key);
            if (converted.isEmpty() || converted.getAsDouble() < 0) continue;

            // ✅ 同時有 kcal / kJ：明確的 kcal 列優先
            if (key == KCAL && "kcal".equals(NutrientUnits.normalizeUnit(unit))) {
                out.put(key, converted.getAsDouble());
                continue;
            }
            out.putIfAbsent(key, converted.getAsDouble());
        }

        if (omega3Sum > 0) out.putIfAbsent(OMEGA3_G, omega3Sum);
        if (omega6Sum > 0) out.putIfAbsent(OMEGA6_G, omega6Sum);

        return out;
    }

    public static String sourceRef(long fdcId) {
        return "https://fdc.nal.usda.gov/fdc-app.html#/food-details/" + fdcId + "/nutrients";
    }

    private static NutrientKey keyFor(String number, String name) {
        if (number != null) {
            NutrientKey byNumber = NUMBER_TO_KEY.get(number.trim());
            if (byNumber != null) return byNumber;
        }
        for (NamePattern p : NAME_TO_KEY) {
            if (p.pattern().matcher(name).find()) return p.key();
        }
        return null;
    }

    private static boolean matchesAny(List<Pattern> patterns, String name) {
        for (Pattern p : patterns) {
            if (p.matcher(name).find()) return true;
        }
        return false;
    }

    private static double nonNegative(OptionalDouble v) {
        return (v.isPresent() && v.getAsDouble() >= 0) ? v.getAsDouble() : 0.0;
    }

    private static String firstNonBlank(String a, String b) {
        return a != null ? a : b;
    }

    private static NamePattern np(String regex, NutrientKey key) {
        return new NamePattern(Pattern.compile(regex), key);
    }
}
