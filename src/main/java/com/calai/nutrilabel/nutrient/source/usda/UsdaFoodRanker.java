package com.calai.nutrilabel.nutrient.source.usda;

import com.calai.nutrilabel.nutrient.source.JsonNumbers;
import com.calai.nutrilabel.nutrient.source.UpcCodes;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * USDA 搜尋結果排序
 * - 每個重疊 token +1.2
 * - UPC 完全相同 +10
 * - 偏好 branded 且 dataType=Branded +2；偏好 generic 且 Foundation / SR Legacy +1.2
 * - 品牌字串出現在 query 內 +1
 * ✅ 同分保留 API 原順序（List.sort 是 stable）
 */
public final class UsdaFoodRanker {

    private UsdaFoodRanker() {}

    static final double TOKEN_WEIGHT = 1.2;
    static final double EXACT_UPC_BONUS = 10.0;
    static final double BRANDED_PREFERENCE_BONUS = 2.0;
    static final double GENERIC_PREFERENCE_BONUS = 1.2;
    static final double BRAND_IN_QUERY_BONUS = 1.0;

    public record Ranked(JsonNode food, double score) {}

    public static Optional<JsonNode> pickBest(List<JsonNode> foods, String query, String upc, boolean preferBranded) {
        return rank(foods, query, upc, preferBranded).stream().findFirst().map(Ranked::food);
    }

    public static List<Ranked> rank(List<JsonNode> foods, String query, String upc, boolean preferBranded) {
        String q = normalizeText(query);
        Set<String> qTokens = tokens(q);

        List<Ranked> out = new ArrayList<>();
        for (JsonNode f : foods) {
            out.add(new Ranked(f, score(f, q, qTokens, upc, preferBranded)));
        }
        out.sort(Comparator.comparingDouble(Ranked::score).reversed());
        return out;
    }

    static double score(JsonNode food, String q, Set<String> qTokens, String upc, boolean preferBranded) {
        String desc = normalizeText(JsonNumbers.textOrNull(food, "description"));
        String brandRaw = JsonNumbers.textOrNull(food, "brandOwner");
        if (brandRaw == null) brandRaw = JsonNumbers.textOrNull(food, "brandName");
        String brand = normalizeText(brandRaw);
        String dataType = JsonNumbers.textOrNull(food, "dataType");

        double points = 0.0;
        if (!desc.isEmpty()) {
            Set<String> descTokens = tokens(desc);
            long overlap = qTokens.stream().filter(descTokens::contains).count();
            points += overlap * TOKEN_WEIGHT;
        }
        if (upc != null && upc.equals(UpcCodes.normalizeOrNull(JsonNumbers.textOrNull(food, "gtinUpc")))) {
            points += EXACT_UPC_BONUS;
        }
        if (preferBranded && "Branded".equals(dataType)) {
            points += BRANDED_PREFERENCE_BONUS;
        }
        if (!preferBranded && ("Foundation".equals(dataType) || "SR Legacy".equals(dataType))) {
            points += GENERIC_PREFERENCE_BONUS;
        }
        if (!brand.isEmpty() && q.contains(brand)) {
            points += BRAND_IN_QUERY_BONUS;
        }
        return points;
    }

    /** 小寫，非英數字換成空白，壓縮空白 */
    public static String normalizeText(String raw) {
        if (raw == null) return "";
        return raw.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", " ")
                .trim();
    }

    private static Set<String> tokens(String normalized) {
        if (normalized.isEmpty()) return Set.of();
        return new HashSet<>(Arrays.asList(normalized.split(" ")));
    }
}
