package com.calai.nutrilabel.nutrient.source.usda;

import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.source.JsonNumbers;
import com.calai.nutrilabel.nutrient.source.ProviderHit;
import com.calai.nutrilabel.nutrient.source.UpcCodes;
import com.calai.nutrilabel.nutrient.source.upstream.Upstream;
import com.calai.nutrilabel.nutrient.source.upstream.UpstreamSession;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * USDA 選食物 + 取明細（branded / generic 兩個 provider 共用）
 * - 有 UPC：先用 UPC 搜 Branded，gtinUpc 完全相同優先，否則取第一筆
 * - 再用文字 query 搜，交給 {@link UsdaFoodRanker} 排序
 */
@Component
@RequiredArgsConstructor
public class UsdaFoodSearch {

    private final UsdaFoodDataClient client;
    private final UsdaProperties props;

    record Match(JsonNode food, boolean exactUpc) {}

    public Optional<ProviderHit> fetchProfile(UpstreamSession session, String query, String upc, boolean preferBranded) {
        Optional<Match> match = pickFood(session, query, upc, preferBranded);
        if (match.isEmpty()) return Optional.empty();

        JsonNode food = match.get().food();
        JsonNode idNode = food.path("fdcId");
        if (!idNode.canConvertToLong()) return Optional.empty();
        long fdcId = idNode.asLong();

        Optional<JsonNode> detail = session.fetch(Upstream.USDA_FDC, "food:" + fdcId, () -> client.food(fdcId));
        if (detail.isEmpty()) return Optional.empty();

        Map<NutrientKey, Double> values = UsdaNutrientMapper.map(detail.get());
        if (values.isEmpty()) return Optional.empty();

        String dataType = JsonNumbers.textOrNull(food, "dataType");
        boolean preferredType = preferBranded
                ? "Branded".equals(dataType)
                : ("Foundation".equals(dataType) || "SR Legacy".equals(dataType));

        return Optional.of(new ProviderHit(values, UsdaNutrientMapper.sourceRef(fdcId), match.get().exactUpc(), preferredType));
    }

    Optional<Match> pickFood(UpstreamSession session, String query, String upc, boolean preferBranded) {
        String normalizedUpc = UpcCodes.normalizeOrNull(upc);

        if (normalizedUpc != null) {
            List<JsonNode> foods = search(session, new UsdaSearchQuery(
                    normalizedUpc, props.upcPageSizeOrDefault(), UsdaSearchQuery.BRANDED_ONLY, true));
            for (JsonNode f : foods) {
                if (normalizedUpc.equals(UpcCodes.normalizeOrNull(JsonNumbers.textOrNull(f, "gtinUpc")))) {
                    return Optional.of(new Match(f, true));
                }
            }
            if (!foods.isEmpty()) return Optional.of(new Match(foods.get(0), false));
        }

        if (query == null || query.isBlank()) return Optional.empty();

        List<JsonNode> foods = search(session, new UsdaSearchQuery(
                query.trim(),
                props.queryPageSizeOrDefault(),
                preferBranded ? UsdaSearchQuery.BRANDED_FIRST : UsdaSearchQuery.GENERIC_FIRST,
                false));

        return UsdaFoodRanker.pickBest(foods, query, normalizedUpc, preferBranded)
                .map(f -> new Match(f, normalizedUpc != null
                        && normalizedUpc.equals(UpcCodes.normalizeOrNull(JsonNumbers.textOrNull(f, "gtinUpc")))));
    }

    private List<JsonNode> search(UpstreamSession session, UsdaSearchQuery q) {
        List<JsonNode> out = new ArrayList<>();
        session.fetch(Upstream.USDA_FDC, q.cacheKey(), () -> client.search(q))
                .map(root -> root.path("foods"))
                .filter(JsonNode::isArray)
                .ifPresent(arr -> arr.forEach(out::add));
        return out;
    }
}
