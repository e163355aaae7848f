package com.calai.nutrilabel.nutrient.source.off;

import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.ProductIdentity;
import com.calai.nutrilabel.nutrient.source.ProviderHit;
import com.calai.nutrilabel.nutrient.source.SourceCandidateProvider;
import com.calai.nutrilabel.nutrient.source.UpcCodes;
import com.calai.nutrilabel.nutrient.source.upstream.Upstream;
import com.calai.nutrilabel.nutrient.source.upstream.UpstreamSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * 製造商資料（OpenFoodFacts）依 UPC 查詢
 */
@Component
@RequiredArgsConstructor
public class ManufacturerUpcProvider implements SourceCandidateProvider {

    public static final String CODE = "MANUFACTURER_UPC";

    private final OpenFoodFactsClient client;

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public Optional<ProviderHit> lookup(ProductIdentity product, UpstreamSession session) {
        String upc = UpcCodes.normalizeOrNull(product.upc());
        if (upc == null) return Optional.empty();

        return session.fetch(Upstream.OPEN_FOOD_FACTS, "upc:" + upc, () -> client.getProduct(upc))
                .map(OpenFoodFactsNutrientMapper::map)
                .filter(values -> !values.isEmpty())
                .map(values -> hit(values, upc));
    }

    private static ProviderHit hit(Map<NutrientKey, Double> values, String upc) {
        // 製造商資料一定是 UPC 精準對應
        return new ProviderHit(values, OpenFoodFactsNutrientMapper.sourceRef(upc), true, false);
    }
}
