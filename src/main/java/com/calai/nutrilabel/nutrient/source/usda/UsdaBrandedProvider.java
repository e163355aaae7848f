package com.calai.nutrilabel.nutrient.source.usda;

import com.calai.nutrilabel.nutrient.model.ProductIdentity;
import com.calai.nutrilabel.nutrient.source.ProviderHit;
import com.calai.nutrilabel.nutrient.source.SourceCandidateProvider;
import com.calai.nutrilabel.nutrient.source.UpcCodes;
import com.calai.nutrilabel.nutrient.source.upstream.UpstreamSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * USDA branded：只有在產品有有效 UPC 時才查
 * query = 品牌 + 產品名稱
 */
@Component
@RequiredArgsConstructor
public class UsdaBrandedProvider implements SourceCandidateProvider {

    public static final String CODE = "USDA_BRANDED";

    private final UsdaFoodSearch search;

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public Optional<ProviderHit> lookup(ProductIdentity product, UpstreamSession session) {
        String upc = UpcCodes.normalizeOrNull(product.upc());
        if (upc == null) return Optional.empty();

        String query = ((product.brand() == null ? "" : product.brand() + " ")
                        + (product.name() == null ? "" : product.name())).trim();
        return search.fetchProfile(session, query, upc, true);
    }
}
