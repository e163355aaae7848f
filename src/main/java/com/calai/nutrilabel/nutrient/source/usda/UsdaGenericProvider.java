package com.calai.nutrilabel.nutrient.source.usda;

import com.calai.nutrilabel.nutrient.model.ProductIdentity;
import com.calai.nutrilabel.nutrient.source.ProviderHit;
import com.calai.nutrilabel.nutrient.source.SourceCandidateProvider;
import com.calai.nutrilabel.nutrient.source.upstream.UpstreamSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * USDA generic：用 ingredient 名稱查（沒有才用產品名稱）
 * ✅ 同一 ingredient group 的產品 query 相同，靠 session 快取只打一次
 */
@Component
@RequiredArgsConstructor
public class UsdaGenericProvider implements SourceCandidateProvider {

    public static final String CODE = "USDA_GENERIC";

    private final UsdaFoodSearch search;

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public Optional<ProviderHit> lookup(ProductIdentity product, UpstreamSession session) {
        String query = product.ingredientName();
        if (query == null || query.isBlank()) query = product.name();
        return search.fetchProfile(session, query, null, false);
    }
}
