package com.calai.nutrilabel.nutrient.source;

import com.calai.nutrilabel.nutrient.model.ProductIdentity;
import com.calai.nutrilabel.nutrient.source.upstream.UpstreamSession;

import java.util.Optional;

/**
 * 外部營養來源（製造商 / USDA branded / USDA generic）
 * ✅ 不往外丟例外：查無、網路錯、被限流一律回 Optional.empty()
 */
public interface SourceCandidateProvider {

    /** 穩定代碼：MANUFACTURER_UPC / USDA_BRANDED / USDA_GENERIC */
    String code();

    Optional<ProviderHit> lookup(ProductIdentity product, UpstreamSession session);
}
