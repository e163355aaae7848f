package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.ProductIdentity;
import com.calai.nutrilabel.nutrient.model.SourceValue;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * 測試用 stage：productId → 固定候選
 */
class FixedStage implements ResolutionStage {

    private final String name;
    private final boolean stored;
    private final Map<String, Map<NutrientKey, SourceValue>> byProduct = new HashMap<>();

    FixedStage(String name, boolean stored) {
        this.name = name;
        this.stored = stored;
    }

    FixedStage put(String productId, NutrientKey key, SourceValue v) {
        byProduct.computeIfAbsent(productId, k -> new EnumMap<>(NutrientKey.class)).put(key, v);
        return this;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean readsStoredValues() {
        return stored;
    }

    @Override
    public Map<NutrientKey, SourceValue> candidates(ProductIdentity product, ResolutionContext ctx) {
        return byProduct.getOrDefault(product.productId(), Map.of());
    }
}
