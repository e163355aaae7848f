package com.calai.nutrilabel.nutrient.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 單一產品、單次 run 的解析結果：每個 key 最多一個勝出值
 * ✅ 合併規則：key 尚未解析，或候選 confidence「嚴格大於」目前勝出者才換人（同分保留先到者）
 */
public final class ResolvedProfile {

    private final String productId;
    private final EnumMap<NutrientKey, SourceValue> winners = new EnumMap<>(NutrientKey.class);

    public ResolvedProfile(String productId) {
        this.productId = productId;
    }

    public String productId() {
        return productId;
    }

    /**
     * @return true 表示候選成為新的勝出者
     */
    public boolean offer(NutrientKey key, SourceValue candidate) {
        if (key == null || candidate == null) return false;
        SourceValue current = winners.get(key);
        if (current == null || candidate.confidence() > current.confidence()) {
            winners.put(key, candidate);
            return true;
        }
        return false;
    }

    /** 規則覆寫（sanity override）：不比 confidence，直接取代 */
    public void override(NutrientKey key, SourceValue value) {
        winners.put(key, value);
    }

    public boolean isResolved(NutrientKey key) {
        return winners.containsKey(key);
    }

    public Optional<SourceValue> get(NutrientKey key) {
        return Optional.ofNullable(winners.get(key));
    }

    public Map<NutrientKey, SourceValue> values() {
        return Collections.unmodifiableMap(winners);
    }

    public int size() {
        return winners.size();
    }

    /** 非推估（非 INFERRED_*）的已解析 key 數，donor 排序用 */
    public long nonInferredCount() {
        return winners.values().stream().filter(v -> !v.isInferred()).count();
    }

    public boolean hasAllCore() {
        return winners.keySet().containsAll(NutrientKey.CORE);
    }

    @Override
    public String toString() {
        return "ResolvedProfile{productId=" + productId + ", keys=" + winners.keySet() + "}";
    }
}
