package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.model.EvidenceGrade;
import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.ProductIdentity;
import com.calai.nutrilabel.nutrient.model.SourceType;
import com.calai.nutrilabel.nutrient.model.SourceValue;
import com.calai.nutrilabel.nutrient.source.ProviderHit;
import com.calai.nutrilabel.nutrient.source.SourceCandidateProvider;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Stage 2~4：外部來源 → 候選（統一蓋上 sourceType / grade / confidence）
 */
public final class RemoteSourceStage implements ResolutionStage {

    private final SourceCandidateProvider provider;
    private final SourceType sourceType;
    private final EvidenceGrade grade;
    private final ToDoubleFunction<ProviderHit> confidence;

    public RemoteSourceStage(SourceCandidateProvider provider,
                             SourceType sourceType,
                             EvidenceGrade grade,
                             ToDoubleFunction<ProviderHit> confidence) {
        this.provider = provider;
        this.sourceType = sourceType;
        this.grade = grade;
        this.confidence = confidence;
    }

    /** 製造商：核心 5 項有 4 項以上 0.96，否則 0.84 */
    public static RemoteSourceStage manufacturer(SourceCandidateProvider provider) {
        return new RemoteSourceStage(provider, SourceType.MANUFACTURER, EvidenceGrade.OPENFOODFACTS,
                hit -> hit.coreCount() >= 4 ? 0.96 : 0.84);
    }

    /** USDA branded：UPC 完全相同 0.9，否則 0.8 */
    public static RemoteSourceStage usdaBranded(SourceCandidateProvider provider) {
        return new RemoteSourceStage(provider, SourceType.USDA, EvidenceGrade.USDA_BRANDED,
                hit -> hit.exactUpcMatch() ? 0.9 : 0.8);
    }

    /** USDA generic：Foundation / SR Legacy 0.82，否則 0.7 */
    public static RemoteSourceStage usdaGeneric(SourceCandidateProvider provider) {
        return new RemoteSourceStage(provider, SourceType.USDA, EvidenceGrade.USDA_GENERIC,
                hit -> hit.preferredDataType() ? 0.82 : 0.7);
    }

    @Override
    public String name() {
        return provider.code();
    }

    @Override
    public Map<NutrientKey, SourceValue> candidates(ProductIdentity product, ResolutionContext ctx) {
        Map<NutrientKey, SourceValue> out = new EnumMap<>(NutrientKey.class);
        Optional<ProviderHit> hit = provider.lookup(product, ctx.session());
        if (hit.isEmpty() || hit.get().isEmpty()) return out;

        double c = confidence.applyAsDouble(hit.get());
        String ref = hit.get().sourceRef();
        hit.get().values().forEach((key, value) -> {
            if (value == null || !Double.isFinite(value) || value < 0) return;
            out.put(key, SourceValue.of(value, sourceType, ref, grade, c));
        });
        return out;
    }
}
