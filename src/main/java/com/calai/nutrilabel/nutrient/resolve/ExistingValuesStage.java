package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.model.EvidenceGrade;
import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.ProductIdentity;
import com.calai.nutrilabel.nutrient.model.SourceType;
import com.calai.nutrilabel.nutrient.model.SourceValue;
import com.calai.nutrilabel.nutrient.model.VerificationStatus;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 1：DB 既有、可信的值
 * ✅ 佔位 / 推估 / 歷史例外的列視為「尚未解析」，讓更好的來源可以取代
 */
@Component
public class ExistingValuesStage implements ResolutionStage {

    public static final String NAME = "EXISTING";

    static final List<String> PLACEHOLDER_REF_PREFIXES = List.of(
            "agent:trace-floor-imputation",
            "historical-cleanup:pending-rebuild"
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean readsStoredValues() {
        return true;
    }

    @Override
    public Map<NutrientKey, SourceValue> candidates(ProductIdentity product, ResolutionContext ctx) {
        Map<NutrientKey, SourceValue> out = new EnumMap<>(NutrientKey.class);
        for (ExistingNutrientRow row : ctx.existingRows(product.productId())) {
            if (!isTrusted(row)) continue;
            double confidence = Math.min(1.0, Math.max(row.confidence(), baselineConfidence(row)));
            out.put(row.key(), new SourceValue(
                    row.value(),
                    row.sourceType(),
                    row.sourceRef(),
                    row.evidenceGrade(),
                    confidence,
                    false
            ));
        }
        return out;
    }

    static boolean isTrusted(ExistingNutrientRow row) {
        if (row.value() == null || !Double.isFinite(row.value()) || row.value() < 0) return false;
        if (row.historicalException()) return false;
        if (row.verificationStatus() == VerificationStatus.REJECTED) return false;
        if (row.evidenceGrade() == EvidenceGrade.INFERRED_FROM_SIMILAR_PRODUCT
            || row.evidenceGrade() == EvidenceGrade.HISTORICAL_EXCEPTION) return false;

        String ref = row.sourceRef() == null ? "" : row.sourceRef();
        for (String prefix : PLACEHOLDER_REF_PREFIXES) {
            if (ref.startsWith(prefix)) return false;
        }
        return true;
    }

    /**
     * 依來源給基準 confidence：MANUAL / MANUFACTURER 0.95、USDA 0.82、ingredient 推估 0.55、其餘 0.35
     */
    static double baselineConfidence(ExistingNutrientRow row) {
        SourceType type = row.sourceType();
        if (type == SourceType.MANUAL || type == SourceType.MANUFACTURER) return 0.95;
        if (type == SourceType.USDA) return 0.82;
        if (row.evidenceGrade() == EvidenceGrade.INFERRED_FROM_INGREDIENT) return 0.55;
        return 0.35;
    }
}
