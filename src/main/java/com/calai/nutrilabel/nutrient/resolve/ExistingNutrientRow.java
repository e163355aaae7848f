package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.entity.ProductNutrientValueEntity;
import com.calai.nutrilabel.nutrient.model.EvidenceGrade;
import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.SourceType;
import com.calai.nutrilabel.nutrient.model.VerificationStatus;

/**
 * DB 既有值的唯讀快照（run 開始時一次載入）
 */
public record ExistingNutrientRow(
        NutrientKey key,
        Double value,
        SourceType sourceType,
        String sourceRef,
        EvidenceGrade evidenceGrade,
        VerificationStatus verificationStatus,
        double confidence,
        boolean historicalException
) {
    /** 未知 key 回 null */
    public static ExistingNutrientRow fromEntity(ProductNutrientValueEntity e) {
        NutrientKey key = NutrientKey.fromKeyOrNull(e.getNutrientKey());
        if (key == null) return null;
        return new ExistingNutrientRow(
                key,
                e.getValuePer100g(),
                e.getSourceType(),
                e.getSourceRef(),
                e.getEvidenceGrade(),
                e.getVerificationStatus(),
                e.getConfidenceScore(),
                e.isHistoricalException()
        );
    }
}
