package com.calai.nutrilabel.nutrient.model;

import java.util.Objects;

/**
 * 一筆候選（或已勝出）的營養值觀測
 * ✅ value 一定是有限且 >= 0（建構時檢查）
 */
public record SourceValue(
        double value,
        SourceType sourceType,
        String sourceRef,
        EvidenceGrade evidenceGrade,
        double confidence,
        boolean historicalException
) {
    public SourceValue {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException("NUTRIENT_VALUE_INVALID: " + value);
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("CONFIDENCE_OUT_OF_RANGE: " + confidence);
        }
        Objects.requireNonNull(sourceType, "sourceType");
        Objects.requireNonNull(evidenceGrade, "evidenceGrade");
        sourceRef = sourceRef == null ? "" : sourceRef;
    }

    public static SourceValue of(double value, SourceType type, String ref, EvidenceGrade grade, double confidence) {
        return new SourceValue(value, type, ref, grade, confidence, false);
    }

    public boolean isInferred() {
        return evidenceGrade.isInferred();
    }
}
