package com.calai.nutrilabel.nutrient.model;

/**
 * 每一筆營養值的證據等級
 * - MANUFACTURER_LABEL：舊資料中直接抄錄包裝標示的列
 */
public enum EvidenceGrade {
    VERIFIED_MANUAL,
    MANUFACTURER_LABEL,
    OPENFOODFACTS,
    USDA_BRANDED,
    USDA_GENERIC,
    INFERRED_FROM_INGREDIENT,
    INFERRED_FROM_SIMILAR_PRODUCT,
    HISTORICAL_EXCEPTION;

    public boolean isInferred() {
        return this == INFERRED_FROM_INGREDIENT || this == INFERRED_FROM_SIMILAR_PRODUCT;
    }

    public boolean isException() {
        return this == HISTORICAL_EXCEPTION;
    }
}
