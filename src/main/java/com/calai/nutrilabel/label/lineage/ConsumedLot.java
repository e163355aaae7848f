package com.calai.nutrilabel.label.lineage;

import com.calai.nutrilabel.label.evidence.EvidenceRow;
import com.calai.nutrilabel.nutrient.model.NutrientKey;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * recipe line × inventory lot 的一筆消耗，帶著 lot 對應產品的 per 100g 營養值與證據列
 */
public record ConsumedLot(
        String ingredientId,
        String ingredientName,
        List<String> allergenTags,
        String productId,
        String productName,
        String brand,
        String upc,
        String vendor,
        String lotId,
        String lotCode,
        String sourceOrderRef,
        double grams,
        Map<NutrientKey, Double> per100g,
        List<EvidenceRow> evidence,
        boolean syntheticLot
) {
    public static final String SYNTHETIC_VENDOR = "SYSTEM_SYNTHETIC";
    public static final String SYNTHETIC_UPC_PREFIX = "SYNTH-";

    public ConsumedLot {
        allergenTags = allergenTags == null ? List.of() : List.copyOf(allergenTags);
        EnumMap<NutrientKey, Double> copy = new EnumMap<>(NutrientKey.class);
        if (per100g != null) copy.putAll(per100g);
        per100g = copy;
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public static boolean isSynthetic(String vendor, String upc) {
        return SYNTHETIC_VENDOR.equals(vendor) || (upc != null && upc.startsWith(SYNTHETIC_UPC_PREFIX));
    }
}
