package com.calai.nutrilabel.nutrient.reconcile;

import com.calai.nutrilabel.nutrient.entity.ProductNutrientValueEntity;
import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.ResolvedProfile;
import com.calai.nutrilabel.nutrient.model.SourceValue;
import com.calai.nutrilabel.nutrient.model.VerificationStatus;
import com.calai.nutrilabel.nutrient.repo.ProductNutrientValueRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * ResolvedProfile → product_nutrient_values
 * - 值 / 來源 / 等級都沒變就不寫
 * - 有寫就改成 NEEDS_REVIEW，version 由 @Version 自動 +1
 */
@Component
@RequiredArgsConstructor
public class NutrientValueWriter {

    static final double VALUE_EPSILON = 1e-9;

    private final ProductNutrientValueRepository repo;

    /**
     * @param existing 這個產品目前在 DB 的列（key → entity）
     * @return 實際寫入筆數
     */
    public int upsert(ResolvedProfile profile,
                      Map<NutrientKey, ProductNutrientValueEntity> existing,
                      String retrievalRunId,
                      Instant now) {
        int written = 0;
        for (Map.Entry<NutrientKey, SourceValue> e : profile.values().entrySet()) {
            NutrientKey key = e.getKey();
            SourceValue v = e.getValue();
            ProductNutrientValueEntity row = existing.get(key);

            if (row != null && unchanged(row, v)) continue;

            if (row == null) {
                row = new ProductNutrientValueEntity();
                row.setProductId(profile.productId());
                row.setNutrientKey(key.key());
            }
            row.setValuePer100g(v.value());
            row.setSourceType(v.sourceType());
            row.setSourceRef(v.sourceRef());
            row.setEvidenceGrade(v.evidenceGrade());
            row.setConfidenceScore(v.confidence());
            row.setHistoricalException(v.historicalException());
            row.setVerificationStatus(VerificationStatus.NEEDS_REVIEW);
            row.setRetrievedAt(now);
            row.setRetrievalRunId(retrievalRunId);

            repo.save(row);
            written++;
        }
        return written;
    }

    static boolean unchanged(ProductNutrientValueEntity row, SourceValue v) {
        if (row.getValuePer100g() == null) return false;
        if (Math.abs(row.getValuePer100g() - v.value()) > VALUE_EPSILON) return false;
        return Objects.equals(row.getSourceRef(), v.sourceRef())
               && row.getEvidenceGrade() == v.evidenceGrade()
               && row.isHistoricalException() == v.historicalException();
    }
}
