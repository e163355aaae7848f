package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.model.EvidenceGrade;
import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.repo.ProductNutrientValueRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.OptionalDouble;

/**
 * 全庫歷史 median（global fallback 第二層）
 */
@Component
@RequiredArgsConstructor
public class HistoricalMedianSource {

    private static final EnumSet<EvidenceGrade> EXCLUDED = EnumSet.of(
            EvidenceGrade.INFERRED_FROM_SIMILAR_PRODUCT,
            EvidenceGrade.HISTORICAL_EXCEPTION
    );

    private final ProductNutrientValueRepository repo;

    public OptionalDouble median(NutrientKey key) {
        List<Double> sorted = repo.findHistoricalValues(key.key(), EXCLUDED);
        return Medians.ofSorted(sorted);
    }
}
