package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.model.EvidenceGrade;
import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.ProductIdentity;
import com.calai.nutrilabel.nutrient.model.SourceType;
import com.calai.nutrilabel.nutrient.model.SourceValue;
import com.calai.nutrilabel.nutrient.model.VerificationStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExistingValuesStageTest {

    private final ExistingValuesStage stage = new ExistingValuesStage();

    private static ExistingNutrientRow row(NutrientKey key, Double value, SourceType type, String ref,
                                           EvidenceGrade grade, VerificationStatus status, double confidence,
                                           boolean exception) {
        return new ExistingNutrientRow(key, value, type, ref, grade, status, confidence, exception);
    }

    @Test
    void trusted_rows_get_baseline_confidence_floor() {
        ProductIdentity p = new ProductIdentity("p1", "i1", "milk", "Milk", "Milk", null, null, null);
        ResolutionContext ctx = new ResolutionContext(null, ResolverMode.STANDARD, Map.of("p1", List.of(
                row(NutrientKey.PROTEIN_G, 3.3, SourceType.MANUAL, "manual:sheet", EvidenceGrade.VERIFIED_MANUAL,
                        VerificationStatus.VERIFIED, 0.5, false),
                row(NutrientKey.FAT_G, 3.2, SourceType.USDA, "usda:1", EvidenceGrade.USDA_GENERIC,
                        VerificationStatus.NEEDS_REVIEW, 0.9, false),
                row(NutrientKey.SODIUM_MG, 40.0, SourceType.DERIVED, "rule:x", EvidenceGrade.INFERRED_FROM_INGREDIENT,
                        VerificationStatus.NEEDS_REVIEW, 0.1, false)
        )), true);

        Map<NutrientKey, SourceValue> out = stage.candidates(p, ctx);

        assertThat(out.get(NutrientKey.PROTEIN_G).confidence()).isEqualTo(0.95);
        assertThat(out.get(NutrientKey.FAT_G).confidence()).isEqualTo(0.9);
        assertThat(out.get(NutrientKey.SODIUM_MG).confidence()).isEqualTo(0.55);
        assertThat(stage.readsStoredValues()).isTrue();
    }

    @Test
    void placeholders_exceptions_rejected_and_donor_rows_are_untrusted() {
        assertThat(ExistingValuesStage.isTrusted(row(NutrientKey.FAT_G, 1.0, SourceType.DERIVED,
                "agent:trace-floor-imputation:v1", EvidenceGrade.USDA_GENERIC, VerificationStatus.NEEDS_REVIEW, 0.5, false))).isFalse();
        assertThat(ExistingValuesStage.isTrusted(row(NutrientKey.FAT_G, 1.0, SourceType.DERIVED,
                "historical-cleanup:pending-rebuild", EvidenceGrade.USDA_GENERIC, VerificationStatus.NEEDS_REVIEW, 0.5, false))).isFalse();
        assertThat(ExistingValuesStage.isTrusted(row(NutrientKey.FAT_G, 1.0, SourceType.USDA,
                "usda:1", EvidenceGrade.USDA_GENERIC, VerificationStatus.NEEDS_REVIEW, 0.5, true))).isFalse();
        assertThat(ExistingValuesStage.isTrusted(row(NutrientKey.FAT_G, 1.0, SourceType.USDA,
                "usda:1", EvidenceGrade.USDA_GENERIC, VerificationStatus.REJECTED, 0.5, false))).isFalse();
        assertThat(ExistingValuesStage.isTrusted(row(NutrientKey.FAT_G, 1.0, SourceType.DERIVED,
                "donor-product:x", EvidenceGrade.INFERRED_FROM_SIMILAR_PRODUCT, VerificationStatus.NEEDS_REVIEW, 0.4, false))).isFalse();
        assertThat(ExistingValuesStage.isTrusted(row(NutrientKey.FAT_G, null, SourceType.USDA,
                "usda:1", EvidenceGrade.USDA_GENERIC, VerificationStatus.VERIFIED, 0.5, false))).isFalse();
        assertThat(ExistingValuesStage.isTrusted(row(NutrientKey.FAT_G, 1.0, SourceType.USDA,
                "usda:1", EvidenceGrade.USDA_GENERIC, VerificationStatus.VERIFIED, 0.5, false))).isTrue();
    }
}
