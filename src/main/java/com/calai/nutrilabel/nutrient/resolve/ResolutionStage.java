package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.ProductIdentity;
import com.calai.nutrilabel.nutrient.model.SourceValue;

import java.util.Map;

/**
 * cascade 的一個 stage：同一個簽名，只產生候選，合併由 {@link NutrientResolver} 負責
 */
public interface ResolutionStage {

    String name();

    Map<NutrientKey, SourceValue> candidates(ProductIdentity product, ResolutionContext ctx);

    /** DB 既有值：trace 等級的值一律視為缺值 */
    default boolean readsStoredValues() {
        return false;
    }
}
