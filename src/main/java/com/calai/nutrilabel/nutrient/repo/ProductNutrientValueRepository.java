package com.calai.nutrilabel.nutrient.repo;

import com.calai.nutrilabel.nutrient.entity.ProductNutrientValueEntity;
import com.calai.nutrilabel.nutrient.model.EvidenceGrade;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface ProductNutrientValueRepository extends JpaRepository<ProductNutrientValueEntity, String> {

    List<ProductNutrientValueEntity> findByProductId(String productId);

    List<ProductNutrientValueEntity> findByProductIdIn(Collection<String> productIds);

    /**
     * ✅ 全庫歷史值（由小到大），median 在 Java 端算，避免依賴 DB 方言
     * - 排除推估 / 例外等級，避免 fallback 值再被拿來當 fallback
     */
    @Query("""
            select v.valuePer100g from ProductNutrientValueEntity v
            where v.nutrientKey = :key
              and v.valuePer100g is not null
              and v.evidenceGrade not in :excluded
            order by v.valuePer100g asc
            """)
    List<Double> findHistoricalValues(@Param("key") String nutrientKey,
                                      @Param("excluded") Collection<EvidenceGrade> excludedGrades);
}
