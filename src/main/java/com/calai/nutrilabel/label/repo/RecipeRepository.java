package com.calai.nutrilabel.label.repo;

import com.calai.nutrilabel.label.entity.RecipeEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RecipeRepository extends JpaRepository<RecipeEntity, String> {

    /** 同一 SKU 有多個 active recipe 時取最新 */
    Optional<RecipeEntity> findFirstBySkuIdAndActiveTrueOrderByUpdatedAtUtcDesc(String skuId);
}
