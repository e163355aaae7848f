package com.calai.nutrilabel.nutrient.repo;

import com.calai.nutrilabel.nutrient.entity.IngredientCatalogEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface IngredientCatalogRepository extends JpaRepository<IngredientCatalogEntity, String> {

    List<IngredientCatalogEntity> findByOrganizationId(String organizationId);
}
