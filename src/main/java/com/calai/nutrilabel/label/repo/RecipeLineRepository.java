package com.calai.nutrilabel.label.repo;

import com.calai.nutrilabel.label.entity.RecipeLineEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RecipeLineRepository extends JpaRepository<RecipeLineEntity, String> {

    List<RecipeLineEntity> findByRecipeIdOrderByLineOrderAsc(String recipeId);
}
