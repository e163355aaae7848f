package com.calai.nutrilabel.label.repo;

import com.calai.nutrilabel.label.entity.LotConsumptionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LotConsumptionRepository extends JpaRepository<LotConsumptionEntity, String> {

    List<LotConsumptionEntity> findByMealServiceEventId(String mealServiceEventId);
}
