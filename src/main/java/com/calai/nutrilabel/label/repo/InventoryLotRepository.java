package com.calai.nutrilabel.label.repo;

import com.calai.nutrilabel.label.entity.InventoryLotEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InventoryLotRepository extends JpaRepository<InventoryLotEntity, String> {
}
