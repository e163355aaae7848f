package com.calai.nutrilabel.label.repo;

import com.calai.nutrilabel.label.entity.SkuEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SkuRepository extends JpaRepository<SkuEntity, String> {
}
