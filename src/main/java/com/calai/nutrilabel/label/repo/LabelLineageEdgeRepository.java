package com.calai.nutrilabel.label.repo;

import com.calai.nutrilabel.label.entity.LabelLineageEdgeEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LabelLineageEdgeRepository extends JpaRepository<LabelLineageEdgeEntity, String> {

    List<LabelLineageEdgeEntity> findByParentLabelId(String parentLabelId);
}
