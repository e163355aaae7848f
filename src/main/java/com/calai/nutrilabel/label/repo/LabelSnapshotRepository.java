package com.calai.nutrilabel.label.repo;

import com.calai.nutrilabel.label.entity.LabelSnapshotEntity;
import com.calai.nutrilabel.label.entity.LabelType;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LabelSnapshotRepository extends JpaRepository<LabelSnapshotEntity, String> {

    long countByOrganizationIdAndLabelTypeAndExternalRefId(String organizationId, LabelType labelType, String externalRefId);
}
