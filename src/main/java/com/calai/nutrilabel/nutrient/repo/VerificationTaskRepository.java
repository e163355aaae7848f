package com.calai.nutrilabel.nutrient.repo;

import com.calai.nutrilabel.nutrient.entity.VerificationTaskEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface VerificationTaskRepository extends JpaRepository<VerificationTaskEntity, String> {

    boolean existsByOrganizationIdAndTaskTypeAndStatusAndTitle(
            String organizationId,
            VerificationTaskEntity.TaskType taskType,
            VerificationTaskEntity.Status status,
            String title
    );
}
