package com.calai.nutrilabel.label.repo;

import com.calai.nutrilabel.label.entity.MealServiceEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface MealServiceEventRepository extends JpaRepository<MealServiceEventEntity, String> {

    /**
     * [start, end)
     */
    @Query("""
            select e from MealServiceEventEntity e
            where e.organizationId = :orgId
              and e.servedAt >= :start
              and e.servedAt < :end
            order by e.servedAt asc, e.id asc
            """)
    List<MealServiceEventEntity> findServedBetween(@Param("orgId") String organizationId,
                                                   @Param("start") Instant start,
                                                   @Param("end") Instant end);
}
