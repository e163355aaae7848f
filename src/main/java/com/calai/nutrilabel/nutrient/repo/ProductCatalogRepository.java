package com.calai.nutrilabel.nutrient.repo;

import com.calai.nutrilabel.nutrient.entity.ProductCatalogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ProductCatalogRepository extends JpaRepository<ProductCatalogEntity, String> {

    @Query("""
            select p from ProductCatalogEntity p
            where p.organizationId = :orgId
              and p.active = true
            order by p.ingredientId asc, p.id asc
            """)
    List<ProductCatalogEntity> findActiveByOrganization(@Param("orgId") String organizationId);
}
