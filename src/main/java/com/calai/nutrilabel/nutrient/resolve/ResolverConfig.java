package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.reconcile.ReconcileProperties;
import com.calai.nutrilabel.nutrient.source.off.ManufacturerUpcProvider;
import com.calai.nutrilabel.nutrient.source.usda.UsdaBrandedProvider;
import com.calai.nutrilabel.nutrient.source.usda.UsdaGenericProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Slf4j
@Configuration
@EnableConfigurationProperties(ReconcileProperties.class)
public class ResolverConfig {

    /**
     * ✅ 順序就是優先序：改順序 = 改解析行為
     */
    @Bean
    public ResolutionCascade resolutionCascade(
            ExistingValuesStage existing,
            ManufacturerUpcProvider manufacturer,
            UsdaBrandedProvider usdaBranded,
            UsdaGenericProvider usdaGeneric
    ) {
        ResolutionCascade cascade = new ResolutionCascade(List.of(
                existing,
                RemoteSourceStage.manufacturer(manufacturer),
                RemoteSourceStage.usdaBranded(usdaBranded),
                RemoteSourceStage.usdaGeneric(usdaGeneric)
        ));
        log.info("ResolutionCascade initialized. stages={}", cascade.names());
        return cascade;
    }

    @Bean
    public NutrientFallbackTable nutrientFallbackTable() {
        return NutrientFallbackTable.defaults();
    }
}
