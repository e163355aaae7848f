package com.calai.nutrilabel.nutrient.resolve;

import java.util.List;

/**
 * 明確排序的 stage 清單（順序 = 優先序，同 confidence 時先到者勝）
 */
public record ResolutionCascade(List<ResolutionStage> stages) {

    public ResolutionCascade {
        stages = List.copyOf(stages);
    }

    public List<String> names() {
        return stages.stream().map(ResolutionStage::name).toList();
    }
}
