package com.calai.nutrilabel.nutrient.source.upstream;

public enum Upstream {
    OPEN_FOOD_FACTS,
    USDA_FDC
}
