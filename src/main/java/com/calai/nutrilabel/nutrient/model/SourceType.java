package com.calai.nutrilabel.nutrient.model;

public enum SourceType {
    MANUAL,
    MANUFACTURER,
    USDA,
    DERIVED
}
