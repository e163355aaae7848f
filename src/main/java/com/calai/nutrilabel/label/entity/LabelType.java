package com.calai.nutrilabel.label.entity;

/**
 * 粗 → 細：SKU > INGREDIENT > PRODUCT > LOT
 */
public enum LabelType {
    SKU,
    INGREDIENT,
    PRODUCT,
    LOT
}
