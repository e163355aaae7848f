package com.calai.nutrilabel.label.entity;

public enum LineageEdgeType {
    SKU_CONTAINS_INGREDIENT(LabelType.SKU, LabelType.INGREDIENT),
    INGREDIENT_RESOLVED_TO_PRODUCT(LabelType.INGREDIENT, LabelType.PRODUCT),
    PRODUCT_CONSUMED_FROM_LOT(LabelType.PRODUCT, LabelType.LOT);

    private final LabelType parentType;
    private final LabelType childType;

    LineageEdgeType(LabelType parentType, LabelType childType) {
        this.parentType = parentType;
        this.childType = childType;
    }

    public LabelType parentType() {
        return parentType;
    }

    public LabelType childType() {
        return childType;
    }
}
