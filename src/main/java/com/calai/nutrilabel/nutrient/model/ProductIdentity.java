package com.calai.nutrilabel.nutrient.model;

/**
 * 單一次 run 內不變的產品身分
 * - ingredientKey：同 key 的產品屬於同一個 ingredient group（donor fallback 用）
 */
public record ProductIdentity(
        String productId,
        String ingredientId,
        String ingredientKey,
        String ingredientName,
        String name,
        String brand,
        String upc,
        String vendor
) {
    /** 名稱 + ingredient 名稱，給 token 規則與 USDA query 用 */
    public String descriptiveText() {
        StringBuilder sb = new StringBuilder();
        if (ingredientName != null) sb.append(ingredientName).append(' ');
        if (name != null) sb.append(name);
        return sb.toString().trim();
    }
}
