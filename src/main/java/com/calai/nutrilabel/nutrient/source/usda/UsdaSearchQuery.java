package com.calai.nutrilabel.nutrient.source.usda;

import java.util.List;
import java.util.Locale;

/**
 * /fdc/v1/foods/search 的查詢參數（api_key 由 client 帶）
 */
public record UsdaSearchQuery(
        String query,
        int pageSize,
        List<String> dataTypes,
        boolean requireAllWords
) {
    public static final List<String> BRANDED_ONLY = List.of("Branded");
    public static final List<String> BRANDED_FIRST = List.of("Branded", "Foundation", "SR Legacy");
    public static final List<String> GENERIC_FIRST = List.of("Foundation", "SR Legacy", "Survey (FNDDS)", "Branded");

    public UsdaSearchQuery {
        dataTypes = dataTypes == null ? List.of() : List.copyOf(dataTypes);
    }

    /** 快取 key：參數固定順序串起來 */
    public String cacheKey() {
        return "search:q=" + query.trim().toLowerCase(Locale.ROOT)
               + "|size=" + pageSize
               + "|types=" + String.join(",", dataTypes)
               + "|all=" + requireAllWords;
    }
}
