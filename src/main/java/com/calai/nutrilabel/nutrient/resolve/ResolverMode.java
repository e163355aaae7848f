package com.calai.nutrilabel.nutrient.resolve;

/**
 * STANDARD：一般補值
 * HISTORICAL_BACKFILL：修復歷史資料（trace 值一律視為缺值、global fallback 標 historicalException）
 */
public enum ResolverMode {
    STANDARD,
    HISTORICAL_BACKFILL
}
