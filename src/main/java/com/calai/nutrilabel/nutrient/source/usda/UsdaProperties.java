package com.calai.nutrilabel.nutrient.source.usda;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * app.usda.*（base-url / timeout 由 UpstreamRestClientConfig 直接讀）
 */
@ConfigurationProperties(prefix = "app.usda")
public record UsdaProperties(
        String apiKey,
        Integer upcPageSize,
        Integer queryPageSize
) {
    public String apiKeyOrDefault() {
        return (apiKey == null || apiKey.isBlank()) ? "DEMO_KEY" : apiKey.trim();
    }

    public int upcPageSizeOrDefault() {
        return (upcPageSize == null || upcPageSize <= 0) ? 10 : upcPageSize;
    }

    public int queryPageSizeOrDefault() {
        return (queryPageSize == null || queryPageSize <= 0) ? 12 : queryPageSize;
    }
}
