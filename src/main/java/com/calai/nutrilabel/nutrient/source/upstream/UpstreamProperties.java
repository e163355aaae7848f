package com.calai.nutrilabel.nutrient.source.upstream;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * app.upstream.*：外部來源共用的重試 / 快取設定
 */
@ConfigurationProperties(prefix = "app.upstream")
public record UpstreamProperties(
        Integer maxAttempts,
        Duration httpBackoff,
        Duration ioBackoff,
        Integer cacheMaxEntries
) {
    public int maxAttemptsOrDefault() {
        return (maxAttempts == null || maxAttempts <= 0) ? 3 : maxAttempts;
    }

    public Duration httpBackoffOrDefault() {
        return httpBackoff == null ? Duration.ofMillis(600) : httpBackoff;
    }

    public Duration ioBackoffOrDefault() {
        return ioBackoff == null ? Duration.ofMillis(500) : ioBackoff;
    }

    public int cacheMaxEntriesOrDefault() {
        return (cacheMaxEntries == null || cacheMaxEntries <= 0) ? 5_000 : cacheMaxEntries;
    }
}
