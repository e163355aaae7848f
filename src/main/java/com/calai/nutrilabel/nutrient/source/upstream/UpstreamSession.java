package com.calai.nutrilabel.nutrient.source.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 單次 run 的外部查詢狀態（run 結束就丟掉）
 * - cache：key = (upstream, 正規化後的 query / upc / id)，查無資料也快取
 * - rateLimited：某個 upstream 連續 429 到放棄後，本 run 之後的呼叫一律直接略過
 */
@Slf4j
public class UpstreamSession {

    private final UpstreamRetryPolicy policy;
    private final UpstreamTelemetry telemetry;
    private final Sleeper sleeper;
    private final Cache<String, Optional<JsonNode>> cache;
    private final Set<Upstream> rateLimited = EnumSet.noneOf(Upstream.class);

    public UpstreamSession(UpstreamRetryPolicy policy, UpstreamTelemetry telemetry, Sleeper sleeper, int maxEntries) {
        this.policy = policy;
        this.telemetry = telemetry;
        this.sleeper = sleeper;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .build();
    }

    public boolean isRateLimited(Upstream upstream) {
        return rateLimited.contains(upstream);
    }

    public Set<Upstream> rateLimitedUpstreams() {
        return Set.copyOf(rateLimited);
    }

    public long cachedEntries() {
        return cache.estimatedSize();
    }

    /**
     * 帶快取 + 重試的呼叫
     * ✅ 任何失敗都降級成 Optional.empty()，不往外丟
     */
    public Optional<JsonNode> fetch(Upstream upstream, String cacheKey, Supplier<JsonNode> call) {
        if (rateLimited.contains(upstream)) {
            telemetry.skipped(upstream, cacheKey);
            return Optional.empty();
        }

        String key = upstream.name() + "|" + cacheKey;
        Optional<JsonNode> cached = cache.getIfPresent(key);
        if (cached != null) return cached;

        Optional<JsonNode> result = callWithRetry(upstream, cacheKey, call);
        cache.put(key, result);
        return result;
    }

    private Optional<JsonNode> callWithRetry(Upstream upstream, String op, Supplier<JsonNode> call) {
        for (int attempt = 1; ; attempt++) {
            long t0 = System.nanoTime();
            try {
                JsonNode node = call.get();
                telemetry.ok(upstream, op, attempt, elapsedMs(t0));
                return Optional.ofNullable(node);
            } catch (UpstreamHttpException e) {
                long ms = elapsedMs(t0);
                if (e.isNotFound()) {
                    telemetry.miss(upstream, op, e.getStatus());
                    return Optional.empty();
                }
                if (!e.isRetryable()) {
                    telemetry.fail(upstream, op, attempt, ms, e.getMessage());
                    return Optional.empty();
                }
                telemetry.fail(upstream, op, attempt, ms, e.getMessage());
                if (policy.shouldGiveUp(attempt)) {
                    if (e.isRateLimited()) {
                        rateLimited.add(upstream);
                        telemetry.rateLimited(upstream, op);
                    }
                    return Optional.empty();
                }
                if (!pause(policy.httpDelay(attempt))) return Optional.empty();
            } catch (UpstreamParseException e) {
                telemetry.fail(upstream, op, attempt, elapsedMs(t0), e.getCode());
                return Optional.empty();
            } catch (RuntimeException e) {
                // 連線逾時 / DNS / 連線被重置 ...
                telemetry.fail(upstream, op, attempt, elapsedMs(t0), e.getClass().getSimpleName());
                if (policy.shouldGiveUp(attempt)) {
                    log.warn("upstream gave up: upstream={} op={} attempts={}", upstream, op, attempt, e);
                    return Optional.empty();
                }
                if (!pause(policy.ioDelay(attempt))) return Optional.empty();
            }
        }
    }

    private boolean pause(Duration d) {
        try {
            sleeper.sleep(d);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}
