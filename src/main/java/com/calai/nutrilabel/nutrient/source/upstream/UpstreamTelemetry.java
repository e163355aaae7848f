package com.calai.nutrilabel.nutrient.source.upstream;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class UpstreamTelemetry {

    public void ok(Upstream upstream, String op, int attempt, long latencyMs) {
        log.info("upstream_call status=OK upstream={} op={} attempt={} latencyMs={}",
                upstream, safe(op), attempt, latencyMs);
    }

    public void miss(Upstream upstream, String op, int status) {
        log.info("upstream_call status=MISS upstream={} op={} httpStatus={}", upstream, safe(op), status);
    }

    public void fail(Upstream upstream, String op, int attempt, long latencyMs, String errorCode) {
        log.warn("upstream_call status=FAIL upstream={} op={} attempt={} latencyMs={} errorCode={}",
                upstream, safe(op), attempt, latencyMs, safe(errorCode));
    }

    public void rateLimited(Upstream upstream, String op) {
        log.warn("upstream_call status=RATE_LIMITED upstream={} op={} (sticky for this run)", upstream, safe(op));
    }

    public void skipped(Upstream upstream, String op) {
        log.debug("upstream_call status=SKIPPED upstream={} op={} reason=RATE_LIMITED", upstream, safe(op));
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
}
