package com.calai.nutrilabel.nutrient.source.upstream;

import lombok.Getter;

@Getter
public class UpstreamHttpException extends RuntimeException {

    private final Upstream upstream;
    private final int status;
    private final String bodySnippet;

    public UpstreamHttpException(Upstream upstream, int status, String bodySnippet) {
        super(upstream + "_HTTP_" + status);
        this.upstream = upstream;
        this.status = status;
        this.bodySnippet = bodySnippet;
    }

    public boolean isNotFound() {
        return status == 404;
    }

    public boolean isRateLimited() {
        return status == 429;
    }

    /** 429 / 5xx 才值得重試 */
    public boolean isRetryable() {
        return status == 429 || status >= 500;
    }
}
