package com.calai.nutrilabel.nutrient.source.upstream;

import lombok.Getter;

@Getter
public class UpstreamParseException extends RuntimeException {

    private final String code;
    private final String bodySnippet;

    public UpstreamParseException(String code, String message, String bodySnippet, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.bodySnippet = bodySnippet;
    }
}
