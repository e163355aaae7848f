package com.calai.nutrilabel.nutrient.source.upstream;

import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * 錯誤 body 截斷（只給 log / 例外訊息用）
 */
public final class HttpBodies {

    private HttpBodies() {}

    public static final int MAX_ERROR_SNIPPET_BYTES = 1024;

    public static String snippetQuietly(ClientHttpResponse res) {
        try (InputStream in = res.getBody()) {
            if (in == null) return null;
            byte[] bytes = in.readNBytes(MAX_ERROR_SNIPPET_BYTES);
            if (bytes.length == 0) return "";
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return null;
        }
    }

    public static String shrink(String s, int maxChars) {
        if (s == null) return null;
        String t = s.replaceAll("\\s+", " ").trim();
        if (t.length() <= maxChars) return t;
        return t.substring(0, maxChars) + "...";
    }

    public static String safe(String s) {
        if (s == null) return "null";
        String t = s.trim();
        return t.isEmpty() ? "blank" : t;
    }
}
