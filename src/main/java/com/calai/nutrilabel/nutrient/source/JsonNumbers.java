package com.calai.nutrilabel.nutrient.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 外部 JSON 的數字容錯解析（"12.3 g" / "0,5" / "≈3.2"）
 */
public final class JsonNumbers {

    private JsonNumbers() {}

    private static final Pattern P_NUM = Pattern.compile("[-+]?\\d+(?:\\.\\d+)?");

    public static Double numberOrNull(JsonNode node, String key) {
        if (node == null || node.isNull()) return null;
        return numberOrNull(node.path(key));
    }

    public static Double numberOrNull(JsonNode v) {
        if (v == null || v.isMissingNode() || v.isNull()) return null;
        if (v.isNumber()) {
            double d = v.asDouble();
            return Double.isFinite(d) ? d : null;
        }

        String raw = v.asText(null);
        if (raw == null) return null;

        String s = raw.trim().replace(',', '.');
        Matcher m = P_NUM.matcher(s);
        if (!m.find()) return null;

        try { return Double.parseDouble(m.group()); }
        catch (NumberFormatException e) { return null; }
    }

    public static String textOrNull(JsonNode node, String key) {
        if (node == null || node.isNull()) return null;
        JsonNode v = node.get(key);
        if (v == null || v.isNull()) return null;
        String s = v.asText(null);
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
