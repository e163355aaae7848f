package com.calai.nutrilabel.nutrient.source;

public final class UpcCodes {

    private UpcCodes() {}

    public static final int MIN_DIGITS = 8;

    /**
     * 只留數字，至少 8 碼才算有效 UPC，否則回 null
     * - "SYNTH-000123" 這類合成碼會被濾掉
     */
    public static String normalizeOrNull(String raw) {
        if (raw == null) return null;
        String digits = raw.replaceAll("\\D", "");
        return digits.length() >= MIN_DIGITS ? digits : null;
    }
}
