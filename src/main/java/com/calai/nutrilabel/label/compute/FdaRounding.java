package com.calai.nutrilabel.label.compute;

/**
 * FDA 標示用的階梯式四捨五入（輸入為未四捨五入的每份值）
 */
public final class FdaRounding {

    private FdaRounding() {}

    /** <5 → 0；≤50 → 5 的倍數；其餘 → 10 的倍數 */
    public static double calories(double v) {
        if (v < 5) return 0;
        if (v <= 50) return nearest(v, 5);
        return nearest(v, 10);
    }

    /** fat / sat fat / trans fat：<0.5 → 0；<5 → 0.5 的倍數；其餘 → 整數 */
    public static double fatLike(double v) {
        if (v < 0.5) return 0;
        if (v < 5) return nearest(v, 0.5);
        return nearest(v, 1);
    }

    /** carb / fiber / sugars / added sugars / protein */
    public static double generalGrams(double v) {
        if (v < 0.5) return 0;
        return nearest(v, 1);
    }

    /** <5 → 0；≤140 → 5 的倍數；其餘 → 10 的倍數 */
    public static double sodium(double v) {
        if (v < 5) return 0;
        if (v <= 140) return nearest(v, 5);
        return nearest(v, 10);
    }

    /** <2 → 0；其餘 → 5 的倍數 */
    public static double cholesterol(double v) {
        if (v < 2) return 0;
        return nearest(v, 5);
    }

    private static double nearest(double v, double step) {
        return Math.round(v / step) * step;
    }
}
