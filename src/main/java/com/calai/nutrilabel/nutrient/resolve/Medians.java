package com.calai.nutrilabel.nutrient.resolve;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

public final class Medians {

    private Medians() {}

    public static OptionalDouble of(Collection<Double> values) {
        List<Double> sorted = new ArrayList<>();
        for (Double v : values) {
            if (v != null && Double.isFinite(v)) sorted.add(v);
        }
        Collections.sort(sorted);
        return ofSorted(sorted);
    }

    /** 已排序（由小到大） */
    public static OptionalDouble ofSorted(List<Double> sorted) {
        if (sorted == null || sorted.isEmpty()) return OptionalDouble.empty();
        int n = sorted.size();
        if (n % 2 == 1) return OptionalDouble.of(sorted.get(n / 2));
        return OptionalDouble.of((sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0);
    }
}
