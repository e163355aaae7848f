package com.calai.nutrilabel.nutrient.source.upstream;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

    void sleep(Duration d) throws InterruptedException;

    Sleeper THREAD = d -> {
        if (d != null && !d.isZero() && !d.isNegative()) Thread.sleep(d.toMillis());
    };
}
