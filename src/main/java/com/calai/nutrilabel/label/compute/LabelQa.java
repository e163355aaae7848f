package com.calai.nutrilabel.label.compute;

/**
 * macroKcal = protein×4 + carb×4 + fat×9（未四捨五入的每份值）
 * delta = macroKcal - labeledCalories
 */
public record LabelQa(double macroKcal, double labeledCalories, double delta, boolean pass) {}
