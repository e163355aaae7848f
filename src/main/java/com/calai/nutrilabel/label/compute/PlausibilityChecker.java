package com.calai.nutrilabel.label.compute;

import com.calai.nutrilabel.nutrient.model.NutrientKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 每份營養值的合理性檢查
 * - ERROR：子項大於母項（sat fat > fat、sugars > carb、added > sugars、fiber > carb），容許 0.5g
 * - WARNING：kcal 與 4/4/9 估算差超過 15%（kcal ≥ 20 才檢查）
 */
@Component
public class PlausibilityChecker {

    static final double SUBSET_TOLERANCE_G = 0.5;
    static final double ENERGY_MISMATCH_RATIO = 0.15;
    static final double ENERGY_MIN_KCAL = 20.0;

    public enum Severity { ERROR, WARNING }

    public record Issue(Severity severity, String rule, String nutrientKey, double value, String message) {}

    public record Report(boolean valid, int errorCount, int warningCount, List<Issue> issues) {
        public Report {
            issues = List.copyOf(issues);
        }
    }

    public Report check(Map<NutrientKey, Double> perServing) {
        List<Issue> issues = new ArrayList<>();

        subset(perServing, NutrientKey.SAT_FAT_G, NutrientKey.FAT_G, "SAT_FAT_EXCEEDS_FAT", issues);
        subset(perServing, NutrientKey.SUGARS_G, NutrientKey.CARB_G, "SUGARS_EXCEED_CARB", issues);
        subset(perServing, NutrientKey.ADDED_SUGARS_G, NutrientKey.SUGARS_G, "ADDED_SUGARS_EXCEED_SUGARS", issues);
        subset(perServing, NutrientKey.FIBER_G, NutrientKey.CARB_G, "FIBER_EXCEEDS_CARB", issues);

        Double kcal = perServing.get(NutrientKey.KCAL);
        if (isFiniteNonNegative(kcal) && kcal >= ENERGY_MIN_KCAL) {
            double est = orZero(perServing.get(NutrientKey.PROTEIN_G)) * 4
                         + orZero(perServing.get(NutrientKey.CARB_G)) * 4
                         + orZero(perServing.get(NutrientKey.FAT_G)) * 9;
            double diff = Math.abs(kcal - est);
            if (diff > est * ENERGY_MISMATCH_RATIO) {
                issues.add(new Issue(Severity.WARNING, "ENERGY_MACRO_MISMATCH", NutrientKey.KCAL.key(), kcal,
                        String.format(Locale.ROOT, "kcal %.1f differs from macro estimate %.1f by %.1f", kcal, est, diff)));
            }
        }

        int errors = (int) issues.stream().filter(i -> i.severity() == Severity.ERROR).count();
        int warnings = issues.size() - errors;
        return new Report(errors == 0, errors, warnings, issues);
    }

    private static void subset(Map<NutrientKey, Double> m, NutrientKey part, NutrientKey whole,
                               String rule, List<Issue> out) {
        Double p = m.get(part);
        if (!isFiniteNonNegative(p)) return;
        double w = orZero(m.get(whole));
        if (p > w + SUBSET_TOLERANCE_G) {
            out.add(new Issue(Severity.ERROR, rule, part.key(), p,
                    String.format(Locale.ROOT, "%s %.2f exceeds %s %.2f", part.key(), p, whole.key(), w)));
        }
    }

    private static boolean isFiniteNonNegative(Double v) {
        return v != null && Double.isFinite(v) && v >= 0.0;
    }

    private static double orZero(Double v) {
        return isFiniteNonNegative(v) ? v : 0.0;
    }
}
