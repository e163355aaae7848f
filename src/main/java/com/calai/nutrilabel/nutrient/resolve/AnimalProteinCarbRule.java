package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.model.EvidenceGrade;
import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.ProductIdentity;
import com.calai.nutrilabel.nutrient.model.ResolvedProfile;
import com.calai.nutrilabel.nutrient.model.SourceType;
import com.calai.nutrilabel.nutrient.model.SourceValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 單純動物蛋白（雞、牛、魚...）的碳水家族一律 0
 * ✅ 有排除 token（麵包、醬、肉乾...）就不套用：那些是加工品，碳水可能是真的
 */
public final class AnimalProteinCarbRule {

    private AnimalProteinCarbRule() {}

    public static final String SOURCE_REF = "rule:animal-protein-zero-carb";
    public static final double CONFIDENCE = 0.8;

    private static final Pattern ANIMAL_PROTEIN = Pattern.compile(
            "^(CHICKEN|TURKEY|BEEF|PORK|LAMB|VEAL|BISON|DUCK|GOOSE|VENISON|FISH|COD|SALMON|TUNA|TILAPIA|SHRIMP|PRAWNS?"
            + "|CRAB|LOBSTER|SCALLOPS?|MUSSELS?|CLAMS?|OYSTERS?|SARDINES?|ANCHOVIES?|HALIBUT|TROUT|BASS|CATFISH"
            + "|SWORDFISH|MAHI|SNAPPER|HADDOCK|POLLOCK|MACKEREL|HERRING|PERCH|SOLE|FLOUNDER|GROUPER)$");

    static final Set<String> EXCLUSION_TOKENS = Set.of(
            "BREAD", "BREADED", "BREADING", "SAUCE", "JERKY", "GLAZE", "GLAZED", "TERIYAKI", "BBQ", "BARBECUE",
            "HONEY", "NUGGET", "NUGGETS", "BATTER", "BATTERED", "CRUSTED", "MEATBALL", "MEATBALLS",
            "SAUSAGE", "SAUSAGES", "SOUP", "SANDWICH", "WRAP", "DUMPLING", "DUMPLINGS", "PIE", "MARINADE",
            "MARINATED", "STUFFED", "SWEET", "SUGAR", "FLOUR", "RICE", "NOODLE", "NOODLES", "PASTA"
    );

    public static boolean applies(ProductIdentity product) {
        Set<String> tokens = tokens(product);
        if (tokens.isEmpty()) return false;
        if (tokens.stream().anyMatch(EXCLUSION_TOKENS::contains)) return false;
        return tokens.stream().anyMatch(t -> ANIMAL_PROTEIN.matcher(t).matches());
    }

    /**
     * 套用到 profile：碳水家族 key 強制覆寫為 0
     */
    public static boolean apply(ProductIdentity product, ResolvedProfile profile) {
        if (!applies(product)) return false;
        SourceValue zero = SourceValue.of(0.0, SourceType.DERIVED, SOURCE_REF,
                EvidenceGrade.INFERRED_FROM_INGREDIENT, CONFIDENCE);
        for (NutrientKey key : NutrientKey.CARB_FAMILY) {
            profile.override(key, zero);
        }
        return true;
    }

    static Set<String> tokens(ProductIdentity product) {
        String text = String.join(" ",
                nz(product.ingredientName()), nz(product.name()), nz(product.brand()));
        return Arrays.stream(text.toUpperCase(Locale.ROOT).split("[^A-Z0-9]+"))
                .filter(t -> !t.isBlank())
                .collect(Collectors.toSet());
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
