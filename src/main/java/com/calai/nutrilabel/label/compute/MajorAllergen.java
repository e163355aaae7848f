package com.calai.nutrilabel.label.compute;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * 9 大過敏原（ingredient_catalog.allergen_tags 用小寫 tag）
 */
public enum MajorAllergen {
    MILK,
    EGG,
    FISH,
    SHELLFISH,
    TREE_NUTS,
    PEANUTS,
    WHEAT,
    SOY,
    SESAME;

    public static final String NONE_STATEMENT = "Contains: None of the 9 major allergens";

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** "tree_nuts" → "tree nuts" */
    public String label() {
        return tag().replace('_', ' ');
    }

    /** "Tree Nuts" / "tree-nuts" / "tree_nuts" 都接受；不是 9 大之一回 null */
    public static MajorAllergen fromTagOrNull(String raw) {
        if (raw == null) return null;
        String t = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if (t.isEmpty()) return null;
        for (MajorAllergen a : values()) {
            if (a.name().equals(t)) return a;
        }
        return null;
    }

    public static String statement(Collection<String> tags) {
        Set<String> labels = new TreeSet<>();
        if (tags != null) {
            for (String raw : tags) {
                MajorAllergen a = fromTagOrNull(raw);
                if (a != null) labels.add(a.label());
            }
        }
        if (labels.isEmpty()) return NONE_STATEMENT;
        return "Contains: " + String.join(", ", labels);
    }
}
