package com.calai.nutrilabel.label.compute;

import java.util.List;

public record DeclaredIngredient(String name, double targetGPerServing, List<String> allergenTags) {
    public DeclaredIngredient {
        allergenTags = allergenTags == null ? List.of() : List.copyOf(allergenTags);
    }
}
