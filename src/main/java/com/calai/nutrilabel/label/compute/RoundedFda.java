package com.calai.nutrilabel.label.compute;

public record RoundedFda(
        double calories,
        double fatG,
        double satFatG,
        double transFatG,
        double cholesterolMg,
        double sodiumMg,
        double carbG,
        double fiberG,
        double sugarsG,
        double addedSugarsG,
        double proteinG
) {}
