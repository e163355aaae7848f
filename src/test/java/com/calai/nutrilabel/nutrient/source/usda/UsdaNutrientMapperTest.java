package com.calai.nutrilabel.nutrient.source.usda;

import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class UsdaNutrientMapperTest {

    private final ObjectMapper om = new ObjectMapper();

    private Map<NutrientKey, Double> map(String json) throws Exception {
        return UsdaNutrientMapper.map(om.readTree(json));
    }

    @Test
    void maps_by_nutrient_number_with_unit_conversion() throws Exception {
        Map<NutrientKey, Double> out = map("""
                {"foodNutrients":[
                  {"nutrient":{"number":"203","name":"Protein","unitName":"g"},"amount":20.5},
                  {"nutrient":{"number":"307","name":"Sodium, Na","unitName":"g"},"amount":0.12},
                  {"nutrient":{"number":"324","name":"Vitamin D (D2 + D3), International Units","unitName":"IU"},"amount":40}
                ]}
                """);

        assertThat(out.get(NutrientKey.PROTEIN_G)).isCloseTo(20.5, within(1e-9));
        assertThat(out.get(NutrientKey.SODIUM_MG)).isCloseTo(120.0, within(1e-9));
        assertThat(out.get(NutrientKey.VITAMIN_D_MCG)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void search_result_shape_falls_back_to_name_patterns() throws Exception {
        Map<NutrientKey, Double> out = map("""
                {"foodNutrients":[
                  {"nutrientName":"Total lipid (fat)","unitName":"G","value":7.1},
                  {"nutrientName":"Carbohydrate, by difference","unitName":"G","value":12},
                  {"nutrientName":"Fiber, total dietary","unitName":"G","value":"2.5"}
                ]}
                """);

        assertThat(out)
                .containsEntry(NutrientKey.FAT_G, 7.1)
                .containsEntry(NutrientKey.CARB_G, 12.0)
                .containsEntry(NutrientKey.FIBER_G, 2.5);
    }

    @Test
    void omega_totals_are_summed_from_fatty_acid_components() throws Exception {
        Map<NutrientKey, Double> out = map("""
                {"foodNutrients":[
                  {"nutrient":{"number":"851","name":"PUFA 18:3 n-3 c,c,c (ALA)","unitName":"g"},"amount":0.2},
                  {"nutrient":{"number":"629","name":"PUFA 20:5 n-3 (EPA)","unitName":"mg"},"amount":300},
                  {"nutrient":{"number":"675","name":"PUFA 18:2 n-6 c,c","unitName":"g"},"amount":1.5}
                ]}
                """);

        assertThat(out.get(NutrientKey.OMEGA3_G)).isCloseTo(0.5, within(1e-9));
        assertThat(out.get(NutrientKey.OMEGA6_G)).isCloseTo(1.5, within(1e-9));
    }

    @Test
    void explicit_kcal_row_wins_over_earlier_energy_row() throws Exception {
        Map<NutrientKey, Double> out = map("""
                {"foodNutrients":[
                  {"nutrient":{"number":"208","name":"Energy","unitName":"kJ"},"amount":836.8},
                  {"nutrient":{"number":"1008","name":"Energy","unitName":"kcal"},"amount":201}
                ]}
                """);

        assertThat(out.get(NutrientKey.KCAL)).isCloseTo(201.0, within(1e-9));
    }

    @Test
    void rows_without_amount_or_with_negative_value_are_ignored() throws Exception {
        Map<NutrientKey, Double> out = map("""
                {"foodNutrients":[
                  {"nutrient":{"number":"203","name":"Protein","unitName":"g"}},
                  {"nutrient":{"number":"204","name":"Total lipid (fat)","unitName":"g"},"amount":-3}
                ]}
                """);

        assertThat(out).isEmpty();
        assertThat(UsdaNutrientMapper.map(null)).isEmpty();
    }
}
