package com.calai.nutrilabel.label.lineage;

import com.calai.nutrilabel.label.compute.ComputedLabel;
import com.calai.nutrilabel.label.compute.DeclaredIngredient;
import com.calai.nutrilabel.label.compute.LabelComputationEngine;
import com.calai.nutrilabel.label.compute.LabelProperties;
import com.calai.nutrilabel.label.compute.NutrientContribution;
import com.calai.nutrilabel.label.entity.InventoryLotEntity;
import com.calai.nutrilabel.label.entity.LotConsumptionEntity;
import com.calai.nutrilabel.label.entity.MealServiceEventEntity;
import com.calai.nutrilabel.label.entity.RecipeEntity;
import com.calai.nutrilabel.label.entity.RecipeLineEntity;
import com.calai.nutrilabel.label.evidence.EvidenceRow;
import com.calai.nutrilabel.label.repo.InventoryLotRepository;
import com.calai.nutrilabel.label.repo.LotConsumptionRepository;
import com.calai.nutrilabel.label.repo.RecipeLineRepository;
import com.calai.nutrilabel.label.repo.RecipeRepository;
import com.calai.nutrilabel.label.repo.SkuRepository;
import com.calai.nutrilabel.nutrient.entity.IngredientCatalogEntity;
import com.calai.nutrilabel.nutrient.entity.ProductCatalogEntity;
import com.calai.nutrilabel.nutrient.entity.ProductNutrientValueEntity;
import com.calai.nutrilabel.nutrient.model.EvidenceGrade;
import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.SourceType;
import com.calai.nutrilabel.nutrient.model.VerificationStatus;
import com.calai.nutrilabel.nutrient.repo.IngredientCatalogRepository;
import com.calai.nutrilabel.nutrient.repo.ProductCatalogRepository;
import com.calai.nutrilabel.nutrient.repo.ProductNutrientValueRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.calai.nutrilabel.label.lineage.LineageFixtures.event;
import static com.calai.nutrilabel.label.lineage.LineageFixtures.sku;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConsumedLotLoaderTest {

    private SkuRepository skuRepo;
    private RecipeRepository recipeRepo;
    private RecipeLineRepository lineRepo;
    private LotConsumptionRepository consumptionRepo;
    private InventoryLotRepository lotRepo;
    private ProductCatalogRepository productRepo;
    private IngredientCatalogRepository ingredientRepo;
    private ProductNutrientValueRepository valueRepo;
    private ConsumedLotLoader loader;

    private final MealServiceEventEntity event = event("evt-1", 2, null);

    @BeforeEach
    void setUp() {
        skuRepo = mock(SkuRepository.class);
        recipeRepo = mock(RecipeRepository.class);
        lineRepo = mock(RecipeLineRepository.class);
        consumptionRepo = mock(LotConsumptionRepository.class);
        lotRepo = mock(InventoryLotRepository.class);
        productRepo = mock(ProductCatalogRepository.class);
        ingredientRepo = mock(IngredientCatalogRepository.class);
        valueRepo = mock(ProductNutrientValueRepository.class);
        loader = new ConsumedLotLoader(skuRepo, recipeRepo, lineRepo, consumptionRepo, lotRepo,
                productRepo, ingredientRepo, valueRepo);

        when(skuRepo.findById("sku-1")).thenReturn(Optional.of(sku()));
        RecipeEntity recipe = new RecipeEntity();
        recipe.setId("recipe-1");
        recipe.setSkuId("sku-1");
        when(recipeRepo.findFirstBySkuIdAndActiveTrueOrderByUpdatedAtUtcDesc("sku-1")).thenReturn(Optional.of(recipe));
    }

    private static RecipeLineEntity line(String id, String ingredientId, double target) {
        RecipeLineEntity l = new RecipeLineEntity();
        l.setId(id);
        l.setRecipeId("recipe-1");
        l.setIngredientId(ingredientId);
        l.setTargetGPerServing(target);
        return l;
    }

    private static LotConsumptionEntity consumption(String lineId, String lotId, double grams) {
        LotConsumptionEntity c = new LotConsumptionEntity();
        c.setId("c-" + lotId);
        c.setMealServiceEventId("evt-1");
        c.setRecipeLineId(lineId);
        c.setInventoryLotId(lotId);
        c.setGramsConsumed(grams);
        return c;
    }

    private static InventoryLotEntity lot(String id, String productId, String code) {
        InventoryLotEntity l = new InventoryLotEntity();
        l.setId(id);
        l.setOrganizationId("org-1");
        l.setProductId(productId);
        l.setLotCode(code);
        l.setSourceOrderRef("PO-9");
        return l;
    }

    private static ProductCatalogEntity product(String id, String ingredientId, String vendor, String upc) {
        ProductCatalogEntity p = new ProductCatalogEntity();
        p.setId(id);
        p.setOrganizationId("org-1");
        p.setIngredientId(ingredientId);
        p.setName("Product " + id);
        p.setVendor(vendor);
        p.setUpc(upc);
        return p;
    }

    private static IngredientCatalogEntity ingredient(String id, String name, String... allergenTags) {
        IngredientCatalogEntity i = new IngredientCatalogEntity();
        i.setId(id);
        i.setName(name);
        i.setAllergenTags(List.of(allergenTags));
        return i;
    }

    private static ProductNutrientValueEntity value(String productId, NutrientKey key, Double v, VerificationStatus status) {
        ProductNutrientValueEntity e = new ProductNutrientValueEntity();
        e.setProductId(productId);
        e.setNutrientKey(key.key());
        e.setValuePer100g(v);
        e.setSourceType(SourceType.MANUAL);
        e.setSourceRef("manual:" + productId);
        e.setEvidenceGrade(EvidenceGrade.VERIFIED_MANUAL);
        e.setVerificationStatus(status);
        return e;
    }

    @Test
    void loads_lots_with_nutrients_and_evidence() throws Exception {
        when(lineRepo.findByRecipeIdOrderByLineOrderAsc("recipe-1")).thenReturn(List.of(line("line-1", "ing-chicken", 150)));
        when(consumptionRepo.findByMealServiceEventId("evt-1")).thenReturn(List.of(consumption("line-1", "lot-1", 300)));
        when(lotRepo.findAllById(any())).thenReturn(List.of(lot("lot-1", "prod-1", "C-1")));
        when(productRepo.findAllById(any())).thenReturn(List.of(product("prod-1", "ing-chicken", "Sysco", "012345678905")));
        IngredientCatalogEntity chicken = new IngredientCatalogEntity();
        chicken.setId("ing-chicken");
        chicken.setName("Chicken");
        chicken.setAllergenTags(List.of());
        when(ingredientRepo.findAllById(any())).thenReturn(List.of(chicken));
        when(valueRepo.findByProductIdIn(any())).thenReturn(List.of(
                value("prod-1", NutrientKey.KCAL, 165.0, VerificationStatus.VERIFIED),
                value("prod-1", NutrientKey.SODIUM_MG, 900.0, VerificationStatus.REJECTED),
                value("prod-1", NutrientKey.FAT_G, null, VerificationStatus.NEEDS_REVIEW)));

        EventLabelInput input = loader.load(event);

        assertThat(input.recipeId()).isEqualTo("recipe-1");
        assertThat(input.sku().getCode()).isEqualTo("BOWL-01");
        ConsumedLot l = input.lots().get(0);
        assertThat(l.ingredientName()).isEqualTo("Chicken");
        assertThat(l.grams()).isEqualTo(300.0);
        assertThat(l.lotCode()).isEqualTo("C-1");
        assertThat(l.sourceOrderRef()).isEqualTo("PO-9");
        assertThat(l.syntheticLot()).isFalse();
        assertThat(l.per100g()).containsOnlyKeys(NutrientKey.KCAL);
        assertThat(l.evidence()).hasSize(3)
                .extracting(EvidenceRow::verificationStatus)
                .contains(VerificationStatus.REJECTED);
    }

    @Test
    void synthetic_product_without_values_still_leaves_evidence() throws Exception {
        when(lineRepo.findByRecipeIdOrderByLineOrderAsc("recipe-1")).thenReturn(List.of(line("line-1", "ing-x", 10)));
        when(consumptionRepo.findByMealServiceEventId("evt-1")).thenReturn(List.of(consumption("line-9", "lot-1", 50)));
        when(lotRepo.findAllById(any())).thenReturn(List.of(lot("lot-1", "prod-s", null)));
        when(productRepo.findAllById(any())).thenReturn(List.of(product("prod-s", "ing-y", ConsumedLot.SYNTHETIC_VENDOR, null)));
        when(ingredientRepo.findAllById(any())).thenReturn(List.of());
        when(valueRepo.findByProductIdIn(any())).thenReturn(List.of());

        ConsumedLot l = loader.load(event).lots().get(0);

        // recipe line 對不上 → 用產品的 ingredient
        assertThat(l.ingredientId()).isEqualTo("ing-y");
        assertThat(l.ingredientName()).isEqualTo("ing-y");
        assertThat(l.syntheticLot()).isTrue();
        assertThat(l.evidence()).singleElement().satisfies(r -> assertThat(r.syntheticLot()).isTrue());
    }

    @Test
    void declaration_covers_recipe_lines_without_consumption() throws Exception {
        when(lineRepo.findByRecipeIdOrderByLineOrderAsc("recipe-1")).thenReturn(List.of(
                line("line-1", "ing-chicken", 150), line("line-2", "ing-cheddar", 30)));
        when(consumptionRepo.findByMealServiceEventId("evt-1")).thenReturn(List.of(consumption("line-1", "lot-1", 300)));
        when(lotRepo.findAllById(any())).thenReturn(List.of(lot("lot-1", "prod-1", "C-1")));
        when(productRepo.findAllById(any())).thenReturn(List.of(product("prod-1", "ing-chicken", "Sysco", "012345678905")));
        when(ingredientRepo.findAllById(any())).thenReturn(List.of(
                ingredient("ing-chicken", "Chicken"), ingredient("ing-cheddar", "Cheddar", "milk")));
        when(valueRepo.findByProductIdIn(any())).thenReturn(List.of(
                value("prod-1", NutrientKey.KCAL, 165.0, VerificationStatus.VERIFIED)));

        EventLabelInput input = loader.load(event);

        assertThat(input.lots()).extracting(ConsumedLot::ingredientName).containsExactly("Chicken");
        assertThat(input.declaredIngredients()).containsExactly(
                new DeclaredIngredient("Chicken", 150, List.of()),
                new DeclaredIngredient("Cheddar", 30, List.of("milk")));

        ComputedLabel label = new LabelComputationEngine(new LabelProperties(null, "label-agent"))
                .compute(List.of(new NutrientContribution(input.lots().get(0).per100g(), 300)),
                        event.getPlannedServings(), input.declaredIngredients());
        assertThat(label.ingredientDeclaration()).isEqualTo("Ingredients: Chicken, Cheddar");
        assertThat(label.allergenStatement()).isEqualTo("Contains: milk");
    }

    @Test
    void lot_ingredient_follows_product_when_recipe_line_disagrees() throws Exception {
        when(lineRepo.findByRecipeIdOrderByLineOrderAsc("recipe-1")).thenReturn(List.of(line("line-1", "ing-chicken", 150)));
        when(consumptionRepo.findByMealServiceEventId("evt-1")).thenReturn(List.of(consumption("line-1", "lot-1", 120)));
        when(lotRepo.findAllById(any())).thenReturn(List.of(lot("lot-1", "prod-t", "T-1")));
        when(productRepo.findAllById(any())).thenReturn(List.of(product("prod-t", "ing-turkey", "Sysco", "036000291452")));
        when(ingredientRepo.findAllById(any())).thenReturn(List.of(
                ingredient("ing-chicken", "Chicken"), ingredient("ing-turkey", "Turkey", "soy")));
        when(valueRepo.findByProductIdIn(any())).thenReturn(List.of());

        EventLabelInput input = loader.load(event);

        ConsumedLot l = input.lots().get(0);
        assertThat(l.ingredientId()).isEqualTo("ing-turkey");
        assertThat(l.ingredientName()).isEqualTo("Turkey");
        assertThat(l.allergenTags()).containsExactly("soy");
        // 聲明仍照 recipe line
        assertThat(input.declaredIngredients()).extracting(DeclaredIngredient::name).containsExactly("Chicken");
    }

    @Test
    void missing_sku_recipe_lines_or_consumptions_are_coded() {
        MealServiceEventEntity orphan = event("evt-x", 1, null);
        orphan.setSkuId("sku-x");
        when(skuRepo.findById("sku-x")).thenReturn(Optional.empty());
        assertThatThrownBy(() -> loader.load(orphan))
                .isInstanceOfSatisfying(LabelRefreshException.class, e -> assertThat(e.getCode()).isEqualTo("SKU_NOT_FOUND"));

        when(lineRepo.findByRecipeIdOrderByLineOrderAsc("recipe-1")).thenReturn(List.of());
        assertThatThrownBy(() -> loader.load(event))
                .isInstanceOfSatisfying(LabelRefreshException.class, e -> assertThat(e.getCode()).isEqualTo("NO_RECIPE_LINES"));

        when(lineRepo.findByRecipeIdOrderByLineOrderAsc("recipe-1")).thenReturn(List.of(line("line-1", "ing-chicken", 150)));
        when(consumptionRepo.findByMealServiceEventId("evt-1")).thenReturn(List.of());
        assertThatThrownBy(() -> loader.load(event))
                .isInstanceOfSatisfying(LabelRefreshException.class, e -> assertThat(e.getCode()).isEqualTo("NO_LOT_CONSUMPTIONS"));

        when(recipeRepo.findFirstBySkuIdAndActiveTrueOrderByUpdatedAtUtcDesc("sku-1")).thenReturn(Optional.empty());
        assertThatThrownBy(() -> loader.load(event))
                .isInstanceOfSatisfying(LabelRefreshException.class, e -> assertThat(e.getCode()).isEqualTo("NO_ACTIVE_RECIPE"));
    }

    @Test
    void consumption_pointing_at_unknown_lot_is_coded() {
        when(lineRepo.findByRecipeIdOrderByLineOrderAsc("recipe-1")).thenReturn(List.of(line("line-1", "ing-chicken", 150)));
        when(consumptionRepo.findByMealServiceEventId("evt-1")).thenReturn(List.of(consumption("line-1", "lot-gone", 10)));
        when(lotRepo.findAllById(any())).thenReturn(List.of());
        when(productRepo.findAllById(any())).thenReturn(List.of());
        when(ingredientRepo.findAllById(any())).thenReturn(List.of());

        assertThatThrownBy(() -> loader.load(event))
                .isInstanceOfSatisfying(LabelRefreshException.class, e -> assertThat(e.getCode()).isEqualTo("LOT_NOT_FOUND"));
    }
}
