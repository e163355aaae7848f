package com.calai.nutrilabel.label.lineage;

import com.calai.nutrilabel.label.compute.DeclaredIngredient;
import com.calai.nutrilabel.label.entity.InventoryLotEntity;
import com.calai.nutrilabel.label.entity.LotConsumptionEntity;
import com.calai.nutrilabel.label.entity.MealServiceEventEntity;
import com.calai.nutrilabel.label.entity.RecipeEntity;
import com.calai.nutrilabel.label.entity.RecipeLineEntity;
import com.calai.nutrilabel.label.entity.SkuEntity;
import com.calai.nutrilabel.label.evidence.EvidenceRow;
import com.calai.nutrilabel.label.repo.InventoryLotRepository;
import com.calai.nutrilabel.label.repo.LotConsumptionRepository;
import com.calai.nutrilabel.label.repo.RecipeLineRepository;
import com.calai.nutrilabel.label.repo.RecipeRepository;
import com.calai.nutrilabel.label.repo.SkuRepository;
import com.calai.nutrilabel.nutrient.entity.IngredientCatalogEntity;
import com.calai.nutrilabel.nutrient.entity.ProductCatalogEntity;
import com.calai.nutrilabel.nutrient.entity.ProductNutrientValueEntity;
import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.VerificationStatus;
import com.calai.nutrilabel.nutrient.repo.IngredientCatalogRepository;
import com.calai.nutrilabel.nutrient.repo.ProductCatalogRepository;
import com.calai.nutrilabel.nutrient.repo.ProductNutrientValueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 出餐 → 消耗 lot 清單（含 per 100g 營養值 / 證據列）
 * - REJECTED 的值不進營養計算，但仍算在證據裡
 * - 成分聲明 / 過敏原來自 recipe line，不只是有消耗的 lot
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConsumedLotLoader {

    private final SkuRepository skuRepo;
    private final RecipeRepository recipeRepo;
    private final RecipeLineRepository lineRepo;
    private final LotConsumptionRepository consumptionRepo;
    private final InventoryLotRepository lotRepo;
    private final ProductCatalogRepository productRepo;
    private final IngredientCatalogRepository ingredientRepo;
    private final ProductNutrientValueRepository valueRepo;

    public EventLabelInput load(MealServiceEventEntity event) throws LabelRefreshException {
        SkuEntity sku = skuRepo.findById(event.getSkuId())
                .orElseThrow(() -> new LabelRefreshException("SKU_NOT_FOUND", "sku not found: " + event.getSkuId()));

        RecipeEntity recipe = recipeRepo.findFirstBySkuIdAndActiveTrueOrderByUpdatedAtUtcDesc(sku.getId())
                .orElseThrow(() -> new LabelRefreshException("NO_ACTIVE_RECIPE", "no active recipe for sku " + sku.getCode()));

        List<RecipeLineEntity> lines = lineRepo.findByRecipeIdOrderByLineOrderAsc(recipe.getId());
        if (lines.isEmpty()) {
            throw new LabelRefreshException("NO_RECIPE_LINES", "recipe has no lines: " + recipe.getId());
        }

        List<LotConsumptionEntity> consumptions = consumptionRepo.findByMealServiceEventId(event.getId());
        if (consumptions.isEmpty()) {
            throw new LabelRefreshException("NO_LOT_CONSUMPTIONS", "no lot consumptions for event " + event.getId());
        }

        Map<String, RecipeLineEntity> lineById = lines.stream()
                .collect(Collectors.toMap(RecipeLineEntity::getId, Function.identity()));

        Set<String> lotIds = consumptions.stream().map(LotConsumptionEntity::getInventoryLotId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, InventoryLotEntity> lotById = lotRepo.findAllById(lotIds).stream()
                .collect(Collectors.toMap(InventoryLotEntity::getId, Function.identity()));

        Set<String> productIds = lotById.values().stream().map(InventoryLotEntity::getProductId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, ProductCatalogEntity> productById = productRepo.findAllById(productIds).stream()
                .collect(Collectors.toMap(ProductCatalogEntity::getId, Function.identity()));

        Set<String> ingredientIds = new LinkedHashSet<>();
        lines.forEach(l -> ingredientIds.add(l.getIngredientId()));
        productById.values().forEach(p -> ingredientIds.add(p.getIngredientId()));
        Map<String, IngredientCatalogEntity> ingredientById = ingredientRepo.findAllById(ingredientIds).stream()
                .collect(Collectors.toMap(IngredientCatalogEntity::getId, Function.identity()));

        Map<String, List<ProductNutrientValueEntity>> valuesByProduct = new HashMap<>();
        if (!productIds.isEmpty()) {
            for (ProductNutrientValueEntity v : valueRepo.findByProductIdIn(productIds)) {
                valuesByProduct.computeIfAbsent(v.getProductId(), k -> new ArrayList<>()).add(v);
            }
        }

        List<ConsumedLot> out = new ArrayList<>();
        for (LotConsumptionEntity c : consumptions) {
            InventoryLotEntity lot = lotById.get(c.getInventoryLotId());
            if (lot == null) {
                throw new LabelRefreshException("LOT_NOT_FOUND", "inventory lot not found: " + c.getInventoryLotId());
            }
            ProductCatalogEntity product = productById.get(lot.getProductId());
            if (product == null) {
                throw new LabelRefreshException("PRODUCT_NOT_FOUND", "product not found for lot " + lot.getId());
            }

            // ingredient 以 lot 的產品為準；recipe line 對不上只記 warn
            String ingredientId = product.getIngredientId();
            RecipeLineEntity line = lineById.get(c.getRecipeLineId());
            if (line != null && !ingredientId.equals(line.getIngredientId())) {
                log.warn("lot ingredient differs from recipe line eventId={} lotId={} productIngredient={} lineIngredient={}",
                        event.getId(), lot.getId(), ingredientId, line.getIngredientId());
            }
            IngredientCatalogEntity ingredient = ingredientById.get(ingredientId);

            boolean synthetic = ConsumedLot.isSynthetic(product.getVendor(), product.getUpc());
            List<ProductNutrientValueEntity> rows = valuesByProduct.getOrDefault(product.getId(), List.of());

            out.add(new ConsumedLot(
                    ingredientId,
                    ingredient == null ? ingredientId : ingredient.getName(),
                    ingredient == null ? List.of() : ingredient.getAllergenTags(),
                    product.getId(),
                    product.getName(),
                    product.getBrand(),
                    product.getUpc(),
                    product.getVendor(),
                    lot.getId(),
                    lot.getLotCode(),
                    lot.getSourceOrderRef(),
                    c.getGramsConsumed(),
                    per100g(rows),
                    evidence(rows, synthetic),
                    synthetic
            ));
        }

        return new EventLabelInput(event, sku, recipe.getId(), out, declared(lines, ingredientById));
    }

    /**
     * 成分聲明 / 過敏原用「全部」recipe line（沒有消耗紀錄的 line 也算）
     */
    static List<DeclaredIngredient> declared(List<RecipeLineEntity> lines,
                                             Map<String, IngredientCatalogEntity> ingredientById) {
        List<DeclaredIngredient> out = new ArrayList<>(lines.size());
        for (RecipeLineEntity l : lines) {
            IngredientCatalogEntity ingredient = ingredientById.get(l.getIngredientId());
            out.add(new DeclaredIngredient(
                    ingredient == null ? l.getIngredientId() : ingredient.getName(),
                    l.getTargetGPerServing(),
                    ingredient == null ? List.of() : ingredient.getAllergenTags()
            ));
        }
        return out;
    }

    static Map<NutrientKey, Double> per100g(List<ProductNutrientValueEntity> rows) {
        Map<NutrientKey, Double> out = new EnumMap<>(NutrientKey.class);
        for (ProductNutrientValueEntity r : rows) {
            NutrientKey key = NutrientKey.fromKeyOrNull(r.getNutrientKey());
            if (key == null || r.getValuePer100g() == null) continue;
            if (r.getVerificationStatus() == VerificationStatus.REJECTED) continue;
            out.put(key, r.getValuePer100g());
        }
        return out;
    }

    static List<EvidenceRow> evidence(List<ProductNutrientValueEntity> rows, boolean syntheticLot) {
        List<EvidenceRow> out = new ArrayList<>(rows.size());
        for (ProductNutrientValueEntity r : rows) {
            out.add(new EvidenceRow(r.getEvidenceGrade(), r.getVerificationStatus(),
                    r.isHistoricalException(), r.getSourceRef(), syntheticLot));
        }
        // 沒有任何營養列的 synthetic lot 也要留下痕跡
        if (out.isEmpty() && syntheticLot) {
            out.add(new EvidenceRow(null, null, false, null, true));
        }
        return out;
    }
}
