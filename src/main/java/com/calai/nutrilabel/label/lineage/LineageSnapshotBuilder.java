package com.calai.nutrilabel.label.lineage;

import com.calai.nutrilabel.label.compute.ComputedLabel;
import com.calai.nutrilabel.label.compute.LabelComputationEngine;
import com.calai.nutrilabel.label.compute.LabelProperties;
import com.calai.nutrilabel.label.compute.NutrientContribution;
import com.calai.nutrilabel.label.compute.PlausibilityChecker;
import com.calai.nutrilabel.label.entity.LabelSnapshotEntity;
import com.calai.nutrilabel.label.entity.LabelType;
import com.calai.nutrilabel.label.entity.LineageEdgeType;
import com.calai.nutrilabel.label.entity.MealServiceEventEntity;
import com.calai.nutrilabel.label.entity.SkuEntity;
import com.calai.nutrilabel.label.evidence.EvidenceAggregator;
import com.calai.nutrilabel.label.evidence.EvidenceRow;
import com.calai.nutrilabel.label.evidence.EvidenceSummary;
import com.calai.nutrilabel.label.evidence.ReasonCode;
import com.calai.nutrilabel.label.repo.MealServiceEventRepository;
import com.calai.nutrilabel.nutrient.entity.VerificationTaskEntity;
import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.repo.VerificationTaskRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 出餐 → SKU / INGREDIENT / PRODUCT / LOT snapshot + lineage edge
 * 1) SKU snapshot（標示 + 全部原始證據列彙總 + plausibility）
 * 2) 依 ingredient 分組（名稱排序）→ INGREDIENT snapshot + SKU→INGREDIENT
 * 3) 組內依 product 分組 → PRODUCT snapshot + INGREDIENT→PRODUCT
 * 4) 組內依 lot 分組（克數加總）→ LOT snapshot + PRODUCT→LOT
 * 5) event 改指向新的 SKU snapshot
 * ✅ 每層證據都從原始列重算，不拿子節點 summary 再加總
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LineageSnapshotBuilder {

    private final LabelComputationEngine engine;
    private final PlausibilityChecker plausibility;
    private final LabelSnapshotWriter writer;
    private final MealServiceEventRepository eventRepo;
    private final VerificationTaskRepository taskRepo;
    private final LabelProperties props;
    private final ObjectMapper om;

    public LineageResult build(EventLabelInput input, Instant frozenAt) {
        MealServiceEventEntity event = input.event();
        SkuEntity sku = input.sku();
        String orgId = event.getOrganizationId();
        String createdBy = props.createdByOrDefault();
        List<ConsumedLot> lots = input.lots();
        double servings = LabelComputationEngine.servingsOrOne(event.getPlannedServings());

        List<Group<ConsumedLot>> ingredientGroups = groupBy(lots, ConsumedLot::ingredientId,
                Comparator.comparing((Group<ConsumedLot> g) -> nullToEmpty(g.first().ingredientName()))
                        .thenComparing(Group::key));

        // ===== SKU =====
        ComputedLabel label = engine.compute(contributions(lots), servings, input.declaredIngredients());
        PlausibilityChecker.Report report = plausibility.check(label.perServing());
        EvidenceSummary skuEvidence = EvidenceAggregator.aggregate(rows(lots))
                .withReasonCodes(plausibilityCodes(report));

        ObjectNode skuPayload = skuPayload(label, report, skuEvidence);
        LabelSnapshotEntity skuSnap = writer.insert(orgId, LabelType.SKU, sku.getId(),
                sku.getCode() + " - " + sku.getName(), skuPayload, createdBy, frozenAt);
        int created = 1;

        if (report.errorCount() > 0) {
            openPlausibilityTask(orgId, sku, skuSnap, report, createdBy);
        }

        // ===== INGREDIENT → PRODUCT → LOT =====
        for (Group<ConsumedLot> ig : ingredientGroups) {
            ConsumedLot head = ig.first();
            Map<NutrientKey, Double> totals = LabelComputationEngine.totals(contributions(ig.items()));
            EvidenceSummary ingEvidence = EvidenceAggregator.aggregate(rows(ig.items()));

            ObjectNode p = om.createObjectNode();
            p.put("ingredientId", head.ingredientId());
            p.put("ingredientName", head.ingredientName());
            p.put("consumedGrams", grams(ig.items()));
            p.set("allergenTags", om.valueToTree(head.allergenTags()));
            p.set("nutrientsTotal", nutrients(totals));
            p.set("nutrientsPerServing", nutrients(LabelComputationEngine.divide(totals, servings)));
            putEvidence(p, ingEvidence);
            p.put("provisional", ingEvidence.provisional());

            LabelSnapshotEntity ingSnap = writer.insert(orgId, LabelType.INGREDIENT, head.ingredientId(),
                    nullToEmpty(head.ingredientName()), p, createdBy, frozenAt);
            writer.link(skuSnap, ingSnap, LineageEdgeType.SKU_CONTAINS_INGREDIENT);
            created++;

            List<Group<ConsumedLot>> productGroups = groupBy(ig.items(), ConsumedLot::productId,
                    Comparator.comparing((Group<ConsumedLot> g) -> nullToEmpty(g.first().productName()))
                            .thenComparing(Group::key));

            for (Group<ConsumedLot> pg : productGroups) {
                LabelSnapshotEntity prodSnap = insertProduct(orgId, pg, createdBy, frozenAt);
                writer.link(ingSnap, prodSnap, LineageEdgeType.INGREDIENT_RESOLVED_TO_PRODUCT);
                created++;

                List<Group<ConsumedLot>> lotGroups = groupBy(pg.items(), ConsumedLot::lotId,
                        Comparator.comparing((Group<ConsumedLot> g) -> nullToEmpty(g.first().lotCode()))
                                .thenComparing(Group::key));

                for (Group<ConsumedLot> lg : lotGroups) {
                    LabelSnapshotEntity lotSnap = insertLot(orgId, lg, createdBy, frozenAt);
                    writer.link(prodSnap, lotSnap, LineageEdgeType.PRODUCT_CONSUMED_FROM_LOT);
                    created++;
                }
            }
        }

        // ===== repoint =====
        String prior = event.getFinalLabelSnapshotId();
        event.setFinalLabelSnapshotId(skuSnap.getId());
        eventRepo.save(event);

        int distinctLots = (int) lots.stream().map(ConsumedLot::lotId).distinct().count();
        log.info("label lineage built eventId={} sku={} labelId={} version={} snapshots={} provisional={} qaPass={}",
                event.getId(), sku.getCode(), skuSnap.getId(), skuSnap.getVersion(), created,
                skuEvidence.provisional(), label.qa().pass());

        return new LineageResult(event.getId(), prior, skuSnap.getId(), distinctLots, created,
                skuEvidence.provisional(), label.qa().pass());
    }

    private LabelSnapshotEntity insertProduct(String orgId, Group<ConsumedLot> pg, String createdBy, Instant frozenAt) {
        ConsumedLot head = pg.first();
        List<EvidenceRow> rows = rows(pg.items());
        EvidenceSummary ev = EvidenceAggregator.aggregate(rows);

        ObjectNode p = om.createObjectNode();
        p.put("productId", head.productId());
        p.put("productName", head.productName());
        p.put("brand", head.brand());
        p.put("upc", head.upc());
        p.put("vendor", head.vendor());
        p.set("nutrientsPer100g", nutrients(head.per100g()));
        putEvidence(p, ev);
        p.set("verificationStatusSummary", om.valueToTree(EvidenceAggregator.verificationStatusSummary(rows)));
        p.put("provisional", ev.provisional());

        return writer.insert(orgId, LabelType.PRODUCT, head.productId(),
                nullToEmpty(head.productName()), p, createdBy, frozenAt);
    }

    private LabelSnapshotEntity insertLot(String orgId, Group<ConsumedLot> lg, String createdBy, Instant frozenAt) {
        ConsumedLot head = lg.first();
        List<EvidenceRow> rows = rows(lg.items());
        EvidenceSummary ev = EvidenceAggregator.aggregate(rows);

        ObjectNode p = om.createObjectNode();
        p.put("lotId", head.lotId());
        p.put("lotCode", head.lotCode());
        p.put("productId", head.productId());
        p.put("productName", head.productName());
        p.put("sourceOrderRef", head.sourceOrderRef());
        p.put("gramsConsumed", grams(lg.items()));
        p.set("nutrientsPer100g", nutrients(head.per100g()));
        putEvidence(p, ev);
        p.set("verificationStatusSummary", om.valueToTree(EvidenceAggregator.verificationStatusSummary(rows)));
        p.put("syntheticLot", head.syntheticLot());
        p.put("provisional", ev.provisional());

        String title = "Lot " + (head.lotCode() == null || head.lotCode().isBlank() ? head.lotId() : head.lotCode());
        return writer.insert(orgId, LabelType.LOT, head.lotId(), title, p, createdBy, frozenAt);
    }

    private ObjectNode skuPayload(ComputedLabel label, PlausibilityChecker.Report report, EvidenceSummary ev) {
        ObjectNode p = om.createObjectNode();
        p.put("servings", label.servings());
        p.put("servingWeightG", label.servingWeightG());
        p.set("perServing", nutrients(label.perServing()));
        p.set("roundedFda", om.valueToTree(label.roundedFda()));
        p.put("ingredientDeclaration", label.ingredientDeclaration());
        p.put("allergenStatement", label.allergenStatement());
        p.set("qa", om.valueToTree(label.qa()));
        p.put("provisional", ev.provisional());
        p.set("reasonCodes", om.valueToTree(ev.reasonCodeNames()));
        p.set("evidenceSummary", om.valueToTree(ev));
        p.set("plausibility", om.valueToTree(report));
        return p;
    }

    private void putEvidence(ObjectNode p, EvidenceSummary ev) {
        p.set("evidenceSummary", om.valueToTree(ev));
        p.set("reasonCodes", om.valueToTree(ev.reasonCodeNames()));
        p.set("sourceRefs", om.valueToTree(ev.sourceRefs()));
        p.set("gradeBreakdown", om.valueToTree(ev.gradeBreakdown()));
    }

    private ObjectNode nutrients(Map<NutrientKey, Double> m) {
        ObjectNode n = om.createObjectNode();
        for (NutrientKey k : NutrientKey.values()) {
            Double v = m.get(k);
            if (v != null) n.put(k.key(), v);
        }
        return n;
    }

    private void openPlausibilityTask(String orgId, SkuEntity sku, LabelSnapshotEntity skuSnap,
                                      PlausibilityChecker.Report report, String createdBy) {
        List<String> messages = report.issues().stream()
                .filter(i -> i.severity() == PlausibilityChecker.Severity.ERROR)
                .map(PlausibilityChecker.Issue::message)
                .toList();

        ObjectNode payload = om.createObjectNode();
        payload.put("labelSnapshotId", skuSnap.getId());
        payload.put("skuId", sku.getId());
        payload.put("skuName", sku.getName());
        ArrayNode issues = payload.putArray("issues");
        report.issues().stream()
                .filter(i -> i.severity() == PlausibilityChecker.Severity.ERROR)
                .forEach(i -> issues.add(om.valueToTree(i)));

        VerificationTaskEntity task = new VerificationTaskEntity();
        task.setOrganizationId(orgId);
        task.setTaskType(VerificationTaskEntity.TaskType.CONSISTENCY);
        task.setSeverity(VerificationTaskEntity.Severity.CRITICAL);
        task.setStatus(VerificationTaskEntity.Status.OPEN);
        task.setTitle("Plausibility errors: " + sku.getName());
        task.setDescription(String.join("; ", messages));
        task.setPayload(payload);
        task.setCreatedBy(createdBy);
        taskRepo.save(task);

        log.warn("label plausibility errors sku={} labelId={} errors={}", sku.getCode(), skuSnap.getId(), report.errorCount());
    }

    // ===== helpers =====

    static Set<ReasonCode> plausibilityCodes(PlausibilityChecker.Report report) {
        Set<ReasonCode> codes = EnumSet.noneOf(ReasonCode.class);
        if (report.errorCount() > 0) codes.add(ReasonCode.PLAUSIBILITY_ERROR);
        if (report.warningCount() > 0) codes.add(ReasonCode.PLAUSIBILITY_WARNING);
        return codes;
    }

    static List<NutrientContribution> contributions(List<ConsumedLot> lots) {
        List<NutrientContribution> out = new ArrayList<>(lots.size());
        for (ConsumedLot l : lots) out.add(new NutrientContribution(l.per100g(), l.grams()));
        return out;
    }

    static List<EvidenceRow> rows(List<ConsumedLot> lots) {
        List<EvidenceRow> out = new ArrayList<>();
        for (ConsumedLot l : lots) out.addAll(l.evidence());
        return out;
    }

    private static double grams(List<ConsumedLot> lots) {
        double sum = 0;
        for (ConsumedLot l : lots) sum += l.grams();
        return sum;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    record Group<T>(String key, List<T> items) {
        T first() {
            return items.get(0);
        }
    }

    static <T> List<Group<T>> groupBy(List<T> items, Function<T, String> keyFn, Comparator<Group<T>> order) {
        Map<String, List<T>> m = new LinkedHashMap<>();
        for (T t : items) {
            m.computeIfAbsent(keyFn.apply(t), k -> new ArrayList<>()).add(t);
        }
        List<Group<T>> out = new ArrayList<>();
        m.forEach((k, v) -> out.add(new Group<>(k, v)));
        out.sort(order);
        return out;
    }
}
