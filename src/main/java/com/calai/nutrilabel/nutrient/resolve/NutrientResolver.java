package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.model.EvidenceGrade;
import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.ProductIdentity;
import com.calai.nutrilabel.nutrient.model.ResolvedProfile;
import com.calai.nutrilabel.nutrient.model.SourceType;
import com.calai.nutrilabel.nutrient.model.SourceValue;
import com.calai.nutrilabel.nutrient.reconcile.ReconcileProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * 營養值解析（整批）
 * 1) cascade：既有值 → 製造商 UPC → USDA branded → USDA generic（confidence 嚴格較高才換人）
 * 2) 動物蛋白 sanity override（碳水家族 = 0）
 * 3) donor：同 ingredient group 的其他產品
 * 4) global：本批 median → 全庫 median → 預設表
 * ✅ 單一產品不會失敗；DB 錯誤直接往外丟，由 job 的 transaction rollback
 */
@Slf4j
@Service
public class NutrientResolver {

    public static final double DONOR_CONFIDENCE = 0.4;
    public static final double GLOBAL_CONFIDENCE = 0.25;

    public static final String DONOR_REF_PREFIX = "donor-product:";
    public static final String BATCH_MEDIAN_REF = "global-median:batch";
    public static final String HISTORICAL_MEDIAN_REF = "global-median:historical";
    public static final String DEFAULT_FALLBACK_REF = "fallback-default";

    private final ResolutionCascade cascade;
    private final NutrientFallbackTable fallbackTable;
    private final HistoricalMedianSource historicalMedians;
    private final double traceThreshold;

    public NutrientResolver(ResolutionCascade cascade,
                            NutrientFallbackTable fallbackTable,
                            HistoricalMedianSource historicalMedians,
                            ReconcileProperties props) {
        this.cascade = cascade;
        this.fallbackTable = fallbackTable;
        this.historicalMedians = historicalMedians;
        this.traceThreshold = props.traceThresholdOrDefault();
    }

    /**
     * 單一產品：cascade + sanity override（不含 donor / global）
     */
    public ResolvedProfile resolveDirect(ProductIdentity product, ResolutionContext ctx) {
        ResolvedProfile profile = new ResolvedProfile(product.productId());

        for (ResolutionStage stage : cascade.stages()) {
            Map<NutrientKey, SourceValue> candidates = stage.candidates(product, ctx);
            int won = 0;
            for (Map.Entry<NutrientKey, SourceValue> e : candidates.entrySet()) {
                if (!accepts(e.getKey(), e.getValue(), stage.readsStoredValues() || ctx.isRepair())) continue;
                if (profile.offer(e.getKey(), e.getValue())) won++;
            }
            log.debug("resolve stage={} productId={} candidates={} won={}",
                    stage.name(), product.productId(), candidates.size(), won);
        }

        if (AnimalProteinCarbRule.apply(product, profile)) {
            log.debug("resolve sanity override animal-protein productId={}", product.productId());
        }
        return profile;
    }

    public BatchResolution resolveBatch(List<ProductIdentity> products, ResolutionContext ctx) {
        Map<String, ResolvedProfile> profiles = new LinkedHashMap<>();
        for (ProductIdentity p : products) {
            profiles.put(p.productId(), resolveDirect(p, ctx));
        }

        // donor / median 只看 cascade 階段的非推估值，避免推估值互相傳染
        Map<String, Map<NutrientKey, SourceValue>> direct = new LinkedHashMap<>();
        Set<String> withSourceMatch = new HashSet<>();
        profiles.forEach((id, profile) -> {
            Map<NutrientKey, SourceValue> observed = new EnumMap<>(NutrientKey.class);
            profile.values().forEach((k, v) -> {
                if (!v.isInferred()) observed.put(k, v);
            });
            direct.put(id, observed);
            if (!observed.isEmpty()) withSourceMatch.add(id);
        });

        fillFromDonors(products, profiles, direct);

        if (ctx.globalFallbackEnabled()) {
            fillFromGlobal(profiles, direct, ctx);
        }

        return new BatchResolution(profiles, withSourceMatch);
    }

    // ===== step 6：donor =====

    private void fillFromDonors(List<ProductIdentity> products,
                                Map<String, ResolvedProfile> profiles,
                                Map<String, Map<NutrientKey, SourceValue>> direct) {
        Map<String, List<ProductIdentity>> groups = new LinkedHashMap<>();
        for (ProductIdentity p : products) {
            if (p.ingredientKey() == null) continue;
            groups.computeIfAbsent(p.ingredientKey(), k -> new ArrayList<>()).add(p);
        }

        // 非推估 key 多的優先，同數量用 productId 排
        Comparator<ProductIdentity> donorOrder = Comparator
                .comparingInt((ProductIdentity d) -> direct.get(d.productId()).size()).reversed()
                .thenComparing(ProductIdentity::productId);

        for (ProductIdentity p : products) {
            List<ProductIdentity> group = groups.get(p.ingredientKey());
            if (group == null || group.size() < 2) continue;

            List<ProductIdentity> donors = group.stream()
                    .filter(d -> !d.productId().equals(p.productId()))
                    .sorted(donorOrder)
                    .toList();

            ResolvedProfile profile = profiles.get(p.productId());
            for (NutrientKey key : NutrientKey.values()) {
                if (profile.isResolved(key)) continue;
                for (ProductIdentity donor : donors) {
                    SourceValue v = direct.get(donor.productId()).get(key);
                    if (v == null) continue;
                    profile.offer(key, new SourceValue(
                            v.value(),
                            SourceType.DERIVED,
                            DONOR_REF_PREFIX + donor.productId(),
                            EvidenceGrade.INFERRED_FROM_SIMILAR_PRODUCT,
                            DONOR_CONFIDENCE,
                            false
                    ));
                    break;
                }
            }
        }
    }

    // ===== step 7：global =====

    private record Fallback(double value, String ref) {}

    private void fillFromGlobal(Map<String, ResolvedProfile> profiles,
                                Map<String, Map<NutrientKey, SourceValue>> direct,
                                ResolutionContext ctx) {
        Map<NutrientKey, Fallback> memo = new EnumMap<>(NutrientKey.class);
        Set<NutrientKey> none = new HashSet<>();

        for (ResolvedProfile profile : profiles.values()) {
            for (NutrientKey key : NutrientKey.values()) {
                if (profile.isResolved(key) || none.contains(key)) continue;

                Fallback fb = memo.get(key);
                if (fb == null) {
                    fb = pickFallback(key, direct);
                    if (fb == null) {
                        none.add(key);
                        continue;
                    }
                    memo.put(key, fb);
                }

                profile.offer(key, new SourceValue(
                        fb.value(),
                        SourceType.DERIVED,
                        fb.ref(),
                        EvidenceGrade.INFERRED_FROM_SIMILAR_PRODUCT,
                        GLOBAL_CONFIDENCE,
                        ctx.isRepair()
                ));
            }
        }
    }

    private Fallback pickFallback(NutrientKey key, Map<String, Map<NutrientKey, SourceValue>> direct) {
        List<Double> observed = new ArrayList<>();
        for (Map<NutrientKey, SourceValue> values : direct.values()) {
            SourceValue v = values.get(key);
            if (v != null) observed.add(v.value());
        }
        OptionalDouble batch = Medians.of(observed);
        if (batch.isPresent()) return new Fallback(batch.getAsDouble(), BATCH_MEDIAN_REF);

        OptionalDouble historical = historicalMedians.median(key);
        if (historical.isPresent() && historical.getAsDouble() >= 0) {
            return new Fallback(historical.getAsDouble(), HISTORICAL_MEDIAN_REF);
        }

        OptionalDouble def = fallbackTable.get(key);
        if (def.isPresent()) return new Fallback(def.getAsDouble(), DEFAULT_FALLBACK_REF);

        return null;
    }

    // ===== merge guard =====

    /**
     * @param dropTrace true：低於 trace 門檻的值視為缺值（既有值 / 修復模式）
     */
    boolean accepts(NutrientKey key, SourceValue v, boolean dropTrace) {
        if (v == null) return false;
        double value = v.value();
        if (!Double.isFinite(value) || value < 0) return false;
        if (!NutrientSanityLimits.withinLimits(key, value)) {
            log.debug("resolve reject implausible key={} value={} ref={}", key.key(), value, v.sourceRef());
            return false;
        }
        return !(dropTrace && value < traceThreshold);
    }
}
