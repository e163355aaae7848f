package com.calai.nutrilabel.nutrient.reconcile;

import com.calai.nutrilabel.common.error.InvalidBatchScopeException;
import com.calai.nutrilabel.nutrient.entity.IngredientCatalogEntity;
import com.calai.nutrilabel.nutrient.entity.ProductCatalogEntity;
import com.calai.nutrilabel.nutrient.entity.ProductNutrientValueEntity;
import com.calai.nutrilabel.nutrient.entity.VerificationTaskEntity;
import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.ProductIdentity;
import com.calai.nutrilabel.nutrient.model.ResolvedProfile;
import com.calai.nutrilabel.nutrient.repo.IngredientCatalogRepository;
import com.calai.nutrilabel.nutrient.repo.ProductCatalogRepository;
import com.calai.nutrilabel.nutrient.repo.ProductNutrientValueRepository;
import com.calai.nutrilabel.nutrient.repo.VerificationTaskRepository;
import com.calai.nutrilabel.nutrient.resolve.BatchResolution;
import com.calai.nutrilabel.nutrient.resolve.ExistingNutrientRow;
import com.calai.nutrilabel.nutrient.resolve.NutrientResolver;
import com.calai.nutrilabel.nutrient.resolve.ResolutionContext;
import com.calai.nutrilabel.nutrient.resolve.ResolverMode;
import com.calai.nutrilabel.nutrient.source.upstream.Upstream;
import com.calai.nutrilabel.nutrient.source.upstream.UpstreamSession;
import com.calai.nutrilabel.nutrient.source.upstream.UpstreamSessionFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 營養值補值 batch
 * - 整批一個 transaction：dryRun 一律 rollback；任何 DB 錯誤整批 rollback
 * - 外部來源失敗只會變成「查無」，不會讓 batch 失敗
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NutrientReconciliationJob {

    public static final String NOTE_NO_SOURCE_MATCH = "no_source_match";

    private final TransactionTemplate tx;
    private final ProductCatalogRepository productRepo;
    private final IngredientCatalogRepository ingredientRepo;
    private final ProductNutrientValueRepository valueRepo;
    private final VerificationTaskRepository taskRepo;
    private final NutrientResolver resolver;
    private final NutrientValueWriter writer;
    private final UpstreamSessionFactory sessionFactory;
    private final ReconcileProperties props;
    private final ObjectMapper om;

    public ReconcileSummary run(ReconcileRequest req) {
        validate(req);

        ReconcileSummary summary = new ReconcileSummary();
        summary.setStartedAt(Instant.now());
        summary.setOrganizationId(req.organizationId());
        summary.setDryRun(req.dryRun());
        summary.setMode(req.mode() == null ? props.modeOrDefault() : req.mode());
        summary.setRetrievalRunId("reconcile-" + UUID.randomUUID());

        try {
            tx.executeWithoutResult(status -> {
                process(req, summary);
                if (req.dryRun()) status.setRollbackOnly();
            });
            summary.setSuccess(true);
            log.info("reconcile done orgId={} dryRun={} groups={} products={} upserts={} missingCore={}",
                    req.organizationId(), req.dryRun(), summary.getGroupsProcessed(),
                    summary.getProductsProcessed(), summary.getUpserts(), summary.getProductsWithMissingCoreAfter());
        } catch (RuntimeException e) {
            log.error("reconcile failed, rolled back. orgId={} runId={}", req.organizationId(), summary.getRetrievalRunId(), e);
            summary.getErrors().add(e.getClass().getSimpleName() + ": " + e.getMessage());
            summary.setSuccess(false);
        } finally {
            summary.setFinishedAt(Instant.now());
        }
        return summary;
    }

    static void validate(ReconcileRequest req) {
        if (req == null || req.organizationId() == null || req.organizationId().isBlank()) {
            throw new InvalidBatchScopeException("ORGANIZATION_REQUIRED", "organizationId is required");
        }
        if (req.limit() != null && req.limit() < 0) {
            throw new InvalidBatchScopeException("INVALID_LIMIT", "limit must be >= 0: " + req.limit());
        }
    }

    private void process(ReconcileRequest req, ReconcileSummary summary) {
        String orgId = req.organizationId();
        ResolverMode mode = summary.getMode();

        List<ProductIdentity> products = loadProducts(orgId, req);
        Map<String, List<ProductIdentity>> groups = new LinkedHashMap<>();
        for (ProductIdentity p : products) {
            groups.computeIfAbsent(p.ingredientKey(), k -> new ArrayList<>()).add(p);
        }

        List<String> ids = products.stream().map(ProductIdentity::productId).toList();
        Map<String, Map<NutrientKey, ProductNutrientValueEntity>> stored = new HashMap<>();
        Map<String, List<ExistingNutrientRow>> existing = new HashMap<>();
        if (!ids.isEmpty()) {
            for (ProductNutrientValueEntity row : valueRepo.findByProductIdIn(ids)) {
                NutrientKey key = NutrientKey.fromKeyOrNull(row.getNutrientKey());
                if (key == null) continue;
                stored.computeIfAbsent(row.getProductId(), k -> new EnumMap<>(NutrientKey.class)).put(key, row);
                existing.computeIfAbsent(row.getProductId(), k -> new ArrayList<>()).add(ExistingNutrientRow.fromEntity(row));
            }
        }

        UpstreamSession session = sessionFactory.open();
        ResolutionContext ctx = new ResolutionContext(session, mode, existing, props.globalFallbackEnabledOrDefault());
        BatchResolution resolution = resolver.resolveBatch(products, ctx);

        Instant now = Instant.now();
        for (Map.Entry<String, List<ProductIdentity>> group : groups.entrySet()) {
            Set<NutrientKey> groupKeys = EnumSet.noneOf(NutrientKey.class);
            boolean coreResolved = true;
            boolean anySourceMatch = false;

            for (ProductIdentity p : group.getValue()) {
                ResolvedProfile profile = resolution.profile(p.productId());
                summary.setUpserts(summary.getUpserts() + writer.upsert(
                        profile, stored.getOrDefault(p.productId(), Map.of()), summary.getRetrievalRunId(), now));

                groupKeys.addAll(profile.values().keySet());
                if (!profile.hasAllCore()) {
                    coreResolved = false;
                    summary.setProductsWithMissingCoreAfter(summary.getProductsWithMissingCoreAfter() + 1);
                    if (props.createVerificationTasksOrDefault() && openSourceRetrievalTask(orgId, p, profile)) {
                        summary.setVerificationTasksCreated(summary.getVerificationTasksCreated() + 1);
                    }
                }
                if (resolution.productsWithSourceMatch().contains(p.productId())) anySourceMatch = true;
                summary.setProductsProcessed(summary.getProductsProcessed() + 1);
            }

            summary.getGroupOutcomes().add(new ReconcileSummary.GroupOutcome(
                    group.getKey(),
                    group.getValue().size(),
                    groupKeys.size(),
                    coreResolved,
                    anySourceMatch ? null : NOTE_NO_SOURCE_MATCH
            ));
            summary.setGroupsProcessed(summary.getGroupsProcessed() + 1);
        }

        for (Upstream u : session.rateLimitedUpstreams()) {
            summary.getUpstreamRateLimited().add(u.name());
        }
    }

    private List<ProductIdentity> loadProducts(String orgId, ReconcileRequest req) {
        Map<String, IngredientCatalogEntity> ingredients = new HashMap<>();
        for (IngredientCatalogEntity i : ingredientRepo.findByOrganizationId(orgId)) {
            ingredients.put(i.getId(), i);
        }

        List<ProductIdentity> all = new ArrayList<>();
        for (ProductCatalogEntity p : productRepo.findActiveByOrganization(orgId)) {
            IngredientCatalogEntity ing = ingredients.get(p.getIngredientId());
            String key = ing == null ? p.getIngredientId() : ing.getCanonicalKey();
            String ingName = ing == null ? null : ing.getName();
            if (!req.ingredientKeys().isEmpty() && !req.ingredientKeys().contains(key)) continue;
            all.add(new ProductIdentity(p.getId(), p.getIngredientId(), key, ingName,
                    p.getName(), p.getBrand(), p.getUpc(), p.getVendor()));
        }

        all.sort(Comparator.comparing(ProductIdentity::ingredientKey).thenComparing(ProductIdentity::productId));

        int limit = req.limit() == null ? 0 : req.limit();
        if (limit <= 0) return all;

        // limit 以 ingredient group 為單位
        List<ProductIdentity> out = new ArrayList<>();
        List<String> seenGroups = new ArrayList<>();
        for (ProductIdentity p : all) {
            if (!seenGroups.contains(p.ingredientKey())) {
                if (seenGroups.size() >= limit) break;
                seenGroups.add(p.ingredientKey());
            }
            out.add(p);
        }
        return out;
    }

    private boolean openSourceRetrievalTask(String orgId, ProductIdentity p, ResolvedProfile profile) {
        String title = "Missing core nutrients: " + p.name();
        if (taskRepo.existsByOrganizationIdAndTaskTypeAndStatusAndTitle(
                orgId, VerificationTaskEntity.TaskType.SOURCE_RETRIEVAL, VerificationTaskEntity.Status.OPEN, title)) {
            return false;
        }

        List<String> missing = NutrientKey.CORE.stream()
                .filter(k -> !profile.isResolved(k))
                .map(NutrientKey::key)
                .sorted()
                .toList();

        ObjectNode payload = om.createObjectNode();
        payload.put("productId", p.productId());
        payload.put("productName", p.name());
        payload.put("upc", p.upc());
        missing.forEach(payload.putArray("missingCoreKeys")::add);

        VerificationTaskEntity task = new VerificationTaskEntity();
        task.setOrganizationId(orgId);
        task.setTaskType(VerificationTaskEntity.TaskType.SOURCE_RETRIEVAL);
        task.setSeverity(VerificationTaskEntity.Severity.HIGH);
        task.setStatus(VerificationTaskEntity.Status.OPEN);
        task.setTitle(title);
        task.setDescription("Core nutrients unresolved after reconciliation: " + String.join(", ", missing));
        task.setPayload(payload);
        task.setCreatedBy(props.createdByOrDefault());
        taskRepo.save(task);
        return true;
    }
}
