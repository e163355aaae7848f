package com.calai.nutrilabel.nutrient.reconcile;

import com.calai.nutrilabel.common.error.InvalidBatchScopeException;
import com.calai.nutrilabel.nutrient.entity.IngredientCatalogEntity;
import com.calai.nutrilabel.nutrient.entity.ProductCatalogEntity;
import com.calai.nutrilabel.nutrient.entity.VerificationTaskEntity;
import com.calai.nutrilabel.nutrient.model.EvidenceGrade;
import com.calai.nutrilabel.nutrient.model.NutrientKey;
import com.calai.nutrilabel.nutrient.model.ProductIdentity;
import com.calai.nutrilabel.nutrient.model.ResolvedProfile;
import com.calai.nutrilabel.nutrient.model.SourceType;
import com.calai.nutrilabel.nutrient.model.SourceValue;
import com.calai.nutrilabel.nutrient.repo.IngredientCatalogRepository;
import com.calai.nutrilabel.nutrient.repo.ProductCatalogRepository;
import com.calai.nutrilabel.nutrient.repo.ProductNutrientValueRepository;
import com.calai.nutrilabel.nutrient.repo.VerificationTaskRepository;
import com.calai.nutrilabel.nutrient.resolve.BatchResolution;
import com.calai.nutrilabel.nutrient.resolve.NutrientResolver;
import com.calai.nutrilabel.nutrient.resolve.ResolutionContext;
import com.calai.nutrilabel.nutrient.resolve.ResolverMode;
import com.calai.nutrilabel.nutrient.source.upstream.UpstreamRetryPolicy;
import com.calai.nutrilabel.nutrient.source.upstream.UpstreamSession;
import com.calai.nutrilabel.nutrient.source.upstream.UpstreamSessionFactory;
import com.calai.nutrilabel.nutrient.source.upstream.UpstreamTelemetry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class NutrientReconciliationJobTest {

    private PlatformTransactionManager ptm;
    private SimpleTransactionStatus txStatus;
    private ProductCatalogRepository productRepo;
    private IngredientCatalogRepository ingredientRepo;
    private ProductNutrientValueRepository valueRepo;
    private VerificationTaskRepository taskRepo;
    private NutrientResolver resolver;
    private NutrientValueWriter writer;
    private NutrientReconciliationJob job;

    @BeforeEach
    void setUp() {
        ptm = mock(PlatformTransactionManager.class);
        txStatus = new SimpleTransactionStatus();
        when(ptm.getTransaction(any())).thenReturn(txStatus);

        productRepo = mock(ProductCatalogRepository.class);
        ingredientRepo = mock(IngredientCatalogRepository.class);
        valueRepo = mock(ProductNutrientValueRepository.class);
        taskRepo = mock(VerificationTaskRepository.class);
        resolver = mock(NutrientResolver.class);
        writer = mock(NutrientValueWriter.class);

        UpstreamSessionFactory sessionFactory = mock(UpstreamSessionFactory.class);
        when(sessionFactory.open()).thenAnswer(inv -> new UpstreamSession(
                new UpstreamRetryPolicy(1, Duration.ZERO, Duration.ZERO), new UpstreamTelemetry(), d -> { }, 10));

        job = new NutrientReconciliationJob(
                new TransactionTemplate(ptm), productRepo, ingredientRepo, valueRepo, taskRepo,
                resolver, writer, sessionFactory,
                new ReconcileProperties(null, true, null, true, "agent"),
                new ObjectMapper());

        when(ingredientRepo.findByOrganizationId("org1")).thenReturn(List.of(
                ingredient("ing-milk", "milk", "Milk"),
                ingredient("ing-rice", "rice", "Rice")));
        when(productRepo.findActiveByOrganization("org1")).thenReturn(List.of(
                product("p2", "ing-milk", "Milk B"),
                product("p1", "ing-milk", "Milk A"),
                product("p3", "ing-rice", "Rice A")));
        when(valueRepo.findByProductIdIn(anyCollection())).thenReturn(List.of());
        when(writer.upsert(any(), anyMap(), anyString(), any())).thenReturn(5);
    }

    private static IngredientCatalogEntity ingredient(String id, String key, String name) {
        IngredientCatalogEntity e = new IngredientCatalogEntity();
        e.setId(id);
        e.setOrganizationId("org1");
        e.setCanonicalKey(key);
        e.setName(name);
        return e;
    }

    private static ProductCatalogEntity product(String id, String ingredientId, String name) {
        ProductCatalogEntity e = new ProductCatalogEntity();
        e.setId(id);
        e.setOrganizationId("org1");
        e.setIngredientId(ingredientId);
        e.setName(name);
        e.setUpc("0001112223334");
        return e;
    }

    private static ResolvedProfile profile(String productId, Set<NutrientKey> keys) {
        ResolvedProfile p = new ResolvedProfile(productId);
        for (NutrientKey k : keys) {
            p.offer(k, SourceValue.of(1.0, SourceType.USDA, "usda:1", EvidenceGrade.USDA_GENERIC, 0.82));
        }
        return p;
    }

    /** p1 / p3 核心齊全，p2 缺 sodium；只有 p1 有來源命中 */
    private void stubResolution() {
        when(resolver.resolveBatch(anyList(), any(ResolutionContext.class))).thenAnswer(inv -> {
            List<ProductIdentity> products = inv.getArgument(0);
            Map<String, ResolvedProfile> profiles = new LinkedHashMap<>();
            for (ProductIdentity p : products) {
                Set<NutrientKey> keys = p.productId().equals("p2")
                        ? NutrientKey.CORE.stream().filter(k -> k != NutrientKey.SODIUM_MG).collect(Collectors.toSet())
                        : NutrientKey.CORE;
                profiles.put(p.productId(), profile(p.productId(), keys));
            }
            return new BatchResolution(profiles, Set.of("p1"));
        });
    }

    @Test
    void processes_groups_in_key_order_and_opens_task_for_missing_core() {
        stubResolution();

        ReconcileSummary s = job.run(new ReconcileRequest("org1", null, null, false, null));

        assertThat(s.isSuccess()).isTrue();
        assertThat(s.getRetrievalRunId()).startsWith("reconcile-");
        assertThat(s.getMode()).isEqualTo(ResolverMode.STANDARD);
        assertThat(s.getGroupsProcessed()).isEqualTo(2);
        assertThat(s.getProductsProcessed()).isEqualTo(3);
        assertThat(s.getUpserts()).isEqualTo(15);
        assertThat(s.getProductsWithMissingCoreAfter()).isEqualTo(1);
        assertThat(s.getVerificationTasksCreated()).isEqualTo(1);
        assertThat(s.getFinishedAt()).isNotNull();

        assertThat(s.getGroupOutcomes()).extracting(ReconcileSummary.GroupOutcome::ingredientKey)
                .containsExactly("milk", "rice");
        ReconcileSummary.GroupOutcome milk = s.getGroupOutcomes().get(0);
        assertThat(milk.products()).isEqualTo(2);
        assertThat(milk.coreResolved()).isFalse();
        assertThat(milk.note()).isNull();
        ReconcileSummary.GroupOutcome rice = s.getGroupOutcomes().get(1);
        assertThat(rice.coreResolved()).isTrue();
        assertThat(rice.note()).isEqualTo(NutrientReconciliationJob.NOTE_NO_SOURCE_MATCH);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ProductIdentity>> products = ArgumentCaptor.forClass(List.class);
        verify(resolver).resolveBatch(products.capture(), any());
        assertThat(products.getValue()).extracting(ProductIdentity::productId).containsExactly("p1", "p2", "p3");

        ArgumentCaptor<VerificationTaskEntity> task = ArgumentCaptor.forClass(VerificationTaskEntity.class);
        verify(taskRepo).save(task.capture());
        assertThat(task.getValue().getTitle()).isEqualTo("Missing core nutrients: Milk B");
        assertThat(task.getValue().getTaskType()).isEqualTo(VerificationTaskEntity.TaskType.SOURCE_RETRIEVAL);
        assertThat(task.getValue().getSeverity()).isEqualTo(VerificationTaskEntity.Severity.HIGH);
        assertThat(task.getValue().getPayload().path("missingCoreKeys").get(0).asText()).isEqualTo("sodium_mg");
        assertThat(task.getValue().getPayload().path("productId").asText()).isEqualTo("p2");

        assertThat(txStatus.isRollbackOnly()).isFalse();
        verify(ptm).commit(txStatus);
    }

    @Test
    void existing_open_task_is_not_duplicated() {
        stubResolution();
        when(taskRepo.existsByOrganizationIdAndTaskTypeAndStatusAndTitle(
                eq("org1"), eq(VerificationTaskEntity.TaskType.SOURCE_RETRIEVAL),
                eq(VerificationTaskEntity.Status.OPEN), eq("Missing core nutrients: Milk B"))).thenReturn(true);

        ReconcileSummary s = job.run(new ReconcileRequest("org1", null, null, false, null));

        assertThat(s.getVerificationTasksCreated()).isZero();
        assertThat(s.getProductsWithMissingCoreAfter()).isEqualTo(1);
        verify(taskRepo, never()).save(any());
    }

    @Test
    void ingredient_filter_and_group_limit_narrow_the_batch() {
        stubResolution();

        ReconcileSummary filtered = job.run(new ReconcileRequest("org1", List.of("rice"), null, false, null));
        ReconcileSummary limited = job.run(new ReconcileRequest("org1", null, 1, false, null));

        assertThat(filtered.getGroupOutcomes()).extracting(ReconcileSummary.GroupOutcome::ingredientKey).containsExactly("rice");
        assertThat(filtered.getProductsProcessed()).isEqualTo(1);
        assertThat(limited.getGroupOutcomes()).extracting(ReconcileSummary.GroupOutcome::ingredientKey).containsExactly("milk");
        assertThat(limited.getProductsProcessed()).isEqualTo(2);
    }

    @Test
    void dry_run_marks_transaction_rollback_only() {
        stubResolution();

        ReconcileSummary s = job.run(new ReconcileRequest("org1", null, null, true, ResolverMode.HISTORICAL_BACKFILL));

        assertThat(s.isSuccess()).isTrue();
        assertThat(s.isDryRun()).isTrue();
        assertThat(s.getMode()).isEqualTo(ResolverMode.HISTORICAL_BACKFILL);
        assertThat(txStatus.isRollbackOnly()).isTrue();

        ArgumentCaptor<ResolutionContext> ctx = ArgumentCaptor.forClass(ResolutionContext.class);
        verify(resolver).resolveBatch(anyList(), ctx.capture());
        assertThat(ctx.getValue().isRepair()).isTrue();
        assertThat(ctx.getValue().globalFallbackEnabled()).isTrue();
    }

    @Test
    void database_failure_rolls_back_and_reports_unsuccessful_summary() {
        stubResolution();
        when(writer.upsert(any(), anyMap(), anyString(), any())).thenThrow(new IllegalStateException("deadlock"));

        ReconcileSummary s = job.run(new ReconcileRequest("org1", null, null, false, null));

        assertThat(s.isSuccess()).isFalse();
        assertThat(s.getErrors()).singleElement().asString().contains("deadlock");
        assertThat(s.getFinishedAt()).isNotNull();
        verify(ptm).rollback(txStatus);
        verify(ptm, never()).commit(any());
    }

    @Test
    void invalid_scope_is_rejected_before_any_work() {
        assertThatThrownBy(() -> job.run(new ReconcileRequest(" ", null, null, false, null)))
                .isInstanceOf(InvalidBatchScopeException.class)
                .satisfies(e -> assertThat(((InvalidBatchScopeException) e).getCode()).isEqualTo("ORGANIZATION_REQUIRED"));
        assertThatThrownBy(() -> job.run(new ReconcileRequest("org1", null, -1, false, null)))
                .isInstanceOf(InvalidBatchScopeException.class)
                .satisfies(e -> assertThat(((InvalidBatchScopeException) e).getCode()).isEqualTo("INVALID_LIMIT"));

        verifyNoInteractions(ptm, productRepo, resolver);
    }
}
