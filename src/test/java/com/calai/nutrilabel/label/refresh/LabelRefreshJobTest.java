package com.calai.nutrilabel.label.refresh;

import com.calai.nutrilabel.common.error.InvalidBatchScopeException;
import com.calai.nutrilabel.label.entity.MealServiceEventEntity;
import com.calai.nutrilabel.label.entity.SkuEntity;
import com.calai.nutrilabel.label.lineage.ConsumedLotLoader;
import com.calai.nutrilabel.label.lineage.EventLabelInput;
import com.calai.nutrilabel.label.lineage.LabelRefreshException;
import com.calai.nutrilabel.label.lineage.LineageResult;
import com.calai.nutrilabel.label.lineage.LineageSnapshotBuilder;
import com.calai.nutrilabel.label.repo.MealServiceEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LabelRefreshJobTest {

    private static final Instant FEB = Instant.parse("2026-02-01T00:00:00Z");
    private static final Instant MAR = Instant.parse("2026-03-01T00:00:00Z");

    private PlatformTransactionManager ptm;
    private SimpleTransactionStatus txStatus;
    private MealServiceEventRepository eventRepo;
    private ConsumedLotLoader loader;
    private LineageSnapshotBuilder builder;
    private LabelRefreshJob job;

    @BeforeEach
    void setUp() {
        ptm = mock(PlatformTransactionManager.class);
        txStatus = new SimpleTransactionStatus();
        when(ptm.getTransaction(any())).thenReturn(txStatus);
        eventRepo = mock(MealServiceEventRepository.class);
        loader = mock(ConsumedLotLoader.class);
        builder = mock(LineageSnapshotBuilder.class);
        job = new LabelRefreshJob(new TransactionTemplate(ptm), eventRepo, loader, builder);
    }

    private static MealServiceEventEntity event(String id) {
        MealServiceEventEntity e = new MealServiceEventEntity();
        e.setId(id);
        e.setOrganizationId("org1");
        e.setSkuId("sku-1");
        e.setServedAt(FEB.plusSeconds(3600));
        e.setPlannedServings(1);
        return e;
    }

    private static EventLabelInput input(MealServiceEventEntity e) {
        return new EventLabelInput(e, new SkuEntity(), "recipe-1", List.of(), List.of());
    }

    private void stubBuilt(MealServiceEventEntity e, boolean provisional) throws LabelRefreshException {
        EventLabelInput in = input(e);
        when(loader.load(e)).thenReturn(in);
        when(builder.build(eq(in), any())).thenReturn(
                new LineageResult(e.getId(), null, "label-" + e.getId(), 1, 4, provisional, true));
    }

    @Test
    void refreshes_every_event_in_month_and_skips_unloadable_ones() throws Exception {
        MealServiceEventEntity a = event("evt-a");
        MealServiceEventEntity b = event("evt-b");
        MealServiceEventEntity c = event("evt-c");
        when(eventRepo.findServedBetween("org1", FEB, MAR)).thenReturn(List.of(a, b, c));
        stubBuilt(a, true);
        when(loader.load(b)).thenThrow(new LabelRefreshException("NO_ACTIVE_RECIPE", "no active recipe for sku X"));
        stubBuilt(c, false);

        LabelRefreshSummary s = job.run(new LabelRefreshRequest("org1", "2026-02", null, false));

        assertThat(s.isSuccess()).isTrue();
        assertThat(s.getMonth()).isEqualTo("2026-02");
        assertThat(s.getEventCount()).isEqualTo(3);
        assertThat(s.getRefreshedEvents()).isEqualTo(2);
        assertThat(s.getProvisionalEvents()).isEqualTo(1);
        assertThat(s.getEvents()).extracting(LineageResult::newLabelId).containsExactly("label-evt-a", "label-evt-c");
        assertThat(s.getErrors()).containsExactly(
                new LabelRefreshSummary.EventError("evt-b", "NO_ACTIVE_RECIPE", "no active recipe for sku X"));
        assertThat(s.getFatalError()).isNull();
        assertThat(s.getFinishedAt()).isNotNull();
        verify(ptm).commit(txStatus);
    }

    @Test
    void limit_caps_processed_events() throws Exception {
        MealServiceEventEntity a = event("evt-a");
        MealServiceEventEntity b = event("evt-b");
        when(eventRepo.findServedBetween("org1", FEB, MAR)).thenReturn(List.of(a, b));
        stubBuilt(a, false);

        LabelRefreshSummary s = job.run(new LabelRefreshRequest("org1", "2026-02", 1, false));

        assertThat(s.getEventCount()).isEqualTo(1);
        verify(loader, never()).load(b);
    }

    @Test
    void dry_run_marks_transaction_rollback_only() throws Exception {
        MealServiceEventEntity a = event("evt-a");
        when(eventRepo.findServedBetween("org1", FEB, MAR)).thenReturn(List.of(a));
        stubBuilt(a, false);

        LabelRefreshSummary s = job.run(new LabelRefreshRequest("org1", "2026-02", 0, true));

        assertThat(s.isSuccess()).isTrue();
        assertThat(s.isDryRun()).isTrue();
        assertThat(s.getRefreshedEvents()).isEqualTo(1);
        // 由 transaction manager 依 rollbackOnly 決定 rollback
        assertThat(txStatus.isRollbackOnly()).isTrue();
    }

    @Test
    void database_failure_rolls_back_whole_batch() throws Exception {
        MealServiceEventEntity a = event("evt-a");
        when(eventRepo.findServedBetween("org1", FEB, MAR)).thenReturn(List.of(a));
        EventLabelInput in = input(a);
        when(loader.load(a)).thenReturn(in);
        when(builder.build(eq(in), any())).thenThrow(new DataIntegrityViolationException("ux_label_snapshots_ref_version"));

        LabelRefreshSummary s = job.run(new LabelRefreshRequest("org1", "2026-02", null, false));

        assertThat(s.isSuccess()).isFalse();
        assertThat(s.getFatalError()).startsWith("DataIntegrityViolationException");
        assertThat(s.getFinishedAt()).isNotNull();
        verify(ptm).rollback(txStatus);
    }

    @Test
    void invalid_scope_fails_before_transaction() {
        assertThatThrownBy(() -> job.run(new LabelRefreshRequest(" ", "2026-02", null, false)))
                .isInstanceOfSatisfying(InvalidBatchScopeException.class,
                        e -> assertThat(e.getCode()).isEqualTo("ORGANIZATION_REQUIRED"));
        assertThatThrownBy(() -> job.run(new LabelRefreshRequest("org1", "2026-02", -1, false)))
                .isInstanceOfSatisfying(InvalidBatchScopeException.class,
                        e -> assertThat(e.getCode()).isEqualTo("INVALID_LIMIT"));
        assertThatThrownBy(() -> job.run(new LabelRefreshRequest("org1", "2026-2", null, false)))
                .isInstanceOfSatisfying(InvalidBatchScopeException.class,
                        e -> assertThat(e.getCode()).isEqualTo("INVALID_MONTH"));

        verifyNoInteractions(ptm, eventRepo);
    }
}
