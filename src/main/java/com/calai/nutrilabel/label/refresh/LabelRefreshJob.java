package com.calai.nutrilabel.label.refresh;

import com.calai.nutrilabel.common.error.InvalidBatchScopeException;
import com.calai.nutrilabel.label.entity.MealServiceEventEntity;
import com.calai.nutrilabel.label.lineage.ConsumedLotLoader;
import com.calai.nutrilabel.label.lineage.EventLabelInput;
import com.calai.nutrilabel.label.lineage.LabelRefreshException;
import com.calai.nutrilabel.label.lineage.LineageResult;
import com.calai.nutrilabel.label.lineage.LineageSnapshotBuilder;
import com.calai.nutrilabel.label.repo.MealServiceEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;

/**
 * 指定月份的出餐 → 重建 label lineage
 * - month 格式錯：開 transaction 前就丟 InvalidBatchScopeException
 * - 單一出餐 LabelRefreshException：記錄、跳過
 * - 其他例外（DB）：整批 rollback，summary.success=false
 * - dryRun：一律 rollback
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LabelRefreshJob {

    private final TransactionTemplate tx;
    private final MealServiceEventRepository eventRepo;
    private final ConsumedLotLoader loader;
    private final LineageSnapshotBuilder builder;

    public LabelRefreshSummary run(LabelRefreshRequest req) {
        if (req == null || req.organizationId() == null || req.organizationId().isBlank()) {
            throw new InvalidBatchScopeException("ORGANIZATION_REQUIRED", "organizationId is required");
        }
        if (req.limit() != null && req.limit() < 0) {
            throw new InvalidBatchScopeException("INVALID_LIMIT", "limit must be >= 0: " + req.limit());
        }
        MonthScope scope = MonthScope.parse(req.month());

        LabelRefreshSummary summary = new LabelRefreshSummary();
        summary.setStartedAt(Instant.now());
        summary.setOrganizationId(req.organizationId());
        summary.setMonth(scope.month());
        summary.setDryRun(req.dryRun());

        try {
            tx.executeWithoutResult(status -> {
                process(req, scope, summary);
                if (req.dryRun()) status.setRollbackOnly();
            });
            summary.setSuccess(true);
            log.info("label refresh done orgId={} month={} dryRun={} events={} refreshed={} errors={}",
                    req.organizationId(), scope.month(), req.dryRun(), summary.getEventCount(),
                    summary.getRefreshedEvents(), summary.getErrors().size());
        } catch (RuntimeException e) {
            log.error("label refresh failed, rolled back. orgId={} month={}", req.organizationId(), scope.month(), e);
            summary.setFatalError(e.getClass().getSimpleName() + ": " + e.getMessage());
            summary.setSuccess(false);
        } finally {
            summary.setFinishedAt(Instant.now());
        }
        return summary;
    }

    private void process(LabelRefreshRequest req, MonthScope scope, LabelRefreshSummary summary) {
        List<MealServiceEventEntity> events = eventRepo.findServedBetween(req.organizationId(), scope.start(), scope.end());
        int limit = req.limit() == null ? 0 : req.limit();
        if (limit > 0 && events.size() > limit) {
            events = events.subList(0, limit);
        }
        summary.setEventCount(events.size());

        Instant frozenAt = Instant.now();
        for (MealServiceEventEntity event : events) {
            try {
                EventLabelInput input = loader.load(event);
                LineageResult result = builder.build(input, frozenAt);
                summary.getEvents().add(result);
                summary.setRefreshedEvents(summary.getRefreshedEvents() + 1);
                if (result.provisional()) {
                    summary.setProvisionalEvents(summary.getProvisionalEvents() + 1);
                }
            } catch (LabelRefreshException e) {
                log.warn("label refresh skipped eventId={} code={} msg={}", event.getId(), e.getCode(), e.getMessage());
                summary.getErrors().add(new LabelRefreshSummary.EventError(event.getId(), e.getCode(), e.getMessage()));
            }
        }
    }
}
