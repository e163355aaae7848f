package com.calai.nutrilabel.label.refresh;

import com.calai.nutrilabel.label.lineage.LineageResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * label 重建 batch 的摘要
 * - errors：單一出餐失敗（batch 繼續）
 * - fatalError：整批 rollback 的原因
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LabelRefreshSummary {

    private Instant startedAt;
    private String organizationId;
    private String month;
    private boolean dryRun;

    private int eventCount;
    private List<LineageResult> events = new ArrayList<>();
    private int refreshedEvents;
    private int provisionalEvents;
    private List<EventError> errors = new ArrayList<>();

    private String fatalError;
    private Instant finishedAt;
    private boolean success;

    public record EventError(String eventId, String code, String message) {}
}
