package com.calai.nutrilabel.nutrient.reconcile;

import com.calai.nutrilabel.nutrient.resolve.ResolverMode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 補值 batch 的摘要（fatal 失敗時也會回傳，success=false）
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReconcileSummary {

    private Instant startedAt;
    private String organizationId;
    private boolean dryRun;
    private ResolverMode mode;
    private String retrievalRunId;

    private int groupsProcessed;
    private int productsProcessed;
    private int upserts;
    private int productsWithMissingCoreAfter;
    private int verificationTasksCreated;
    private List<String> upstreamRateLimited = new ArrayList<>();

    private List<String> errors = new ArrayList<>();
    private List<GroupOutcome> groupOutcomes = new ArrayList<>();

    private Instant finishedAt;
    private boolean success;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GroupOutcome(
            String ingredientKey,
            int products,
            int resolvedKeys,
            boolean coreResolved,
            String note
    ) {}
}
