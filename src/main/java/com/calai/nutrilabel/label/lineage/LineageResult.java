package com.calai.nutrilabel.label.lineage;

/**
 * 單一出餐重建結果
 * - priorLabelId：重建前 event 指向的 SKU snapshot（保留供 diff，不刪）
 */
public record LineageResult(
        String eventId,
        String priorLabelId,
        String newLabelId,
        int consumedLots,
        int snapshotsCreated,
        boolean provisional,
        boolean qaPass
) {}
