package com.calai.nutrilabel.label.lineage;

/**
 * 單一出餐無法重建 label（沒有 active recipe / 沒有 recipe line / 沒有消耗紀錄 ...）
 * ✅ 由 batch 接住、記錄後跳過，不會讓整批失敗
 */
public class LabelRefreshException extends Exception {

    private final String code;

    public LabelRefreshException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
