package com.calai.nutrilabel.common.error;

/**
 * 批次範圍參數錯誤（例如 month 不是 YYYY-MM）
 * ✅ 在開 transaction 之前丟出，不做任何事
 */
public class InvalidBatchScopeException extends IllegalArgumentException {

    private final String code;

    public InvalidBatchScopeException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
