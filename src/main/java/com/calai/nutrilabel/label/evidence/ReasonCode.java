package com.calai.nutrilabel.label.evidence;

/**
 * 宣告順序 = 輸出順序
 */
public enum ReasonCode {
    PLAUSIBILITY_ERROR,
    PLAUSIBILITY_WARNING,
    UNVERIFIED_SOURCE,
    HISTORICAL_EXCEPTION,
    SYNTHETIC_LOT_USAGE
}
