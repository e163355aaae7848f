package com.calai.nutrilabel.label.evidence;

import com.calai.nutrilabel.nutrient.model.EvidenceGrade;
import com.calai.nutrilabel.nutrient.model.VerificationStatus;

/**
 * 一筆營養值列的證據資訊（lot × nutrient key）
 * - grade / status 可能是 null（舊資料）
 */
public record EvidenceRow(
        EvidenceGrade evidenceGrade,
        VerificationStatus verificationStatus,
        boolean historicalException,
        String sourceRef,
        boolean syntheticLot
) {}
