package com.calai.nutrilabel.label.evidence;

import com.calai.nutrilabel.nutrient.model.EvidenceGrade;
import com.calai.nutrilabel.nutrient.model.VerificationStatus;

import java.util.Collection;
import java.util.EnumSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 證據彙總：lot / product / ingredient / SKU 各自從「原始列」算，不從子節點的 summary 再加總
 * - inferred：INFERRED_FROM_INGREDIENT / INFERRED_FROM_SIMILAR_PRODUCT
 * - exception：historicalException 或 HISTORICAL_EXCEPTION 等級
 * - unverified：狀態不是 VERIFIED（含 null）
 * - synthetic lot：強制 SYNTHETIC_LOT_USAGE + HISTORICAL_EXCEPTION
 */
public final class EvidenceAggregator {

    private EvidenceAggregator() {}

    public static final String UNKNOWN_GRADE = "UNKNOWN";

    public static EvidenceSummary aggregate(Collection<EvidenceRow> rows) {
        int verified = 0;
        int inferred = 0;
        int exception = 0;
        int unverified = 0;
        int total = 0;
        boolean synthetic = false;

        TreeSet<String> refs = new TreeSet<>();
        TreeMap<String, Integer> grades = new TreeMap<>();
        EnumSet<ReasonCode> codes = EnumSet.noneOf(ReasonCode.class);

        if (rows != null) {
            for (EvidenceRow r : rows) {
                if (r == null) continue;
                total++;

                EvidenceGrade g = r.evidenceGrade();
                grades.merge(g == null ? UNKNOWN_GRADE : g.name(), 1, Integer::sum);

                if (g != null && g.isInferred()) inferred++;

                if (r.historicalException() || (g != null && g.isException())) {
                    exception++;
                    codes.add(ReasonCode.HISTORICAL_EXCEPTION);
                }

                if (r.verificationStatus() == VerificationStatus.VERIFIED) {
                    verified++;
                } else {
                    unverified++;
                    codes.add(ReasonCode.UNVERIFIED_SOURCE);
                }

                if (r.syntheticLot()) {
                    synthetic = true;
                    codes.add(ReasonCode.SYNTHETIC_LOT_USAGE);
                    codes.add(ReasonCode.HISTORICAL_EXCEPTION);
                }

                if (r.sourceRef() != null && !r.sourceRef().isBlank()) refs.add(r.sourceRef());
            }
        }

        boolean provisional = unverified > 0 || inferred > 0 || exception > 0 || synthetic;
        return new EvidenceSummary(verified, inferred, exception, unverified, total,
                refs, grades, codes, synthetic, provisional);
    }

    public static VerificationStatusSummary verificationStatusSummary(Collection<EvidenceRow> rows) {
        int verified = 0;
        int needsReview = 0;
        int rejected = 0;
        if (rows != null) {
            for (EvidenceRow r : rows) {
                if (r == null) continue;
                VerificationStatus s = r.verificationStatus();
                if (s == VerificationStatus.VERIFIED) verified++;
                else if (s == VerificationStatus.REJECTED) rejected++;
                else needsReview++;
            }
        }
        return new VerificationStatusSummary(verified, needsReview, rejected);
    }
}
