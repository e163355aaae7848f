package com.calai.nutrilabel.label.evidence;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

public record EvidenceSummary(
        int verifiedCount,
        int inferredCount,
        int exceptionCount,
        int unverifiedCount,
        int totalRows,
        SortedSet<String> sourceRefs,
        SortedMap<String, Integer> gradeBreakdown,
        Set<ReasonCode> reasonCodes,
        boolean syntheticLot,
        boolean provisional
) {
    public EvidenceSummary {
        sourceRefs = Collections.unmodifiableSortedSet(new TreeSet<>(sourceRefs));
        gradeBreakdown = Collections.unmodifiableSortedMap(new TreeMap<>(gradeBreakdown));
        EnumSet<ReasonCode> codes = EnumSet.noneOf(ReasonCode.class);
        codes.addAll(reasonCodes);
        reasonCodes = Collections.unmodifiableSet(codes);
    }

    /** 依 ReasonCode 宣告順序 */
    @JsonIgnore
    public List<String> reasonCodeNames() {
        return reasonCodes.stream().map(Enum::name).toList();
    }

    /** 追加 reason code（plausibility 用），provisional 不變 */
    public EvidenceSummary withReasonCodes(Set<ReasonCode> extra) {
        if (extra == null || extra.isEmpty()) return this;
        EnumSet<ReasonCode> codes = EnumSet.noneOf(ReasonCode.class);
        codes.addAll(reasonCodes);
        codes.addAll(extra);
        return new EvidenceSummary(verifiedCount, inferredCount, exceptionCount, unverifiedCount, totalRows,
                sourceRefs, gradeBreakdown, codes, syntheticLot, provisional);
    }

    public static EvidenceSummary empty() {
        return new EvidenceSummary(0, 0, 0, 0, 0, new TreeSet<>(), new TreeMap<>(),
                EnumSet.noneOf(ReasonCode.class), false, false);
    }
}
