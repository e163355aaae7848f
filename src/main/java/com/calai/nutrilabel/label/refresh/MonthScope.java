package com.calai.nutrilabel.label.refresh;

import com.calai.nutrilabel.common.error.InvalidBatchScopeException;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.regex.Pattern;

/**
 * "YYYY-MM" → [當月 1 日 00:00Z, 下個月 1 日 00:00Z)
 */
public record MonthScope(String month, Instant start, Instant end) {

    private static final Pattern MONTH = Pattern.compile("^\\d{4}-\\d{2}$");

    public static MonthScope parse(String raw) {
        String m = raw == null ? "" : raw.trim();
        if (!MONTH.matcher(m).matches()) {
            throw new InvalidBatchScopeException("INVALID_MONTH", "month must be YYYY-MM: " + raw);
        }
        int mm = Integer.parseInt(m.substring(5));
        if (mm < 1 || mm > 12) {
            throw new InvalidBatchScopeException("INVALID_MONTH", "month out of range: " + raw);
        }

        YearMonth ym = YearMonth.of(Integer.parseInt(m.substring(0, 4)), mm);
        Instant start = ym.atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
        Instant end = ym.plusMonths(1).atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
        return new MonthScope(m, start, end);
    }
}
