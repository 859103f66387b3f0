package com.asiainfo.dimensional.domain.time;

import com.asiainfo.dimensional.domain.model.Grain;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;

/**
 * 将时间戳归入指定粒度的桶，返回桶起点（UTC）
 */
public final class TimeBucketing {

    private TimeBucketing() {
    }

    public static Instant bucketStart(Grain grain, Instant ts) {
        ZonedDateTime t = ts.atZone(ZoneOffset.UTC);
        ZonedDateTime bucket = switch (grain) {
            case MIN_30 -> {
                ZonedDateTime hour = t.truncatedTo(ChronoUnit.HOURS);
                yield t.getMinute() >= 30 ? hour.plusMinutes(30) : hour;
            }
            case HOUR -> t.truncatedTo(ChronoUnit.HOURS);
            case DAY -> t.truncatedTo(ChronoUnit.DAYS);
            case WEEK -> weekStart(t);
            case BIWEEK -> {
                // 相位由 ISO 周序号奇偶决定，跨 ISO 年时会重置
                ZonedDateTime week = weekStart(t);
                int isoWeek = t.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
                yield isoWeek % 2 == 1 ? week.minusWeeks(1) : week;
            }
            case MONTH -> t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
            case QUARTER -> {
                int firstMonth = ((t.getMonthValue() - 1) / 3) * 3 + 1;
                yield t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).withMonth(firstMonth);
            }
        };
        return bucket.toInstant();
    }

    private static ZonedDateTime weekStart(ZonedDateTime t) {
        return t.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }
}
