package com.my.memory.domain.service;

import com.my.memory.domain.exception.InvalidRequestException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "7d", "24h", "2 weeks", "today", "yesterday", ISO 날짜를 기준 시각으로 바꾼다.
 */
public final class TimeframeParser {

    private static final Pattern RELATIVE = Pattern.compile(
            "^(\\d+)\\s*(m|min|mins|minute|minutes|h|hr|hrs|hour|hours|d|day|days|w|week|weeks|month|months|y|year|years)(\\s+ago)?$");

    private TimeframeParser() {
    }

    /**
     * timeframe 이 비어 있으면 null 을 돌려준다.
     */
    public static Instant since(String timeframe, Instant now) {
        if (timeframe == null || timeframe.isBlank()) {
            return null;
        }
        String value = timeframe.strip().toLowerCase(Locale.ROOT);
        switch (value) {
            case "today":
                return now.truncatedTo(ChronoUnit.DAYS);
            case "yesterday":
                return now.truncatedTo(ChronoUnit.DAYS).minus(Duration.ofDays(1));
            case "last week":
                return now.minus(Duration.ofDays(7));
            case "last month":
                return now.minus(Duration.ofDays(30));
            default:
                break;
        }
        Matcher matcher = RELATIVE.matcher(value);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            return now.minus(unit(matcher.group(2)).multipliedBy(amount));
        }
        try {
            return Instant.parse(timeframe.strip());
        } catch (DateTimeParseException ignored) {
            // 날짜 형식으로 다시 시도한다.
        }
        try {
            return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("지원하지 않는 timeframe 입니다: " + timeframe, e);
        }
    }

    private static Duration unit(String unit) {
        if (unit.startsWith("mi") || unit.equals("m")) {
            return Duration.ofMinutes(1);
        }
        if (unit.startsWith("h")) {
            return Duration.ofHours(1);
        }
        if (unit.startsWith("d")) {
            return Duration.ofDays(1);
        }
        if (unit.startsWith("w")) {
            return Duration.ofDays(7);
        }
        if (unit.startsWith("mo")) {
            return Duration.ofDays(30);
        }
        return Duration.ofDays(365);
    }
}
