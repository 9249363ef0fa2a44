package com.tracelens.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Aggregation window selector. The token only picks the window length; the caller
 * supplies the records inside the current window and the preceding one.
 *
 * <pre>
 *   1h   last_hour
 *   24h  last_24h, today
 *   7d   last_7d, week
 *   30d  last_30d, month
 *   90d  last_90d
 * </pre>
 */
public enum TimeRange {
    LAST_HOUR("1h",  Duration.ofHours(1),  List.of("last_hour")),
    LAST_DAY("24h",  Duration.ofHours(24), List.of("last_24h", "today")),
    LAST_WEEK("7d",  Duration.ofDays(7),   List.of("last_7d", "week")),
    LAST_MONTH("30d", Duration.ofDays(30), List.of("last_30d", "month")),
    LAST_QUARTER("90d", Duration.ofDays(90), List.of("last_90d"));

    private final String token;
    private final Duration window;
    private final List<String> aliases;

    TimeRange(String token, Duration window, List<String> aliases) {
        this.token   = token;
        this.window  = window;
        this.aliases = aliases;
    }

    @JsonValue
    public String token() {
        return token;
    }

    public Duration window() {
        return window;
    }

    /** Window length in (possibly fractional) days; 1h is 1/24. */
    public double windowDays() {
        return window.toMinutes() / (24.0 * 60.0);
    }

    /**
     * Parses a range token or one of its aliases.
     *
     * @throws IllegalArgumentException for unsupported tokens
     */
    @JsonCreator
    public static TimeRange fromToken(String value) {
        if (value == null) {
            throw new IllegalArgumentException("time range must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TimeRange range : values()) {
            if (range.token.equals(normalized) || range.aliases.contains(normalized)) {
                return range;
            }
        }
        throw new IllegalArgumentException("unsupported time range: " + value);
    }
}
