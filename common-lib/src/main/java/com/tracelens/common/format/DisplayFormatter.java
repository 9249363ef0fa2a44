package com.tracelens.common.format;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.NumberFormat;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Pure formatting helpers that turn raw telemetry values into display strings.
 *
 * <h3>Duration buckets</h3>
 * <pre>
 *   ms &lt; 1000        → "999ms"
 *   seconds &lt; 60     → "1.00s"
 *   minutes &lt; 60     → "1.50m"
 *   otherwise        → "2.00h"
 * </pre>
 *
 * <h3>Relative time buckets (all divisions floor)</h3>
 * <pre>
 *   &lt; 60s → "Ns ago", &lt; 60m → "Nm ago", &lt; 24h → "Nh ago",
 *   &lt; 30d → "Nd ago", &lt; 12mo → "Nmo ago" (30-day months), else "Ny ago"
 * </pre>
 *
 * <p>Stateless and thread-safe; {@link DecimalFormat} instances are created per call.
 */
public final class DisplayFormatter {

    private static final String CURRENCY_PATTERN = "$#,##0.00####";

    private static final DateTimeFormatter DATE_FORMAT =
        DateTimeFormatter.ofPattern("MMM d, yyyy, hh:mm:ss a", Locale.US);

    private static final DateTimeFormatter ISO_INPUT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private DisplayFormatter() {}

    // ── Durations ──────────────────────────────────────────────────

    /**
     * Formats a non-negative millisecond duration.
     *
     * @throws IllegalArgumentException when {@code ms} is negative
     */
    public static String formatDuration(long ms) {
        if (ms < 0) {
            throw new IllegalArgumentException("duration must not be negative: " + ms);
        }
        if (ms < 1000) return ms + "ms";

        double seconds = ms / 1000.0;
        if (seconds < 60) return twoDecimals(seconds, RoundingMode.HALF_UP) + "s";

        double minutes = seconds / 60.0;
        if (minutes < 60) return twoDecimals(minutes, RoundingMode.HALF_UP) + "m";

        double hours = minutes / 60.0;
        return twoDecimals(hours, RoundingMode.HALF_UP) + "h";
    }

    /**
     * Fractional variant used for averages. Sub-second values are cut, not rounded, to
     * 2 decimals so they never read as a full second ({@code 999.999 → "999.99ms"}).
     */
    public static String formatDuration(double ms) {
        if (ms < 0 || Double.isNaN(ms)) {
            throw new IllegalArgumentException("duration must not be negative: " + ms);
        }
        if (ms < 1000) {
            return ms == Math.rint(ms)
                ? (long) ms + "ms"
                : twoDecimals(ms, RoundingMode.DOWN) + "ms";
        }
        return formatDuration((long) ms);
    }

    /** Rounds the exact binary value of {@code value}, as JS {@code toFixed(2)} does. */
    private static String twoDecimals(double value, RoundingMode mode) {
        return new BigDecimal(value).setScale(2, mode).toPlainString();
    }

    // ── Currency & numbers ─────────────────────────────────────────

    /**
     * USD with at least 2 and at most 6 fraction digits; extra digits appear only
     * when needed, so {@code 0.000123} renders as {@code $0.000123} instead of {@code $0.00}.
     * Ties round away from zero, like {@code Intl.NumberFormat}.
     */
    public static String formatCurrency(double amount) {
        DecimalFormat format = new DecimalFormat(CURRENCY_PATTERN, DecimalFormatSymbols.getInstance(Locale.US));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format.format(amount);
    }

    /** en-US digit grouping, e.g. {@code 1234567 → "1,234,567"}. */
    public static String formatNumber(long value) {
        return NumberFormat.getIntegerInstance(Locale.US).format(value);
    }

    // ── Dates ──────────────────────────────────────────────────────

    /** Absolute timestamp such as {@code "Jan 5, 2025, 02:07:09 PM"} in the given zone. */
    public static String formatDate(Instant timestamp, ZoneId zone) {
        return DATE_FORMAT.format(timestamp.atZone(zone));
    }

    /**
     * Buckets the elapsed time between {@code timestamp} and {@code now}.
     * Timestamps later than {@code now} render as {@code "0s ago"}.
     */
    public static String formatRelativeTime(Instant timestamp, Instant now) {
        long diffInSeconds = Math.max(0L, Math.floorDiv(Duration.between(timestamp, now).toMillis(), 1000L));
        if (diffInSeconds < 60) return diffInSeconds + "s ago";

        long diffInMinutes = diffInSeconds / 60;
        if (diffInMinutes < 60) return diffInMinutes + "m ago";

        long diffInHours = diffInMinutes / 60;
        if (diffInHours < 24) return diffInHours + "h ago";

        long diffInDays = diffInHours / 24;
        if (diffInDays < 30) return diffInDays + "d ago";

        long diffInMonths = diffInDays / 30;
        if (diffInMonths < 12) return diffInMonths + "mo ago";

        return (diffInMonths / 12) + "y ago";
    }

    /**
     * ISO-8601 variant ({@code 2025-01-05T14:07:09Z} or with an explicit offset).
     *
     * @throws java.time.format.DateTimeParseException when {@code timestamp} is malformed
     */
    public static String formatRelativeTime(String timestamp, Instant now) {
        return formatRelativeTime(parseInstant(timestamp), now);
    }

    /**
     * Strict ISO-8601 parse shared by the string overloads; never yields a placeholder value.
     *
     * @throws java.time.format.DateTimeParseException when {@code value} is malformed
     */
    public static Instant parseInstant(String value) {
        if (value == null) {
            throw new java.time.format.DateTimeParseException("timestamp is null", "", 0);
        }
        return Instant.from(ISO_INPUT.parse(value.trim()));
    }

    // ── Text ───────────────────────────────────────────────────────

    /** Cuts {@code text} to {@code maxLength} characters and appends {@code "..."} when shortened. */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) return text;
        return text.substring(0, maxLength) + "...";
    }
}
