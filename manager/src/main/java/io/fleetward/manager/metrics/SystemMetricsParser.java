package io.fleetward.manager.metrics;

import io.fleetward.api.remote.LoadAverage;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;

/**
 * Parses the output of the standard system metric commands. Every method
 * returns null for output it cannot make sense of.
 */
public final class SystemMetricsParser {

    private SystemMetricsParser() {
    }

    /**
     * Parse {@code /proc/loadavg}, e.g. {@code 0.52 0.58 0.59 1/389 12345}.
     */
    @Nullable
    public static LoadAverage parseLoadAverage(@Nonnull String output) {
        String[] fields = output.trim().split("\\s+");
        if (fields.length < 3) {
            return null;
        }
        Double one = parseDouble(fields[0]);
        Double five = parseDouble(fields[1]);
        Double fifteen = parseDouble(fields[2]);
        if (one == null || five == null || fifteen == null) {
            return null;
        }
        return new LoadAverage(one, five, fifteen);
    }

    /**
     * Parse a percentage, tolerating a trailing {@code %} sign.
     */
    @Nullable
    public static Double parsePercent(@Nonnull String output) {
        String value = output.trim();
        if (value.endsWith("%")) {
            value = value.substring(0, value.length() - 1).trim();
        }
        Double percent = parseDouble(value);
        if (percent == null || percent < 0 || percent > 100) {
            return null;
        }
        return percent;
    }

    /**
     * Parse an idle percentage and convert it to usage.
     */
    @Nullable
    public static Double parseCpuUsageFromIdle(@Nonnull String output) {
        Double idle = parsePercent(output);
        return idle == null ? null : Math.round((100.0 - idle) * 10.0) / 10.0;
    }

    /**
     * Parse a process count from {@code ps aux | wc -l}, which includes the header line.
     */
    @Nullable
    public static Integer parseProcessCount(@Nonnull String output) {
        try {
            int lines = Integer.parseInt(output.trim());
            return lines > 0 ? lines - 1 : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parse {@code /proc/uptime}, e.g. {@code 35212.47 140023.11}.
     */
    @Nullable
    public static Duration parseUptime(@Nonnull String output) {
        String[] fields = output.trim().split("\\s+");
        Double seconds = fields.length == 0 ? null : parseDouble(fields[0]);
        if (seconds == null || seconds <= 0) {
            return null;
        }
        return Duration.ofMillis((long) (seconds * 1000));
    }

    @Nullable
    private static Double parseDouble(String value) {
        try {
            double d = Double.parseDouble(value);
            return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
