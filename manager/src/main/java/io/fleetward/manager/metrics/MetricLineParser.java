package io.fleetward.manager.metrics;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracts custom metrics that health check commands print as
 * {@code METRIC:key=value} lines.
 *
 * <p>Numeric values become {@link Double}s, anything else is kept as a
 * string. Lines without the marker, without a key or without {@code =} are
 * ignored. A later line overrides an earlier one with the same key.</p>
 */
public final class MetricLineParser {

    public static final String MARKER = "METRIC:";

    private MetricLineParser() {
    }

    @Nonnull
    public static Map<String, Object> parse(@Nonnull String output) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        for (String rawLine : output.split("\\R")) {
            String line = rawLine.trim();
            if (!line.startsWith(MARKER)) {
                continue;
            }
            String body = line.substring(MARKER.length());
            int eq = body.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String key = body.substring(0, eq).trim();
            if (key.isEmpty()) {
                continue;
            }
            metrics.put(key, parseValue(body.substring(eq + 1).trim()));
        }
        return metrics;
    }

    private static Object parseValue(String value) {
        try {
            double number = Double.parseDouble(value);
            if (!Double.isNaN(number) && !Double.isInfinite(number)) {
                return number;
            }
        } catch (NumberFormatException e) {
            // not numeric
        }
        return value;
    }
}
