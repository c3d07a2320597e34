package io.fleetward.manager.metrics;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

final class MetricLineParserTest {

    @Test
    void parsesNumericAndTextValues() {
        String output = String.join("\n",
                "checking queue",
                "METRIC:queue_depth=42",
                "  METRIC:mode = degraded  ",
                "done");

        Map<String, Object> metrics = MetricLineParser.parse(output);

        Assertions.assertEquals(2, metrics.size());
        Assertions.assertEquals(42.0, metrics.get("queue_depth"));
        Assertions.assertEquals("degraded", metrics.get("mode"));
    }

    @Test
    void laterLineWins() {
        Map<String, Object> metrics = MetricLineParser.parse("METRIC:conn=1\nMETRIC:conn=7\n");

        Assertions.assertEquals(7.0, metrics.get("conn"));
    }

    @Test
    void ignoresMalformedLines() {
        Map<String, Object> metrics = MetricLineParser.parse("METRIC:novalue\nMETRIC:=3\nmetric:x=1\n");

        Assertions.assertTrue(metrics.isEmpty());
    }

    @Test
    void splitsOnFirstEquals() {
        Map<String, Object> metrics = MetricLineParser.parse("METRIC:query=a=b");

        Assertions.assertEquals("a=b", metrics.get("query"));
    }
}
