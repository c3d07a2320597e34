package io.fleetward.manager.metrics;

import io.fleetward.api.remote.LoadAverage;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class SystemMetricsParserTest {

    @Test
    void parsesLoadAverage() {
        LoadAverage load = SystemMetricsParser.parseLoadAverage("0.52 0.58 0.59 1/389 12345\n");

        Assertions.assertNotNull(load);
        Assertions.assertEquals(0.52, load.oneMinute());
        Assertions.assertEquals(0.58, load.fiveMinutes());
        Assertions.assertEquals(0.59, load.fifteenMinutes());
        Assertions.assertNull(SystemMetricsParser.parseLoadAverage("garbage"));
    }

    @Test
    void percentAcceptsSignAndRejectsOutOfRange() {
        Assertions.assertEquals(37.0, SystemMetricsParser.parsePercent(" 37% \n"));
        Assertions.assertEquals(12.5, SystemMetricsParser.parsePercent("12.5"));
        Assertions.assertNull(SystemMetricsParser.parsePercent("140"));
        Assertions.assertNull(SystemMetricsParser.parsePercent(""));
    }

    @Test
    void cpuUsageIsComplementOfIdle() {
        Assertions.assertEquals(6.8, SystemMetricsParser.parseCpuUsageFromIdle("93.2"));
        Assertions.assertNull(SystemMetricsParser.parseCpuUsageFromIdle("n/a"));
    }

    @Test
    void processCountExcludesHeader() {
        Assertions.assertEquals(211, SystemMetricsParser.parseProcessCount("212\n"));
        Assertions.assertNull(SystemMetricsParser.parseProcessCount("0"));
    }

    @Test
    void parsesUptimeSeconds() {
        Assertions.assertEquals(Duration.ofMillis(35212470), SystemMetricsParser.parseUptime("35212.47 140023.11"));
        Assertions.assertNull(SystemMetricsParser.parseUptime(""));
    }
}
