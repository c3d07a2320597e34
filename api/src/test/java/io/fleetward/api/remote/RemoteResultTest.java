package io.fleetward.api.remote;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;

final class RemoteResultTest {

    @Test
    void nonZeroExitIsNotSuccess() {
        RemoteResult result = RemoteResult.completed("web1", "false", "", 1, Instant.now());

        Assertions.assertFalse(result.success());
        Assertions.assertFalse(result.timedOut());
        Assertions.assertNull(result.error());
    }

    @Test
    void timedOutKeepsPartialOutputAndHasNoExitCode() {
        RemoteResult result = RemoteResult.timedOut("web1", "sleep 60", "partial", Instant.now());

        Assertions.assertFalse(result.success());
        Assertions.assertTrue(result.timedOut());
        Assertions.assertEquals("partial", result.output());
        Assertions.assertEquals(RemoteResult.NO_EXIT_CODE, result.exitCode());
    }

    @Test
    void failedCarriesError() {
        RemoteResult result = RemoteResult.failed("web2", "uptime", "connection refused", Instant.now());

        Assertions.assertFalse(result.success());
        Assertions.assertEquals("connection refused", result.error());
        Assertions.assertEquals("", result.output());
    }
}
