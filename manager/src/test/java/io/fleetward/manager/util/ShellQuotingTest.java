package io.fleetward.manager.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ShellQuotingTest {

    @Test
    void wrapsPlainValue() {
        Assertions.assertEquals("'/etc/nginx/nginx.conf'", ShellQuoting.quote("/etc/nginx/nginx.conf"));
    }

    @Test
    void escapesEmbeddedSingleQuote() {
        Assertions.assertEquals("'it'\"'\"'s'", ShellQuoting.quote("it's"));
    }
}
