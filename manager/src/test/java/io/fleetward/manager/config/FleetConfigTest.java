package io.fleetward.manager.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

final class FleetConfigTest {

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        Path root = Files.createTempDirectory("fleetward-test-config-");
        Path file = root.resolve("fleet.yml");

        FleetConfig config = FleetConfig.load(file);

        Assertions.assertTrue(Files.exists(file));
        Assertions.assertEquals(Duration.ofSeconds(10), config.getSsh().connectTimeout());
        Assertions.assertEquals(Duration.ofSeconds(60), config.getSsh().commandTimeout());
        Assertions.assertEquals(1000, config.getMonitor().getMaxAlerts());
        Assertions.assertEquals(1000, config.getSync().getMaxHistory());
        Assertions.assertTrue(config.getPersistence().isEnabled());
        Assertions.assertFalse(Files.readString(file).contains("!!"));
    }

    @Test
    void partialFileKeepsDefaultsForMissingKeys() throws Exception {
        Path root = Files.createTempDirectory("fleetward-test-config-");
        Path file = root.resolve("fleet.yml");
        Files.write(file, String.join("\n",
                "ssh:",
                "  commandTimeoutSeconds: 15",
                "monitor:",
                "  maxAlerts: 50",
                "  autoStart: true",
                "").getBytes(StandardCharsets.UTF_8));

        FleetConfig config = FleetConfig.load(file);

        Assertions.assertEquals(Duration.ofSeconds(15), config.getSsh().commandTimeout());
        Assertions.assertEquals(Duration.ofSeconds(10), config.getSsh().connectTimeout());
        Assertions.assertEquals(50, config.getMonitor().getMaxAlerts());
        Assertions.assertTrue(config.getMonitor().isAutoStart());
        Assertions.assertEquals("/tmp", config.getSync().getTempDirectory());
    }

    @Test
    void savedConfigLoadsBack() throws Exception {
        Path file = Files.createTempDirectory("fleetward-test-config-").resolve("fleet.yml");
        FleetConfig config = new FleetConfig();
        config.getSync().setMaxHistory(25);
        config.getPersistence().setStateDirectory("data");
        config.save(file);

        FleetConfig loaded = FleetConfig.load(file);

        Assertions.assertEquals(25, loaded.getSync().getMaxHistory());
        Assertions.assertEquals("data", loaded.getPersistence().getStateDirectory());
    }
}
