package io.fleetward.manager.connection;

import io.fleetward.api.remote.ServerConfig;
import io.fleetward.manager.config.FleetConfig;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Creates JSch-backed connections using the configured SSH settings.
 */
public class SshConnectionFactory implements ConnectionFactory {

    private final FleetConfig.SshSettings settings;

    public SshConnectionFactory(@Nonnull FleetConfig.SshSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    @Nonnull
    public RemoteConnection create(@Nonnull ServerConfig config) {
        return new SshConnection(config, settings.isStrictHostKeyChecking(), settings.getKnownHostsFile());
    }
}
