package io.fleetward.manager.connection;

import io.fleetward.api.remote.ServerConfig;

import javax.annotation.Nonnull;

/**
 * Creates unconnected {@link RemoteConnection}s for server configs.
 */
@FunctionalInterface
public interface ConnectionFactory {

    @Nonnull
    RemoteConnection create(@Nonnull ServerConfig config);
}
