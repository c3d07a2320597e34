package io.fleetward.manager.registry;

import io.fleetward.api.remote.ServerConfig;
import io.fleetward.api.remote.ServerInfo;
import io.fleetward.api.remote.ServerStatus;
import io.fleetward.manager.connection.RemoteConnection;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry entry: a server definition plus its runtime state and cached
 * connection. Only the registry touches these.
 */
final class ServerRecord {

    private final ServerConfig config;
    private final ReentrantLock connectLock = new ReentrantLock();

    private volatile ServerStatus status = ServerStatus.UNKNOWN;
    private volatile Instant lastChecked;
    private volatile String lastError;
    private final AtomicReference<RemoteConnection> connection = new AtomicReference<>();

    ServerRecord(@Nonnull ServerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Nonnull
    ServerConfig getConfig() {
        return config;
    }

    @Nonnull
    String getName() {
        return config.name();
    }

    @Nonnull
    ServerStatus getStatus() {
        return status;
    }

    /**
     * Record the outcome of an operation.
     *
     * @return the previous status
     */
    ServerStatus markChecked(@Nonnull ServerStatus newStatus, @Nullable String error) {
        ServerStatus previous = status;
        status = newStatus;
        lastError = error;
        lastChecked = Instant.now();
        return previous;
    }

    /**
     * Lock serializing connection setup for this server.
     */
    ReentrantLock connectLock() {
        return connectLock;
    }

    @Nullable
    RemoteConnection getConnection() {
        return connection.get();
    }

    void setConnection(@Nonnull RemoteConnection newConnection) {
        RemoteConnection previous = connection.getAndSet(newConnection);
        if (previous != null && previous != newConnection) {
            previous.close();
        }
    }

    /**
     * Detach and close the cached connection, if any.
     */
    void evictConnection() {
        RemoteConnection current = connection.getAndSet(null);
        if (current != null) {
            current.close();
        }
    }

    /**
     * Detach and close {@code failed} if it is still the cached connection.
     */
    void evictConnection(@Nonnull RemoteConnection failed) {
        if (connection.compareAndSet(failed, null)) {
            failed.close();
        }
    }

    @Nonnull
    ServerInfo toInfo() {
        return new ServerInfo(config, status, lastChecked, lastError, connection.get() != null);
    }
}
