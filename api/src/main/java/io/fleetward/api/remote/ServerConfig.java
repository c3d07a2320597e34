package io.fleetward.api.remote;

import io.fleetward.api.error.ValidationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * Connection definition for one remote server.
 *
 * <p>The name is the server's identity inside a registry and never changes;
 * everything else can be replaced through an update. Authentication uses
 * either a password or a private key file. When both are set the key wins.</p>
 *
 * @param name unique server name
 * @param host host name or address
 * @param port SSH port
 * @param username login user
 * @param password password, or null for key authentication
 * @param privateKeyPath path to a private key file, or null for password authentication
 * @param tags free-form labels
 */
public record ServerConfig(
        @Nonnull String name,
        @Nonnull String host,
        int port,
        @Nonnull String username,
        @Nullable String password,
        @Nullable String privateKeyPath,
        @Nonnull Map<String, String> tags
) {

    public static final int DEFAULT_PORT = 22;

    public ServerConfig {
        name = name == null ? "" : name;
        host = host == null ? "" : host;
        username = username == null ? "" : username;
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /**
     * Create a builder for server configs.
     *
     * @return new builder
     */
    @Nonnull
    public static ServerConfigBuilder builder() {
        return new ServerConfigBuilder();
    }

    /**
     * Create a builder pre-filled with this config's values.
     *
     * @return new builder
     */
    @Nonnull
    public ServerConfigBuilder toBuilder() {
        return new ServerConfigBuilder()
                .name(name)
                .host(host)
                .port(port)
                .username(username)
                .password(password)
                .privateKeyPath(privateKeyPath)
                .tags(tags);
    }

    /**
     * Check whether key-based authentication is used.
     *
     * @return true if a private key path is configured
     */
    public boolean usesKeyAuthentication() {
        return privateKeyPath != null && !privateKeyPath.isBlank();
    }

    /**
     * Validate the config without touching the network.
     *
     * @throws ValidationException if a required field is missing or out of range
     */
    public void validate() {
        if (name.isBlank()) {
            throw new ValidationException("Server name is required");
        }
        if (host.isBlank()) {
            throw new ValidationException("Host is required for server: " + name);
        }
        if (port < 1 || port > 65535) {
            throw new ValidationException("Port out of range for server " + name + ": " + port);
        }
        if (username.isBlank()) {
            throw new ValidationException("Username is required for server: " + name);
        }
        boolean hasPassword = password != null && !password.isEmpty();
        if (!hasPassword && !usesKeyAuthentication()) {
            throw new ValidationException("Either password or private key path is required for server: " + name);
        }
    }

    @Override
    public String toString() {
        return "ServerConfig{"
                + "name='" + name + '\''
                + ", host='" + host + '\''
                + ", port=" + port
                + ", username='" + username + '\''
                + ", password=" + (password == null ? "null" : "****")
                + ", privateKeyPath=" + privateKeyPath
                + ", tags=" + tags
                + '}';
    }
}
