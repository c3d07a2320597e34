package io.fleetward.api.remote;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builder for {@link ServerConfig}.
 */
public class ServerConfigBuilder {

    private String name;
    private String host;
    private int port = ServerConfig.DEFAULT_PORT;
    private String username;
    private String password;
    private String privateKeyPath;
    private final Map<String, String> tags = new HashMap<>();

    public ServerConfigBuilder name(@Nonnull String name) {
        this.name = name;
        return this;
    }

    public ServerConfigBuilder host(@Nonnull String host) {
        this.host = host;
        return this;
    }

    /**
     * Set the SSH port. Zero selects the default port.
     */
    public ServerConfigBuilder port(int port) {
        this.port = port == 0 ? ServerConfig.DEFAULT_PORT : port;
        return this;
    }

    public ServerConfigBuilder username(@Nonnull String username) {
        this.username = username;
        return this;
    }

    public ServerConfigBuilder password(@Nullable String password) {
        this.password = password;
        return this;
    }

    public ServerConfigBuilder privateKeyPath(@Nullable String privateKeyPath) {
        this.privateKeyPath = privateKeyPath;
        return this;
    }

    public ServerConfigBuilder tag(@Nonnull String key, @Nonnull String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        this.tags.put(key, value);
        return this;
    }

    public ServerConfigBuilder tags(@Nonnull Map<String, String> tags) {
        Objects.requireNonNull(tags, "tags");
        this.tags.putAll(tags);
        return this;
    }

    public ServerConfig build() {
        return new ServerConfig(name, host, port, username, password, privateKeyPath, new HashMap<>(tags));
    }
}
