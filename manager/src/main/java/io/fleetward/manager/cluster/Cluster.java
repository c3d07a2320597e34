package io.fleetward.manager.cluster;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Named group of server names.
 *
 * <p>Members are plain names. They are resolved against the registry when
 * the cluster is used, not when it is created.</p>
 *
 * @param name unique cluster name
 * @param description free text, may be empty
 * @param servers member server names
 * @param tags free-form labels
 * @param createdAt creation time
 * @param updatedAt time of the last change
 * @param health last computed health, or null if never checked
 */
public record Cluster(
        @Nonnull String name,
        @Nonnull String description,
        @Nonnull List<String> servers,
        @Nonnull Map<String, String> tags,
        @Nonnull Instant createdAt,
        @Nonnull Instant updatedAt,
        @Nullable ClusterHealth health
) {

    public Cluster {
        description = description == null ? "" : description;
        servers = servers == null ? List.of() : List.copyOf(servers);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public int size() {
        return servers.size();
    }

    public boolean hasServer(@Nonnull String server) {
        return servers.contains(server);
    }

    Cluster withServers(List<String> newServers, Instant now) {
        return new Cluster(name, description, newServers, tags, createdAt, now, health);
    }

    Cluster withHealth(ClusterHealth newHealth) {
        return new Cluster(name, description, servers, tags, createdAt, updatedAt, newHealth);
    }
}
