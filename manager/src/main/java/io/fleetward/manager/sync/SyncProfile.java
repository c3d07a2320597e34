package io.fleetward.manager.sync;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Named definition of a local path synced to a remote path on many servers.
 *
 * @param name unique profile name
 * @param description free text
 * @param sourcePath local file or directory
 * @param targetPath remote path
 * @param servers target server names
 * @param excludes glob patterns of files to leave out of a directory sync
 * @param preCommands commands run before the transfer; the first failure aborts
 * @param postCommands commands run after the transfer; a failure fails the server
 * @param backupBefore whether to copy the existing target aside first
 * @param validate whether to compare remote and source fingerprints afterwards
 * @param permissions octal mode applied to the target, or null
 * @param owner owning user applied to the target, or null
 * @param group owning group applied to the target, or null
 * @param tags free-form labels
 * @param createdAt creation time
 * @param updatedAt time of the last change
 */
public record SyncProfile(
        @Nonnull String name,
        @Nonnull String description,
        @Nonnull String sourcePath,
        @Nonnull String targetPath,
        @Nonnull List<String> servers,
        @Nonnull List<String> excludes,
        @Nonnull List<String> preCommands,
        @Nonnull List<String> postCommands,
        boolean backupBefore,
        boolean validate,
        @Nullable String permissions,
        @Nullable String owner,
        @Nullable String group,
        @Nonnull Map<String, String> tags,
        @Nullable Instant createdAt,
        @Nullable Instant updatedAt
) {

    public SyncProfile {
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        sourcePath = sourcePath == null ? "" : sourcePath;
        targetPath = targetPath == null ? "" : targetPath;
        servers = servers == null ? List.of() : List.copyOf(servers);
        excludes = excludes == null ? List.of() : List.copyOf(excludes);
        preCommands = preCommands == null ? List.of() : List.copyOf(preCommands);
        postCommands = postCommands == null ? List.of() : List.copyOf(postCommands);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /**
     * Start a profile definition with the required fields.
     */
    @Nonnull
    public static Builder builder(
            @Nonnull String name,
            @Nonnull String sourcePath,
            @Nonnull String targetPath,
            @Nonnull List<String> servers) {
        return new Builder(name, sourcePath, targetPath, servers);
    }

    SyncProfile withTimestamps(Instant created, Instant updated) {
        return new SyncProfile(name, description, sourcePath, targetPath, servers, excludes, preCommands,
                postCommands, backupBefore, validate, permissions, owner, group, tags, created, updated);
    }

    /**
     * Builder for profile definitions.
     */
    public static final class Builder {

        private final String name;
        private final String sourcePath;
        private final String targetPath;
        private final List<String> servers;
        private String description = "";
        private final List<String> excludes = new ArrayList<>();
        private final List<String> preCommands = new ArrayList<>();
        private final List<String> postCommands = new ArrayList<>();
        private boolean backupBefore;
        private boolean validate = true;
        private String permissions;
        private String owner;
        private String group;
        private final Map<String, String> tags = new HashMap<>();

        private Builder(String name, String sourcePath, String targetPath, List<String> servers) {
            this.name = name;
            this.sourcePath = sourcePath;
            this.targetPath = targetPath;
            this.servers = servers == null ? new ArrayList<>() : new ArrayList<>(servers);
        }

        public Builder description(@Nonnull String description) {
            this.description = description;
            return this;
        }

        public Builder exclude(@Nonnull String pattern) {
            excludes.add(pattern);
            return this;
        }

        public Builder preCommand(@Nonnull String command) {
            preCommands.add(command);
            return this;
        }

        public Builder postCommand(@Nonnull String command) {
            postCommands.add(command);
            return this;
        }

        public Builder backupBefore(boolean backupBefore) {
            this.backupBefore = backupBefore;
            return this;
        }

        public Builder validate(boolean validate) {
            this.validate = validate;
            return this;
        }

        public Builder permissions(@Nullable String permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder owner(@Nullable String owner) {
            this.owner = owner;
            return this;
        }

        public Builder group(@Nullable String group) {
            this.group = group;
            return this;
        }

        public Builder tag(@Nonnull String key, @Nonnull String value) {
            tags.put(key, value);
            return this;
        }

        public SyncProfile build() {
            return new SyncProfile(name, description, sourcePath, targetPath, servers, excludes, preCommands,
                    postCommands, backupBefore, validate, permissions, owner, group, tags, null, null);
        }
    }
}
