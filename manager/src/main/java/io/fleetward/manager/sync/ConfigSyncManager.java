package io.fleetward.manager.sync;

import io.fleetward.api.error.ChecksumMismatchException;
import io.fleetward.api.error.NetworkException;
import io.fleetward.api.error.NotFoundException;
import io.fleetward.api.error.RemoteException;
import io.fleetward.api.error.ValidationException;
import io.fleetward.api.remote.RemoteManager;
import io.fleetward.api.remote.RemoteResult;
import io.fleetward.manager.config.FleetConfig;
import io.fleetward.manager.persistence.JsonDefinitionStore;
import io.fleetward.manager.util.FanOutExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.fleetward.manager.util.ShellQuoting.quote;

/**
 * Pushes local files and directories to remote paths on many servers.
 *
 * <p>Each sync fingerprints the source once and then works through every
 * server in parallel. On a single server the steps run in order: pre-commands,
 * backup, transfer, permissions, validation, post-commands. A failure on one
 * server never stops the others.</p>
 */
public class ConfigSyncManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigSyncManager.class);

    static final String TEMP_SUFFIX = ".fleetward-tmp";
    static final DateTimeFormatter BACKUP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final Pattern PERMISSIONS = Pattern.compile("[0-7]{3,4}");
    private static final Pattern MD5_LINE = Pattern.compile("^(\\\\)?([0-9a-f]{32}) [ *](.+)$");
    private static final String BACKUP_MARKER = "fleetward_backup_done";

    private final Map<String, SyncProfile> profiles = new HashMap<>();
    private final Deque<SyncEvent> history = new ArrayDeque<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final RemoteManager remote;
    private final FleetConfig.SyncSettings settings;
    private final FanOutExecutor fanOut;
    private final JsonDefinitionStore<SyncProfile> store;
    private final Clock clock;

    /**
     * Create a sync manager.
     *
     * @param remote server dispatcher
     * @param settings sync settings
     * @param fanOut executor for per-server syncs
     * @param store definition store, or null to keep profiles in memory only
     * @param clock time source
     */
    public ConfigSyncManager(
            @Nonnull RemoteManager remote,
            @Nonnull FleetConfig.SyncSettings settings,
            @Nonnull FanOutExecutor fanOut,
            @Nullable JsonDefinitionStore<SyncProfile> store,
            @Nonnull Clock clock) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
        this.store = store;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ==================== Profiles ====================

    /**
     * Register a sync profile.
     *
     * @param profile profile definition
     * @return the stored profile with timestamps set
     * @throws ValidationException if a required field is missing or the name is taken
     */
    @Nonnull
    public SyncProfile createSyncProfile(@Nonnull SyncProfile profile) {
        Objects.requireNonNull(profile, "profile");
        checkDefinition(profile);

        Instant now = clock.instant();
        SyncProfile stored = profile.withTimestamps(now, now);

        lock.writeLock().lock();
        try {
            if (profiles.containsKey(stored.name())) {
                throw new ValidationException("Sync profile already exists: " + stored.name());
            }
            profiles.put(stored.name(), stored);
        } finally {
            lock.writeLock().unlock();
        }

        persist(stored);
        LOGGER.info("Created sync profile '{}' ({} -> {} on {} servers)",
                stored.name(), stored.sourcePath(), stored.targetPath(), stored.servers().size());
        return stored;
    }

    /**
     * Replace an existing profile, keeping its creation time.
     *
     * @param profile new definition, matched by name
     * @return the stored profile
     * @throws NotFoundException if no profile has that name
     */
    @Nonnull
    public SyncProfile updateSyncProfile(@Nonnull SyncProfile profile) {
        Objects.requireNonNull(profile, "profile");
        checkDefinition(profile);

        SyncProfile stored;
        lock.writeLock().lock();
        try {
            SyncProfile current = profiles.get(profile.name());
            if (current == null) {
                throw new NotFoundException("sync profile", profile.name());
            }
            stored = profile.withTimestamps(current.createdAt(), clock.instant());
            profiles.put(stored.name(), stored);
        } finally {
            lock.writeLock().unlock();
        }

        persist(stored);
        LOGGER.info("Updated sync profile '{}'", stored.name());
        return stored;
    }

    /**
     * Delete a profile. Its history stays.
     *
     * @throws NotFoundException if no profile has that name
     */
    public void deleteSyncProfile(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        lock.writeLock().lock();
        try {
            if (profiles.remove(name) == null) {
                throw new NotFoundException("sync profile", name);
            }
        } finally {
            lock.writeLock().unlock();
        }
        unpersist(name);
        LOGGER.info("Deleted sync profile '{}'", name);
    }

    /**
     * Get a profile by name.
     *
     * @throws NotFoundException if no profile has that name
     */
    @Nonnull
    public SyncProfile getSyncProfile(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        lock.readLock().lock();
        try {
            SyncProfile profile = profiles.get(name);
            if (profile == null) {
                throw new NotFoundException("sync profile", name);
            }
            return profile;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * List all profiles sorted by name.
     */
    @Nonnull
    public List<SyncProfile> listSyncProfiles() {
        lock.readLock().lock();
        try {
            List<SyncProfile> list = new ArrayList<>(profiles.values());
            list.sort(Comparator.comparing(SyncProfile::name));
            return list;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Check that a profile can be synced right now: the source exists and
     * every target server is registered.
     *
     * @param name profile name
     * @throws NotFoundException if no profile has that name
     * @throws ValidationException listing every problem found
     */
    public void validateProfile(@Nonnull String name) {
        SyncProfile profile = getSyncProfile(name);
        List<String> problems = new ArrayList<>();
        if (!Files.exists(Paths.get(profile.sourcePath()))) {
            problems.add("source path does not exist: " + profile.sourcePath());
        }
        for (String server : profile.servers()) {
            if (!remote.hasServer(server)) {
                problems.add("unknown server: " + server);
            }
        }
        if (!problems.isEmpty()) {
            throw new ValidationException("Sync profile '" + name + "' is invalid: " + String.join("; ", problems));
        }
    }

    // ==================== Sync ====================

    /**
     * Sync a profile to all of its servers.
     *
     * @param name profile name
     * @return the recorded event with one result per server
     * @throws NotFoundException if no profile has that name
     * @throws ValidationException if the source cannot be read
     */
    @Nonnull
    public SyncEvent syncConfiguration(@Nonnull String name) {
        SyncProfile profile = getSyncProfile(name);
        Instant started = clock.instant();
        SourceSnapshot snapshot = snapshot(profile, started, true);

        LOGGER.info("Syncing profile '{}' ({} files, {} bytes) to {} servers",
                name, snapshot.fileCount(), snapshot.totalBytes(), profile.servers().size());

        Map<String, SyncResult> results = fanOut.invokeAll(
                profile.servers(),
                server -> syncToServer(profile, snapshot, server),
                (server, error) -> SyncResult.failure(server, String.valueOf(error.getMessage()), Duration.ZERO));

        SyncEvent event = buildEvent(profile, SyncEventType.SYNC, started, results, snapshot, null);
        record(event);
        if (event.failureCount() > 0) {
            LOGGER.warn("Sync of '{}' finished with {} of {} servers failed",
                    name, event.failureCount(), results.size());
        } else {
            LOGGER.info("Sync of '{}' finished on {} servers", name, event.successCount());
        }
        return event;
    }

    /**
     * Plan a sync without touching any server. The event is not recorded.
     *
     * @param name profile name
     * @return the planned event; each known server reports the files it would receive
     * @throws NotFoundException if no profile has that name
     * @throws ValidationException if the source cannot be read
     */
    @Nonnull
    public SyncEvent dryRun(@Nonnull String name) {
        SyncProfile profile = getSyncProfile(name);
        Instant started = clock.instant();
        SourceSnapshot snapshot = snapshot(profile, started, false);

        Map<String, SyncResult> results = new LinkedHashMap<>();
        for (String server : new LinkedHashSet<>(profile.servers())) {
            if (remote.hasServer(server)) {
                results.put(server, new SyncResult(server, true, snapshot.fileCount(), 0,
                        snapshot.totalBytes(), Duration.ZERO, null, null, null));
            } else {
                results.put(server, SyncResult.failure(server, "Server not found: " + server, Duration.ZERO));
            }
        }
        LOGGER.info("Dry run of '{}': {} files, {} bytes, {} servers",
                name, snapshot.fileCount(), snapshot.totalBytes(), results.size());
        return buildEvent(profile, SyncEventType.DRY_RUN, started, results, snapshot, null);
    }

    private SourceSnapshot snapshot(SyncProfile profile, Instant started, boolean recordFailure) {
        try {
            return SourceSnapshot.capture(Paths.get(profile.sourcePath()), profile.excludes());
        } catch (IOException e) {
            String message = "Cannot read source of sync profile '" + profile.name() + "': " + e.getMessage();
            if (recordFailure) {
                record(buildEvent(profile, SyncEventType.SYNC, started, Map.of(), null, message));
            }
            throw new ValidationException(message, e);
        }
    }

    private SyncResult syncToServer(SyncProfile profile, SourceSnapshot snapshot, String server) {
        Instant started = clock.instant();
        Progress progress = new Progress();
        try {
            for (String command : profile.preCommands()) {
                runRequired(server, "pre-command", command);
            }
            if (profile.backupBefore()) {
                progress.backupPath = backup(server, profile.targetPath(), started);
            }
            transfer(server, profile, snapshot, progress);
            applyOwnership(server, profile, snapshot.directory());
            if (profile.validate()) {
                progress.checksum = validate(server, profile.targetPath(), snapshot);
            }
            for (String command : profile.postCommands()) {
                runRequired(server, "post-command", command);
            }
        } catch (RemoteException e) {
            LOGGER.warn("Sync of '{}' to '{}' failed: {}", profile.name(), server, e.getMessage());
            return progress.toResult(server, false, e.getMessage(), Duration.between(started, clock.instant()));
        }
        LOGGER.debug("Synced '{}' to '{}': {} updated, {} unchanged",
                profile.name(), server, progress.filesUpdated, progress.filesSkipped);
        return progress.toResult(server, true, null, Duration.between(started, clock.instant()));
    }

    // ==================== Steps ====================

    private void runRequired(String server, String step, String command) throws RemoteException {
        RemoteResult result = remote.executeCommand(server, command);
        if (!result.success()) {
            String reason = result.error() != null ? result.error() : "exit code " + result.exitCode();
            throw new RemoteException(server, step, step + " '" + command + "' failed: " + reason);
        }
    }

    @Nullable
    private String backup(String server, String target, Instant at) {
        String backupPath = target + ".backup." + BACKUP_FORMAT.withZone(clock.getZone()).format(at);
        String command = "[ -e " + quote(target) + " ] && cp -a " + quote(target) + " " + quote(backupPath)
                + " && echo " + BACKUP_MARKER;
        try {
            RemoteResult result = remote.executeCommand(server, command);
            if (result.output().contains(BACKUP_MARKER)) {
                return backupPath;
            }
            LOGGER.debug("No backup taken of '{}' on '{}' (exit {})", target, server, result.exitCode());
        } catch (RemoteException e) {
            LOGGER.warn("Backup of '{}' on '{}' failed: {}", target, server, e.getMessage());
        }
        return null;
    }

    private void transfer(String server, SyncProfile profile, SourceSnapshot snapshot, Progress progress)
            throws RemoteException {
        String target = profile.targetPath();
        Map<String, String> remoteDigests = remoteDigestsBestEffort(server, remotePaths(target, snapshot));

        if (!snapshot.directory()) {
            SourceSnapshot.SourceFile file = snapshot.files().get(0);
            if (file.md5().equals(remoteDigests.get(target))) {
                progress.filesSkipped++;
                return;
            }
            String temp = settings.getTempDirectory() + "/fleetward-" + UUID.randomUUID() + "-"
                    + file.path().getFileName();
            remote.uploadFile(server, file.path(), temp);
            runRequired(server, "install", "mkdir -p " + quote(parentOf(target))
                    + " && mv -f " + quote(temp) + " " + quote(target));
            progress.filesUpdated++;
            progress.bytesTransferred += file.size();
            return;
        }

        List<SourceSnapshot.SourceFile> changed = new ArrayList<>();
        Set<String> directories = new LinkedHashSet<>();
        directories.add(target);
        for (SourceSnapshot.SourceFile file : snapshot.files()) {
            String remotePath = target + "/" + file.relativePath();
            if (file.md5().equals(remoteDigests.get(remotePath))) {
                progress.filesSkipped++;
            } else {
                changed.add(file);
                directories.add(parentOf(remotePath));
            }
        }
        if (changed.isEmpty()) {
            if (snapshot.files().isEmpty()) {
                runRequired(server, "install", "mkdir -p " + quote(target));
            }
            return;
        }

        runRequired(server, "install", "mkdir -p " + joinQuoted(directories));
        List<String> moves = new ArrayList<>();
        for (SourceSnapshot.SourceFile file : changed) {
            String remotePath = target + "/" + file.relativePath();
            remote.uploadFile(server, file.path(), remotePath + TEMP_SUFFIX);
            moves.add("mv -f " + quote(remotePath + TEMP_SUFFIX) + " " + quote(remotePath));
            progress.filesUpdated++;
            progress.bytesTransferred += file.size();
        }
        runRequired(server, "install", String.join(" && ", moves));
    }

    private void applyOwnership(String server, SyncProfile profile, boolean directory) {
        String recursive = directory ? "-R " : "";
        String target = quote(profile.targetPath());
        if (profile.permissions() != null) {
            runBestEffort(server, "chmod " + recursive + profile.permissions() + " " + target);
        }
        if (profile.owner() != null) {
            String owner = profile.group() != null ? profile.owner() + ":" + profile.group() : profile.owner();
            runBestEffort(server, "chown " + recursive + quote(owner) + " " + target);
        } else if (profile.group() != null) {
            runBestEffort(server, "chgrp " + recursive + quote(profile.group()) + " " + target);
        }
    }

    private void runBestEffort(String server, String command) {
        try {
            RemoteResult result = remote.executeCommand(server, command);
            if (!result.success()) {
                LOGGER.warn("'{}' on '{}' failed with exit code {}", command, server, result.exitCode());
            }
        } catch (RemoteException e) {
            LOGGER.warn("'{}' on '{}' failed: {}", command, server, e.getMessage());
        }
    }

    private String validate(String server, String target, SourceSnapshot snapshot) throws RemoteException {
        List<String> paths = remotePaths(target, snapshot);
        Map<String, String> digests = remoteDigests(server, paths);

        List<String> ordered = new ArrayList<>(paths.size());
        for (String path : paths) {
            String digest = digests.get(path);
            if (digest == null) {
                throw new ChecksumMismatchException(server, path, snapshot.checksum(), "missing");
            }
            ordered.add(digest);
        }
        String actual = snapshot.directory() ? SourceSnapshot.combine(ordered) : ordered.get(0);
        if (!actual.equals(snapshot.checksum())) {
            throw new ChecksumMismatchException(server, target, snapshot.checksum(), actual);
        }
        return actual;
    }

    // ==================== Remote digests ====================

    private Map<String, String> remoteDigestsBestEffort(String server, List<String> paths) throws RemoteException {
        try {
            return remoteDigests(server, paths);
        } catch (RemoteException e) {
            if (e instanceof NetworkException) {
                throw e;
            }
            LOGGER.debug("Could not read remote digests on '{}': {}", server, e.getMessage());
            return Map.of();
        }
    }

    private Map<String, String> remoteDigests(String server, List<String> paths) throws RemoteException {
        if (paths.isEmpty()) {
            return Map.of();
        }
        RemoteResult result = remote.executeCommand(server,
                "md5sum -- " + joinQuoted(paths) + " 2>/dev/null < /dev/null");
        if (result.timedOut()) {
            throw new RemoteException(server, "checksum", "md5sum timed out");
        }
        return parseDigests(result.output());
    }

    /**
     * Parse {@code md5sum} output into digests keyed by path. A leading
     * backslash marks a line whose file name has {@code \\} and {@code \n}
     * escapes.
     */
    static Map<String, String> parseDigests(String output) {
        Map<String, String> digests = new HashMap<>();
        for (String line : output.split("\\R")) {
            Matcher matcher = MD5_LINE.matcher(line);
            if (matcher.matches()) {
                String path = matcher.group(1) != null ? unescape(matcher.group(3)) : matcher.group(3);
                digests.put(path, matcher.group(2));
            }
        }
        return digests;
    }

    private static String unescape(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '\\' && i + 1 < name.length()) {
                char next = name.charAt(++i);
                sb.append(next == 'n' ? '\n' : next);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static List<String> remotePaths(String target, SourceSnapshot snapshot) {
        if (!snapshot.directory()) {
            return List.of(target);
        }
        List<String> paths = new ArrayList<>(snapshot.fileCount());
        for (SourceSnapshot.SourceFile file : snapshot.files()) {
            paths.add(target + "/" + file.relativePath());
        }
        return paths;
    }

    private static String parentOf(String remotePath) {
        int slash = remotePath.lastIndexOf('/');
        if (slash < 0) {
            return ".";
        }
        return slash == 0 ? "/" : remotePath.substring(0, slash);
    }

    private static String joinQuoted(Iterable<String> values) {
        StringBuilder sb = new StringBuilder();
        for (String value : values) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(quote(value));
        }
        return sb.toString();
    }

    // ==================== History ====================

    private SyncEvent buildEvent(
            SyncProfile profile,
            SyncEventType type,
            Instant started,
            Map<String, SyncResult> results,
            @Nullable SourceSnapshot snapshot,
            @Nullable String error) {
        int success = 0;
        for (SyncResult result : results.values()) {
            if (result.success()) {
                success++;
            }
        }
        return new SyncEvent(
                profile.name(),
                type,
                started,
                profile.servers(),
                results,
                success,
                results.size() - success,
                snapshot != null ? snapshot.fileCount() : 0,
                snapshot != null ? snapshot.totalBytes() : 0,
                snapshot != null ? snapshot.checksum() : null,
                Duration.between(started, clock.instant()),
                error);
    }

    private void record(SyncEvent event) {
        lock.writeLock().lock();
        try {
            history.addLast(event);
            while (history.size() > Math.max(1, settings.getMaxHistory())) {
                history.removeFirst();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Get all retained sync events, oldest first.
     */
    @Nonnull
    public List<SyncEvent> getSyncHistory() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(history);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get the retained sync events of one profile, oldest first.
     */
    @Nonnull
    public List<SyncEvent> getSyncHistory(@Nonnull String profileName) {
        Objects.requireNonNull(profileName, "profileName");
        lock.readLock().lock();
        try {
            List<SyncEvent> events = new ArrayList<>();
            for (SyncEvent event : history) {
                if (event.profileName().equals(profileName)) {
                    events.add(event);
                }
            }
            return events;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Summarize profiles and retained history.
     */
    @Nonnull
    public SyncStats getSyncStats() {
        lock.readLock().lock();
        try {
            Set<String> servers = new HashSet<>();
            for (SyncProfile profile : profiles.values()) {
                servers.addAll(profile.servers());
            }
            int successful = 0;
            for (SyncEvent event : history) {
                if (event.isSuccessful()) {
                    successful++;
                }
            }
            Instant lastSync = history.isEmpty() ? null : history.peekLast().timestamp();
            return new SyncStats(profiles.size(), servers.size(), history.size(),
                    successful, history.size() - successful, lastSync);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Persistence ====================

    /**
     * Restore persisted profiles. Profiles already defined are kept.
     *
     * @return number of profiles restored
     * @throws IOException if the store cannot be read
     */
    public int loadPersisted() throws IOException {
        if (store == null) {
            return 0;
        }
        int restored = 0;
        lock.writeLock().lock();
        try {
            for (SyncProfile profile : store.loadAll()) {
                if (profile.name().isBlank() || profile.servers().isEmpty()) {
                    LOGGER.warn("Ignoring invalid persisted sync profile '{}'", profile.name());
                    continue;
                }
                if (profiles.putIfAbsent(profile.name(), profile) == null) {
                    restored++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return restored;
    }

    private void persist(SyncProfile profile) {
        if (store == null) {
            return;
        }
        try {
            store.save(profile.name(), profile);
        } catch (IOException e) {
            LOGGER.warn("Failed to persist sync profile '{}': {}", profile.name(), e.getMessage());
        }
    }

    private void unpersist(String name) {
        if (store == null) {
            return;
        }
        try {
            store.delete(name);
        } catch (IOException e) {
            LOGGER.warn("Failed to delete persisted sync profile '{}': {}", name, e.getMessage());
        }
    }

    private static void checkDefinition(SyncProfile profile) {
        if (profile.name().isBlank()) {
            throw new ValidationException("Sync profile name is required");
        }
        if (profile.sourcePath().isBlank()) {
            throw new ValidationException("Sync profile source path is required: " + profile.name());
        }
        if (profile.targetPath().isBlank()) {
            throw new ValidationException("Sync profile target path is required: " + profile.name());
        }
        if (profile.servers().isEmpty()) {
            throw new ValidationException("Sync profile must have at least one server: " + profile.name());
        }
        if (profile.permissions() != null && !PERMISSIONS.matcher(profile.permissions()).matches()) {
            throw new ValidationException("Invalid permissions '" + profile.permissions()
                    + "' in sync profile " + profile.name());
        }
    }

    private static final class Progress {
        int filesUpdated;
        int filesSkipped;
        long bytesTransferred;
        String backupPath;
        String checksum;

        SyncResult toResult(String server, boolean success, @Nullable String error, Duration duration) {
            return new SyncResult(server, success, filesUpdated, filesSkipped, bytesTransferred,
                    duration, error, backupPath, checksum);
        }
    }
}
