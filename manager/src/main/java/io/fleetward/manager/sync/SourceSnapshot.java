package io.fleetward.manager.sync;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.charset.StandardCharsets;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Stream;

/**
 * Fingerprint of a sync source taken once per sync.
 *
 * <p>A single file's checksum is its MD5. A directory's checksum is the MD5 of
 * its files' hex digests concatenated in sorted relative-path order, after
 * excludes are applied. Remote validation combines digests the same way.</p>
 *
 * @param root source path
 * @param directory whether the source is a directory
 * @param files files to transfer, sorted by relative path
 * @param checksum combined fingerprint
 * @param totalBytes sum of file sizes
 */
public record SourceSnapshot(
        @Nonnull Path root,
        boolean directory,
        @Nonnull List<SourceFile> files,
        @Nonnull String checksum,
        long totalBytes
) {

    private static final HexFormat HEX = HexFormat.of();

    public SourceSnapshot {
        files = List.copyOf(files);
    }

    /**
     * One file of the source.
     *
     * @param path local path
     * @param relativePath path below the source root using '/' separators, empty for a single-file source
     * @param size file size in bytes
     * @param md5 hex MD5 digest
     */
    public record SourceFile(@Nonnull Path path, @Nonnull String relativePath, long size, @Nonnull String md5) {}

    /**
     * Number of files in the snapshot.
     */
    public int fileCount() {
        return files.size();
    }

    /**
     * Capture a snapshot of a local file or directory.
     *
     * @param source local path
     * @param excludes glob patterns matched against relative paths and file names
     * @return the snapshot
     * @throws IOException if the source does not exist or cannot be read
     */
    @Nonnull
    public static SourceSnapshot capture(@Nonnull Path source, @Nonnull List<String> excludes) throws IOException {
        if (!Files.exists(source)) {
            throw new IOException("Source path does not exist: " + source);
        }
        if (!Files.isDirectory(source)) {
            String md5 = digestFile(source);
            long size = Files.size(source);
            return new SourceSnapshot(source, false, List.of(new SourceFile(source, "", size, md5)), md5, size);
        }

        List<PathMatcher> matchers = compile(source.getFileSystem(), excludes);
        List<SourceFile> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(source)) {
            for (Path path : (Iterable<Path>) walk::iterator) {
                if (!Files.isRegularFile(path)) {
                    continue;
                }
                Path relative = source.relativize(path);
                if (isExcluded(relative, matchers)) {
                    continue;
                }
                files.add(new SourceFile(path, toUnixPath(relative), Files.size(path), digestFile(path)));
            }
        }
        files.sort(Comparator.comparing(SourceFile::relativePath));

        List<String> digests = new ArrayList<>(files.size());
        long totalBytes = 0;
        for (SourceFile file : files) {
            digests.add(file.md5());
            totalBytes += file.size();
        }
        return new SourceSnapshot(source, true, files, combine(digests), totalBytes);
    }

    /**
     * Combine per-file hex digests into a directory fingerprint.
     *
     * @param digests hex digests in sorted relative-path order
     * @return hex MD5 of the concatenated digests
     */
    @Nonnull
    public static String combine(@Nonnull List<String> digests) {
        MessageDigest md = newDigest();
        for (String digest : digests) {
            md.update(digest.getBytes(StandardCharsets.US_ASCII));
        }
        return HEX.formatHex(md.digest());
    }

    static String digestFile(Path path) throws IOException {
        MessageDigest md = newDigest();
        try (InputStream in = new DigestInputStream(Files.newInputStream(path), md)) {
            in.transferTo(OutputStream.nullOutputStream());
        }
        return HEX.formatHex(md.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static List<PathMatcher> compile(FileSystem fs, List<String> excludes) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : excludes) {
            if (pattern != null && !pattern.isBlank()) {
                matchers.add(fs.getPathMatcher("glob:" + pattern));
            }
        }
        return matchers;
    }

    private static boolean isExcluded(Path relative, List<PathMatcher> matchers) {
        Path fileName = relative.getFileName();
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(relative) || (fileName != null && matcher.matches(fileName))) {
                return true;
            }
        }
        // a file below an excluded directory is excluded too
        for (Path parent = relative.getParent(); parent != null; parent = parent.getParent()) {
            Path name = parent.getFileName();
            for (PathMatcher matcher : matchers) {
                if (matcher.matches(parent) || (name != null && matcher.matches(name))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String toUnixPath(Path relative) {
        return relative.toString().replace(relative.getFileSystem().getSeparator(), "/");
    }
}
