package com.deepansh.explorer.repo;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Repository backed by a local directory.
 *
 * Security model:
 * - All reads are sandboxed to the root directory
 * - Path traversal prevention: the normalized path must stay under the root
 * - Reads are capped at max-file-size to keep tool results bounded
 * - No symlink following
 *
 * Build output and VCS directories are skipped while walking.
 */
@Slf4j
public class LocalCodeRepository implements CodeRepository {

    private static final Set<String> EXCLUDED_DIRECTORIES = Set.of(
            ".git", ".svn", ".hg", ".idea", ".vscode", "node_modules", "target", "build",
            "dist", "__pycache__", ".venv", "venv", ".gradle", ".mvn");

    private static final long DEFAULT_MAX_FILE_BYTES = 1024 * 1024;

    private final Path root;
    private final long maxFileBytes;

    public LocalCodeRepository(Path root) {
        this(root, DEFAULT_MAX_FILE_BYTES);
    }

    public LocalCodeRepository(Path root, long maxFileBytes) {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Repository root is not a directory: " + root);
        }
        this.root = root.toAbsolutePath().normalize();
        this.maxFileBytes = maxFileBytes;
    }

    @Override
    public String getName() {
        return root.toString();
    }

    @Override
    public List<RepositoryFile> walk() throws IOException {
        List<RepositoryFile> files = new ArrayList<>();

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                if (EXCLUDED_DIRECTORIES.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                files.add(new RepositoryFile(relativize(dir), true, 0));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    files.add(new RepositoryFile(relativize(file), false, attrs.size()));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.debug("Skipping unreadable path {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        return files;
    }

    @Override
    public String readFile(String path) throws IOException {
        Path resolved = resolveSafePath(path);
        if (!Files.isRegularFile(resolved, LinkOption.NOFOLLOW_LINKS)) {
            throw new NoSuchFileException(path);
        }

        long size = Files.size(resolved);
        if (size > maxFileBytes) {
            throw new IOException(String.format(
                    "File too large (%d KB). Max allowed: %d KB", size / 1024, maxFileBytes / 1024));
        }
        return Files.readString(resolved, StandardCharsets.UTF_8);
    }

    @Override
    public boolean exists(String path) {
        try {
            return Files.exists(resolveSafePath(path), LinkOption.NOFOLLOW_LINKS);
        } catch (SecurityException e) {
            return false;
        }
    }

    /**
     * Resolves a repository-relative path under the root.
     * Throws SecurityException if the path escapes the root (traversal prevention).
     */
    private Path resolveSafePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new SecurityException("Path traversal attempt detected: '" + path + "'");
        }
        return resolved;
    }

    private String relativize(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
