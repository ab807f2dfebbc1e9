package com.deepansh.explorer.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Key/value cache with per-entry TTL, LRU eviction and optional write-through persistence.
 *
 * Design decisions:
 * - Expiry is lazy: {@link #get} drops an expired entry before answering and
 *   {@link #set} sweeps all expired entries before inserting. No background thread.
 * - LRU order is kept by an access-ordered LinkedHashMap, so ties in timestamps
 *   never make eviction ambiguous.
 * - Persistence: one JSON file per entry, named by the MD5 of the key. Loaded back on
 *   construction; expired and unreadable files are deleted.
 *
 * Not thread-safe. Each agent owns its own cache and its own directory.
 */
@Slf4j
public class ResultCache {

    private static final String FILE_SUFFIX = ".json";

    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final int maxSize;
    private final long ttlMs;
    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ResultCache(int maxSize, Duration ttl) {
        this(maxSize, ttl, null, new ObjectMapper(), Clock.systemUTC());
    }

    public ResultCache(int maxSize, Duration ttl, Path directory, ObjectMapper objectMapper) {
        this(maxSize, ttl, directory, objectMapper, Clock.systemUTC());
    }

    public ResultCache(int maxSize, Duration ttl, Path directory, ObjectMapper objectMapper, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.maxSize = maxSize;
        this.ttlMs = ttl.toMillis();
        this.directory = directory;
        this.objectMapper = objectMapper;
        this.clock = clock;

        if (directory != null) {
            loadPersistedEntries();
        }
    }

    /**
     * Returns the value if present and not expired, refreshing its access time.
     */
    public Optional<Object> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }

        long now = clock.millis();
        if (entry.isExpired(now, ttlMs)) {
            remove(key);
            log.debug("Cache entry expired [key={}]", key);
            return Optional.empty();
        }

        entry.setLastAccessAt(now);
        return Optional.ofNullable(entry.getValue());
    }

    public void set(String key, Object value) {
        long now = clock.millis();

        removeExpired(now);
        // replacing an existing key never needs an eviction
        if (!entries.containsKey(key) && entries.size() >= maxSize) {
            evictLeastRecentlyUsed();
        }

        CacheEntry entry = new CacheEntry(key, value, now, now);
        entries.put(key, entry);

        if (directory != null) {
            persist(entry);
        }
    }

    public void clear() {
        entries.clear();
        if (directory == null || !Files.isDirectory(directory)) {
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                Files.deleteIfExists(file);
            }
            log.info("Cleared persistent cache [dir={}]", directory);
        } catch (IOException e) {
            log.warn("Failed to clear persistent cache [dir={}]: {}", directory, e.getMessage());
        }
    }

    /** Number of physically held entries, including ones that have expired but not been purged. */
    public int size() {
        return entries.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    private void removeExpired(long now) {
        List<String> expired = new ArrayList<>();
        for (CacheEntry entry : entries.values()) {
            if (entry.isExpired(now, ttlMs)) {
                expired.add(entry.getKey());
            }
        }
        expired.forEach(this::remove);
    }

    private void evictLeastRecentlyUsed() {
        Iterator<String> eldest = entries.keySet().iterator();
        if (eldest.hasNext()) {
            String key = eldest.next();
            remove(key);
            log.debug("Evicted LRU cache entry [key={}]", key);
        }
    }

    private void remove(String key) {
        entries.remove(key);
        if (directory != null) {
            try {
                Files.deleteIfExists(fileFor(key));
            } catch (IOException e) {
                log.warn("Failed to delete cache file for key={}: {}", key, e.getMessage());
            }
        }
    }

    private void persist(CacheEntry entry) {
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(fileFor(entry.getKey()).toFile(), entry);
        } catch (IOException e) {
            // Memory copy is still valid, persistence is best-effort
            log.warn("Failed to persist cache entry [key={}]: {}", entry.getKey(), e.getMessage());
        }
    }

    private void loadPersistedEntries() {
        if (!Files.isDirectory(directory)) {
            return;
        }

        long now = clock.millis();
        List<CacheEntry> loaded = new ArrayList<>();

        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                CacheEntry entry = readEntry(file);
                if (entry == null || entry.getKey() == null) {
                    deleteQuietly(file, "corrupted");
                } else if (entry.isExpired(now, ttlMs)) {
                    deleteQuietly(file, "expired");
                } else {
                    loaded.add(entry);
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan persistent cache [dir={}]: {}", directory, e.getMessage());
            return;
        }

        // re-insert oldest access first so the LRU order survives the restart
        loaded.sort(Comparator.comparingLong(CacheEntry::getLastAccessAt));
        for (CacheEntry entry : loaded) {
            if (entries.size() >= maxSize) {
                evictLeastRecentlyUsed();
            }
            entries.put(entry.getKey(), entry);
        }
        log.info("Loaded {} cache entries from {}", entries.size(), directory);
    }

    private CacheEntry readEntry(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), CacheEntry.class);
        } catch (IOException e) {
            log.debug("Unreadable cache file {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    private void deleteQuietly(Path file, String why) {
        try {
            Files.deleteIfExists(file);
            log.debug("Deleted {} cache file {}", why, file.getFileName());
        } catch (IOException e) {
            log.warn("Failed to delete {} cache file {}: {}", why, file.getFileName(), e.getMessage());
        }
    }

    private Path fileFor(String key) {
        return directory.resolve(DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8)) + FILE_SUFFIX);
    }
}
