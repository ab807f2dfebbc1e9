package com.deepansh.explorer.cache;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A cached value with its timestamps (epoch millis).
 * Also the JSON shape of a persisted cache file; the key is stored so
 * entries survive a reload even though the file name is only its hash.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    private String key;
    private Object value;
    private long createdAt;
    private long lastAccessAt;

    boolean isExpired(long now, long ttlMs) {
        return now - createdAt > ttlMs;
    }
}
