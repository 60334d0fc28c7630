package com.tracepile.store.cache;

import java.util.Map;

/**
 * On-disk content of one cache shard: all cached files of one directory.
 */
public record CacheShard(
    int version,
    Map<String, CachedFile> entries    // absolute path -> metadata
) {
}
