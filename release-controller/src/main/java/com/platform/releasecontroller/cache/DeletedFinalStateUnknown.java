package com.platform.releasecontroller.cache;

import com.platform.releasecontroller.model.Release;

/**
 * Tombstone delivered on delete when the watcher missed the actual deletion.
 * 
 * @param key last known key of the release
 * @param obj last known state, possibly stale
 */
public record DeletedFinalStateUnknown(String key, Release obj) {}
