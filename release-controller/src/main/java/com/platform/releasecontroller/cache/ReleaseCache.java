package com.platform.releasecontroller.cache;

import com.platform.releasecontroller.error.LookupException;
import com.platform.releasecontroller.model.Release;

import java.util.Optional;

/**
 * Eventually consistent local view of releases.
 */
public interface ReleaseCache {
    
    /**
     * Whether the initial listing has been delivered.
     */
    boolean hasSynced();
    
    /**
     * Look up a release. The returned object is a copy owned by the caller.
     * 
     * @return the release, or empty if it does not exist
     * @throws LookupException if the cache could not be read
     */
    Optional<Release> lookup(String namespace, String name);
    
    void addEventHandler(ReleaseEventHandler handler);
    
    void removeEventHandler(ReleaseEventHandler handler);
}
