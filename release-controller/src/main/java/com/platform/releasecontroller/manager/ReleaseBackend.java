package com.platform.releasecontroller.manager;

import com.platform.releasecontroller.cache.ReleaseKey;
import com.platform.releasecontroller.error.BackendException;
import com.platform.releasecontroller.model.Release;
import com.platform.releasecontroller.model.ReleaseHistory;

import java.util.List;
import java.util.Set;

/**
 * Persistent store of releases and release histories.
 * 
 * Writes carry the caller's {@code resourceVersion}; a stale version is rejected with
 * {@link BackendException#conflict}, a missing release with {@link BackendException#notFound}.
 */
public interface ReleaseBackend {
    
    /**
     * Persist the status of a release. The spec of the argument is ignored.
     * 
     * @return the stored copy with its new resourceVersion
     */
    Release updateStatus(Release release);
    
    /**
     * Persist spec and status. A changed spec increments the generation.
     * 
     * @return the stored copy
     */
    Release update(Release release);
    
    boolean exists(ReleaseKey key);
    
    Set<ReleaseKey> listKeys();
    
    /**
     * Histories of a release ordered by version.
     */
    List<ReleaseHistory> listHistories(String namespace, String name);
    
    /**
     * Store a history, replacing an existing one with the same version.
     */
    ReleaseHistory createHistory(ReleaseHistory history);
    
    /**
     * @return number of histories removed
     */
    int deleteHistories(String namespace, String name);
    
    Set<ReleaseKey> listHistoryOwners();
}
