package com.platform.releasecontroller.cache;

import com.platform.releasecontroller.model.Release;

/**
 * Receives release change notifications from the cache.
 */
public interface ReleaseEventHandler {
    
    void onAdd(Release release);
    
    void onUpdate(Release oldRelease, Release newRelease);
    
    /**
     * @param obj the deleted {@link Release}, or a {@link DeletedFinalStateUnknown}
     */
    void onDelete(Object obj);
}
