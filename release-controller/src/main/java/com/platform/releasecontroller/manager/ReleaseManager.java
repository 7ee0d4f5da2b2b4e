package com.platform.releasecontroller.manager;

import com.platform.releasecontroller.error.ConvergenceException;
import com.platform.releasecontroller.model.Release;

/**
 * Performs the actual create, update, rollback and delete work for releases.
 * 
 * Every operation is idempotent: calling it again on unchanged input has no
 * further externally visible effect.
 */
public interface ReleaseManager {
    
    /**
     * Converge live state toward the release's desired spec. On success the release
     * carries a single Available condition.
     * 
     * @throws ConvergenceException if convergence could not complete during this
     *         attempt; a Failure condition has been recorded when the release still exists
     */
    void trigger(Release release);
    
    /**
     * Tear down everything owned by a release that no longer exists.
     * Succeeds when there is nothing to delete.
     * 
     * @throws ConvergenceException if live resources could not be removed
     */
    void delete(String namespace, String name);
    
    /**
     * Repair state left behind by an unclean shutdown, such as resources whose
     * release was deleted mid-operation. Cheap when there is nothing to repair.
     * 
     * @return number of orphaned objects removed
     */
    int run();
}
