package com.platform.releasecontroller.manager;

import com.platform.releasecontroller.model.LiveResource;
import com.platform.releasecontroller.model.RenderedResource;

import java.util.List;

/**
 * Applies rendered resources to the target environment.
 */
public interface ResourceClient {
    
    /**
     * Create or replace a resource.
     * 
     * @param owner key of the owning release
     * @return true if the live state changed
     */
    boolean apply(String namespace, String owner, RenderedResource resource);
    
    /**
     * @return true if something was deleted
     */
    boolean delete(String namespace, String kind, String name);
    
    List<LiveResource> listByOwner(String owner);
    
    List<LiveResource> listAll();
}
